package com.duohub.partnernotifier;

import com.duohub.partnernotifier.event.PartnerNotification;

/**
 * 伴侣通知投递接口（发后即忘）。
 *
 * 实现方必须保证：
 *  - 不抛出异常（失败只记日志）；
 *  - 不阻塞调用线程等待投递结果；
 *  - 不做同步重试。
 */
public interface PartnerNotifier {

    void notifyPartner(PartnerNotification notification);
}
