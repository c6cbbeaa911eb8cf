package com.duohub.gameservice.games.session.infrastructure.notify;

import com.duohub.partnernotifier.PartnerNotifier;
import com.duohub.partnernotifier.event.PartnerNotification;
import lombok.extern.slf4j.Slf4j;

/**
 * 未配置 Kafka 时的通知实现：只记日志，对方设备靠轮询发现变化。
 */
@Slf4j
public class LoggingPartnerNotifier implements PartnerNotifier {

    @Override
    public void notifyPartner(PartnerNotification notification) {
        log.info("伴侣通知（未启用推送）: type={}, to={}, sessionId={}, summary={}",
                notification.getType(), notification.getRecipientId(), notification.getSessionId(),
                notification.getSummary());
    }
}
