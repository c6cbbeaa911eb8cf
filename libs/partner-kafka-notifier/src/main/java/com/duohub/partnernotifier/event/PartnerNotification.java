package com.duohub.partnernotifier.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 伴侣通知事件。
 *
 * 一方设备在会话上产生变化（新建 / 走子 / 让出回合 / 完成）后，
 * 通过 Kafka 投递给推送服务，由推送服务唤醒另一方设备去拉取最新会话。
 * 事件只携带定位信息与文案摘要，不携带会话快照本身。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PartnerNotification {

    /** 通知类型 */
    private Type type;

    /** 情侣键（两个参与者ID排序后以 _ 拼接） */
    private String pairKey;

    /** 会话ID */
    private String sessionId;

    /** 游戏种类线上名：ladder / quiz / memory-flip */
    private String kind;

    /** 触发方参与者ID */
    private String senderId;

    /** 接收方参与者ID（Kafka 消息 key） */
    private String recipientId;

    /** 展示用摘要，例如当前单词、匹配率 */
    private String summary;

    /** 事件时间（毫秒） */
    private Long timestamp;

    public enum Type {
        /** 新会话已创建 */
        SESSION_CREATED,
        /** 对方已走子 */
        MOVE_MADE,
        /** 对方让出回合 */
        YIELDED,
        /** 会话已完成 */
        COMPLETED
    }

    public static PartnerNotification of(Type type, String pairKey, String sessionId, String kind,
                                         String senderId, String recipientId, String summary) {
        return new PartnerNotification(type, pairKey, sessionId, kind, senderId, recipientId, summary,
                Instant.now().toEpochMilli());
    }
}
