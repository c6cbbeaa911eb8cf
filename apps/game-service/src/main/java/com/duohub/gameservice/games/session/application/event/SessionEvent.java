package com.duohub.gameservice.games.session.application.event;

import com.duohub.gameservice.games.session.domain.model.GameSession;

/**
 * 会话事件：展示层（STOMP / 本地 UI）据此刷新。
 *
 * @param actor 触发者；远端同步引起的事件为 null
 */
public record SessionEvent(Type type, GameSession session, String actor, long at) {

    public enum Type {
        CREATED,
        MOVE_APPLIED,
        YIELDED,
        COMPLETED,
        EXPIRED,
        /** 远端快照覆盖了本地（含丢弃本地推测状态） */
        REFRESHED,
        /** 仲裁落败，已删除 */
        DISCARDED
    }
}
