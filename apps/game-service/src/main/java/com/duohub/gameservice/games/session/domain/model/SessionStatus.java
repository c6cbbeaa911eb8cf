package com.duohub.gameservice.games.session.domain.model;

/**
 * 会话状态：
 *   ACTIVE → (ACTIVE | YIELDED) → COMPLETED
 *   ACTIVE/YIELDED → EXPIRED（访问时惰性判定，不跑后台定时器）
 * YIELDED 只出现在单词阶梯，属于 ACTIVE 的子状态，下一步合法走子后自动清除。
 */
public enum SessionStatus {
    ACTIVE,
    YIELDED,
    COMPLETED,
    EXPIRED;

    /** 还能走子 */
    public boolean playable() {
        return this == ACTIVE || this == YIELDED;
    }

    /** 终态：除奖励记账外不可再变 */
    public boolean terminal() {
        return this == COMPLETED || this == EXPIRED;
    }
}
