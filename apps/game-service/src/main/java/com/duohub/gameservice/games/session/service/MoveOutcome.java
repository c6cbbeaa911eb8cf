package com.duohub.gameservice.games.session.service;

import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;

import java.util.List;

/**
 * 走子结果。
 *
 * @param session       走子后的会话视图（拒绝/重复时为当前视图）
 * @param reason        REJECTED 时的原因码
 * @param grantedTiers  本次新记账的奖励 tierKey
 */
public record MoveOutcome(Result result, GameSession session, RejectReason reason, List<String> grantedTiers) {

    public enum Result { ACCEPTED, COMPLETED, REJECTED, DUPLICATE }

    public static MoveOutcome accepted(GameSession session, List<String> tiers) {
        return new MoveOutcome(Result.ACCEPTED, session, null, List.copyOf(tiers));
    }

    public static MoveOutcome completed(GameSession session, List<String> tiers) {
        return new MoveOutcome(Result.COMPLETED, session, null, List.copyOf(tiers));
    }

    public static MoveOutcome rejected(GameSession session, RejectReason reason, List<String> tiers) {
        return new MoveOutcome(Result.REJECTED, session, reason, List.copyOf(tiers));
    }

    public static MoveOutcome duplicate(GameSession session) {
        return new MoveOutcome(Result.DUPLICATE, session, null, List.of());
    }
}
