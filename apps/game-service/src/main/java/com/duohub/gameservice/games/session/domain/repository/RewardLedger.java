package com.duohub.gameservice.games.session.domain.repository;

import java.util.concurrent.CompletableFuture;

/**
 * 积分账本：外部发放接口。调用方已用 rewardsIssued 去重，
 * 这里仍把 {sessionId}:{tierKey} 作为幂等键交给账本再去重一次。
 */
public interface RewardLedger {

    CompletableFuture<Boolean> awardOnce(String sessionId, String tierKey, int amount, String reason);

    CompletableFuture<Boolean> awardBadgeOnce(String sessionId, String badgeKey);

    static String idempotencyKey(String sessionId, String tierKey) {
        return sessionId + ":" + tierKey;
    }
}
