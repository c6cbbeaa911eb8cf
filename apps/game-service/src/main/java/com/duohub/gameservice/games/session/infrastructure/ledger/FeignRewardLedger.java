package com.duohub.gameservice.games.session.infrastructure.ledger;

import com.duohub.gameservice.games.session.domain.repository.RewardLedger;
import com.duohub.gameservice.infrastructure.client.ledger.AwardReceipt;
import com.duohub.gameservice.infrastructure.client.ledger.AwardRequest;
import com.duohub.gameservice.infrastructure.client.ledger.BadgeRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 账本客户端：在同步线程池上异步调用网关，调用方不等待结果。
 */
public class FeignRewardLedger implements RewardLedger {

    private final RewardLedgerGateway gateway;
    private final Executor executor;

    public FeignRewardLedger(RewardLedgerGateway gateway, Executor executor) {
        this.gateway = gateway;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Boolean> awardOnce(String sessionId, String tierKey, int amount, String reason) {
        String key = RewardLedger.idempotencyKey(sessionId, tierKey);
        AwardRequest request = new AwardRequest(sessionId, tierKey, amount, reason, key);
        return CompletableFuture.supplyAsync(() -> gateway.award(request), executor)
                .thenApply(AwardReceipt::settled);
    }

    @Override
    public CompletableFuture<Boolean> awardBadgeOnce(String sessionId, String badgeKey) {
        String key = RewardLedger.idempotencyKey(sessionId, "badge:" + badgeKey);
        BadgeRequest request = new BadgeRequest(sessionId, badgeKey, key);
        return CompletableFuture.supplyAsync(() -> gateway.awardBadge(request), executor)
                .thenApply(AwardReceipt::settled);
    }
}
