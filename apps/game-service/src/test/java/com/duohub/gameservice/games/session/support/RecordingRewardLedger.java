package com.duohub.gameservice.games.session.support;

import com.duohub.gameservice.games.session.domain.repository.RewardLedger;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录每一次账本调用（不去重），方便断言"只发一次"。
 */
public class RecordingRewardLedger implements RewardLedger {

    public record Award(String sessionId, String tierKey, int amount) {
    }

    public final List<Award> awards = new CopyOnWriteArrayList<>();
    public final List<String> badges = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Boolean> awardOnce(String sessionId, String tierKey, int amount, String reason) {
        awards.add(new Award(sessionId, tierKey, amount));
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public CompletableFuture<Boolean> awardBadgeOnce(String sessionId, String badgeKey) {
        badges.add(sessionId + ":" + badgeKey);
        return CompletableFuture.completedFuture(true);
    }

    public int total() {
        return awards.stream().mapToInt(Award::amount).sum();
    }
}
