package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.repository.RewardLedger;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 奖励发放：先记到会话的 rewardsIssued（同一 tierKey 只记一次），
 * 会话提交后再异步调用账本。账本失败不回滚记账，由账本侧幂等键兜底补发。
 */
@Slf4j
public class RewardIssuer {

    public record Grant(String tierKey, int amount, String reason, String badge) {
    }

    private final RewardLedger ledger;

    public RewardIssuer(RewardLedger ledger) {
        this.ledger = ledger;
    }

    public Optional<Grant> record(GameSession session, String tierKey, int amount, String reason) {
        if (session.getRewardsIssued().containsKey(tierKey)) {
            log.debug("奖励已记账，跳过: sessionId={}, tierKey={}", session.getId(), tierKey);
            return Optional.empty();
        }
        session.getRewardsIssued().put(tierKey, amount);
        return Optional.of(new Grant(tierKey, amount, reason, null));
    }

    public Optional<Grant> recordBadge(GameSession session, String badge) {
        String tierKey = "badge:" + badge;
        if (session.getRewardsIssued().containsKey(tierKey)) {
            return Optional.empty();
        }
        session.getRewardsIssued().put(tierKey, 0);
        return Optional.of(new Grant(tierKey, 0, null, badge));
    }

    public void dispatch(String sessionId, List<Grant> grants) {
        for (Grant g : grants) {
            CompletableFuture<Boolean> call;
            try {
                call = g.badge() != null
                        ? ledger.awardBadgeOnce(sessionId, g.badge())
                        : ledger.awardOnce(sessionId, g.tierKey(), g.amount(), g.reason());
            } catch (Exception e) {
                log.warn("调用积分账本失败: sessionId={}, tierKey={}, err={}", sessionId, g.tierKey(), e.toString());
                continue;
            }
            call.whenComplete((ok, ex) -> {
                if (ex != null) {
                    log.warn("积分账本调用异常: sessionId={}, tierKey={}, err={}", sessionId, g.tierKey(), ex.toString());
                } else if (!Boolean.TRUE.equals(ok)) {
                    log.warn("积分账本未确认: sessionId={}, tierKey={}", sessionId, g.tierKey());
                } else {
                    log.debug("积分已发放: sessionId={}, tierKey={}, amount={}", sessionId, g.tierKey(), g.amount());
                }
            });
        }
    }
}
