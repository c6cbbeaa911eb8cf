package com.duohub.gameservice.games.session.infrastructure.ledger;

import com.duohub.gameservice.infrastructure.client.ledger.AwardReceipt;
import com.duohub.gameservice.infrastructure.client.ledger.AwardRequest;
import com.duohub.gameservice.infrastructure.client.ledger.BadgeRequest;
import com.duohub.gameservice.infrastructure.client.ledger.RewardLedgerClient;
import com.duohub.web.common.ApiResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 积分账本网关：同步 Feign 调用 + 熔断，失败回执为未入账。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardLedgerGateway {

    private final RewardLedgerClient client;

    @CircuitBreaker(name = "rewardLedger", fallbackMethod = "awardFallback")
    public AwardReceipt award(AwardRequest request) {
        return receipt(client.award(request), request.idempotencyKey());
    }

    @CircuitBreaker(name = "rewardLedger", fallbackMethod = "badgeFallback")
    public AwardReceipt awardBadge(BadgeRequest request) {
        return receipt(client.awardBadge(request), request.idempotencyKey());
    }

    private AwardReceipt receipt(ApiResponse<AwardReceipt> resp, String key) {
        if (resp == null || !resp.hasData()) {
            log.warn("积分账本返回异常: key={}, resp={}", key, resp);
            return new AwardReceipt(false, false, key);
        }
        return resp.data();
    }

    private AwardReceipt awardFallback(AwardRequest request, Throwable ex) {
        log.warn("积分账本调用失败，已降级: key={}, err={}", request.idempotencyKey(), ex.toString());
        return new AwardReceipt(false, false, request.idempotencyKey());
    }

    private AwardReceipt badgeFallback(BadgeRequest request, Throwable ex) {
        log.warn("徽章发放失败，已降级: key={}, err={}", request.idempotencyKey(), ex.toString());
        return new AwardReceipt(false, false, request.idempotencyKey());
    }
}
