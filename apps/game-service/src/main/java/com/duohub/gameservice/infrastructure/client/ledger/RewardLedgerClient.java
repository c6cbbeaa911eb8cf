package com.duohub.gameservice.infrastructure.client.ledger;

import com.duohub.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 积分账本接口。请求都带幂等键，账本侧对同一幂等键只入账一次。
 */
@FeignClient(
        name = "reward-ledger",
        url = "${duohub.ledger.url:http://localhost:8091}",
        path = "/api/love-points"
)
public interface RewardLedgerClient {

    @PostMapping("/award")
    ApiResponse<AwardReceipt> award(@RequestBody AwardRequest request);

    @PostMapping("/badges")
    ApiResponse<AwardReceipt> awardBadge(@RequestBody BadgeRequest request);
}
