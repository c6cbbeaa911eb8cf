package com.duohub.gameservice.infrastructure.client.ledger;

/**
 * 账本回执。
 *
 * @param credited  本次是否实际入账
 * @param duplicate 幂等键已存在（之前入过账）
 */
public record AwardReceipt(boolean credited, boolean duplicate, String idempotencyKey) {

    public boolean settled() {
        return credited || duplicate;
    }
}
