package com.duohub.gameservice.infrastructure.client.ledger;

/**
 * 积分发放请求。
 *
 * @param idempotencyKey {sessionId}:{tierKey}
 */
public record AwardRequest(String sessionId, String tierKey, int amount, String reason, String idempotencyKey) {
}
