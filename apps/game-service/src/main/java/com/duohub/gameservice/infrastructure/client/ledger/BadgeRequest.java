package com.duohub.gameservice.infrastructure.client.ledger;

public record BadgeRequest(String sessionId, String badgeKey, String idempotencyKey) {
}
