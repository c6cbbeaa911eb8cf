package com.duohub.gameservice.games.session.domain.model;

/**
 * 一次走子尝试：某参与者针对某会话提交的载荷。
 * moveId 仅用于链路追踪；去重依据是 {@link #fingerprint()}。
 */
public record Move(String moveId, String sessionId, String submitter, MovePayload payload) {

    public Move {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("MISSING_SESSION_ID");
        }
        if (submitter == null || submitter.isBlank()) {
            throw new IllegalArgumentException("MISSING_SUBMITTER");
        }
        if (payload == null) {
            throw new IllegalArgumentException("MISSING_PAYLOAD");
        }
    }

    public String fingerprint() {
        return submitter + "/" + payload.fingerprint();
    }
}
