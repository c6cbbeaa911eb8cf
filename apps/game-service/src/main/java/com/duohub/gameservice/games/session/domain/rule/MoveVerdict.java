package com.duohub.gameservice.games.session.domain.rule;

/**
 * 校验结论：合法，或带原因码的拒绝。
 */
public record MoveVerdict(boolean valid, RejectReason reason) {

    public static final MoveVerdict VALID = new MoveVerdict(true, null);

    public static MoveVerdict reject(RejectReason reason) {
        return new MoveVerdict(false, reason);
    }
}
