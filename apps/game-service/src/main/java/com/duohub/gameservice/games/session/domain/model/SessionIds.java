package com.duohub.gameservice.games.session.domain.model;

import java.util.regex.Pattern;

/**
 * 会话ID 校验：只接受标准格式的 UUID（小写或大写十六进制，8-4-4-4-12）。
 * 会话ID 会拼进 Redis 键和本地文件名，外部来的快照必须先过这里。
 */
public final class SessionIds {

    private static final Pattern UUID_FORM =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private SessionIds() {}

    public static boolean isWellFormed(String sessionId) {
        return sessionId != null && UUID_FORM.matcher(sessionId).matches();
    }

    /**
     * @throws IllegalArgumentException 非 UUID 格式
     */
    public static String require(String sessionId) {
        if (!isWellFormed(sessionId)) {
            throw new IllegalArgumentException("MALFORMED_SESSION_ID: " + sessionId);
        }
        return sessionId;
    }
}
