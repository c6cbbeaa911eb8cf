package com.duohub.web.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

/**
 * 当前参与者解析工具类
 *
 * 会话同步只关心“我是谁”：参与者ID 统一取 JWT 的 subject，
 * 展示名仅用于伴侣通知文案（优先 name，其次 preferred_username）。
 *
 * 使用方式：
 * <pre>
 * {@code
 * @PostMapping("/{sessionId}/moves")
 * public ResponseEntity<?> move(@AuthenticationPrincipal Jwt jwt, ...) {
 *     String me = CurrentUserHelper.requireUserId(jwt);
 *     // ...
 * }
 * }
 * </pre>
 */
@Slf4j
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 快速获取用户ID（jwt 为空时返回 null）
     */
    public static String getUserId(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }

    /**
     * 获取参与者ID；缺失 subject 视为参数错误
     */
    public static String requireUserId(Jwt jwt) {
        String userId = getUserId(jwt);
        if (userId == null || userId.isBlank()) {
            log.warn("请求缺少有效的用户标识（JWT subject 为空）");
            throw new IllegalArgumentException("MISSING_USER_ID");
        }
        return userId;
    }

    /**
     * 显示名称：name > preferred_username > userId
     */
    public static String getDisplayName(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        return Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .or(() -> Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                        .filter(s -> !s.isBlank()))
                .orElse(jwt.getSubject());
    }
}
