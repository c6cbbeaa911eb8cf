package com.duohub.gameservice.games.session.infrastructure.redis;

import com.duohub.gameservice.games.session.domain.model.GameKind;

/**
 * 统一集中管理会话相关的 Redis Key。
 * pairKey 放在 {} 里作为 hash tag，保证同一对情侣的键落在同一个 slot，Lua 脚本可以跨键原子执行。
 */
public final class RedisKeys {

    private static final String PFX = "duohub:pair:";

    private RedisKeys() {}

    private static String base(String pairKey, GameKind kind) {
        return PFX + "{" + pairKey + "}:" + kind.wireName();
    }

    // ---- 会话文档（fastjson2 JSON） ----
    public static String session(String pairKey, GameKind kind, String sessionId) {
        return base(pairKey, kind) + ":session:" + sessionId;
    }

    // ---- 会话版本号（条件写入依据） ----
    public static String sessionVersion(String pairKey, GameKind kind, String sessionId) {
        return session(pairKey, kind, sessionId) + ":version";
    }

    // ---- 奖励记账 Hash：tierKey -> amount ----
    public static String sessionRewards(String pairKey, GameKind kind, String sessionId) {
        return session(pairKey, kind, sessionId) + ":rewards";
    }

    // ---- 会话索引 ZSet：member = sessionId，score = createdAt ----
    public static String sessionIndex(String pairKey, GameKind kind) {
        return base(pairKey, kind) + ":index";
    }

    // ---- 建局槽位占用 ----
    public static String slotClaim(String pairKey, GameKind kind, String slotKey) {
        return base(pairKey, kind) + ":slot:" + slotKey;
    }

    // ---- 会话变更频道（消息体：kind|sessionId） ----
    public static String changes(String pairKey) {
        return PFX + "{" + pairKey + "}:changes";
    }
}
