package com.duohub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 封装 String/Hash/ZSet/Key/PubSub/脚本 原语
 * - 值一律是字符串（会话文档由 fastjson2 序列化后存入）
 * - 业务键名放在各自的 RedisKeys 里组织
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    private final StringRedisTemplate strRedis;

    // -------------- String --------------

    /**
     * 写入字符串键值（带 TTL）
     */
    public boolean setString(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
        return true;
    }

    /**
     * 仅当不存在时写入字符串键值（SETNX），带 TTL。
     * @return true 表示写入成功，false 表示已存在
     */
    public boolean setStringNx(String key, String val, Duration ttl) {
        Boolean ok = strRedis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    public String getString(String key) {
        return strRedis.opsForValue().get(key);
    }

    // -------------- Hash --------------

    /**
     * 仅当字段不存在时写入（HSETNX）
     */
    public boolean hSetNx(String key, String field, String val) {
        Boolean ok = strRedis.opsForHash().putIfAbsent(key, field, val);
        return Boolean.TRUE.equals(ok);
    }

    /**
     * 获取整个 Hash
     */
    public Map<String, String> hGetAll(String key) {
        Map<Object, Object> raw = strRedis.opsForHash().entries(key);
        Map<String, String> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    // -------------- ZSet --------------

    public boolean zAdd(String key, String member, double score) {
        Boolean ok = strRedis.opsForZSet().add(key, member, score);
        return Boolean.TRUE.equals(ok);
    }

    /**
     * 按分数升序取全部成员
     */
    public Set<String> zRangeAll(String key) {
        Set<String> members = strRedis.opsForZSet().range(key, 0, -1);
        return members == null ? Collections.emptySet() : members;
    }

    public Long zRem(String key, String... members) {
        return strRedis.opsForZSet().remove(key, (Object[]) members);
    }

    // -------------- Key & TTL --------------

    public Boolean expire(String key, Duration ttl) {
        return strRedis.expire(key, ttl);
    }

    public Long del(String... keys) {
        return strRedis.delete(Arrays.asList(keys));
    }

    // -------------- Pub/Sub --------------

    public void publish(String channel, String message) {
        strRedis.convertAndSend(channel, message);
    }

    // -------------- Script --------------

    /**
     * 执行 Lua 脚本（原子操作）
     * -------------------------------------------------------
     * 常用于：条件写入（乐观锁）、多键原子更新。
     *
     * @param script     Lua 文本
     * @param keys       KEYS[...]
     * @param args       ARGV[...]（均为字符串）
     * @param resultType 返回类型
     */
    public <T> T eval(String script, List<String> keys, List<String> args, Class<T> resultType) {
        DefaultRedisScript<T> rs = new DefaultRedisScript<>();
        rs.setResultType(resultType);
        rs.setScriptText(script);
        return strRedis.execute(rs, keys, args.toArray());
    }
}
