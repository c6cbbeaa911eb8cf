package com.duohub.gameservice.games.session.infrastructure.redis;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.repository.RemoteSessionStore;
import com.duohub.gameservice.games.session.infrastructure.codec.SessionCodec;
import com.duohub.gameservice.infrastructure.redis.RedisOps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RedisRemoteSessionStore
 * -------------------------------------------------------
 * 远端会话存储的 Redis 实现：
 * - 会话文档：String（fastjson2 JSON），版本号单独一个键；
 * - 条件写入：Lua 脚本比较版本号后原子写入文档、版本、索引并发布变更；
 * - 奖励记账：Hash + HSETNX，字段级取并集；
 * - 变更通知：每对情侣一个频道，消息体为 kind|sessionId。
 * 所有键带 TTL，过期的历史会话由 Redis 自行清理。
 * -------------------------------------------------------
 */
@Slf4j
@Repository
public class RedisRemoteSessionStore implements RemoteSessionStore {

    /**
     * KEYS[1]=文档 KEYS[2]=版本 KEYS[3]=索引
     * ARGV[1]=文档JSON ARGV[2]=期望版本(-1 表示必须不存在) ARGV[3]=新版本
     * ARGV[4]=createdAt ARGV[5]=TTL毫秒 ARGV[6]=sessionId ARGV[7]=频道 ARGV[8]=消息
     */
    static final String CAS_WRITE_LUA =
            "local cur = redis.call('GET', KEYS[2]) " +
            "local expected = tonumber(ARGV[2]) " +
            "if cur == false then " +
            "  if expected ~= -1 then return 0 end " +
            "elseif tonumber(cur) ~= expected then " +
            "  return 0 " +
            "end " +
            "redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[5]) " +
            "redis.call('SET', KEYS[2], ARGV[3], 'PX', ARGV[5]) " +
            "redis.call('ZADD', KEYS[3], ARGV[4], ARGV[6]) " +
            "redis.call('PEXPIRE', KEYS[3], ARGV[5]) " +
            "redis.call('PUBLISH', ARGV[7], ARGV[8]) " +
            "return 1";

    private final RedisOps ops;
    private final SessionCodec codec;
    private final RedisMessageListenerContainer listenerContainer;
    private final Duration ttl;

    public RedisRemoteSessionStore(RedisOps ops,
                                   SessionCodec codec,
                                   RedisMessageListenerContainer listenerContainer,
                                   @Value("${duohub.remote.ttl:30d}") Duration ttl) {
        this.ops = ops;
        this.codec = codec;
        this.listenerContainer = listenerContainer;
        this.ttl = ttl;
    }

    @Override
    public Optional<GameSession> read(String pairKey, GameKind kind, String sessionId) {
        String json = ops.getString(RedisKeys.session(pairKey, kind, sessionId));
        if (json == null) {
            return Optional.empty();
        }
        GameSession session;
        try {
            session = codec.fromJson(json);
        } catch (IllegalArgumentException e) {
            log.warn("远端会话文档损坏，已忽略: sessionId={}, err={}", sessionId, e.getMessage());
            return Optional.empty();
        }
        Map<String, String> rewards = ops.hGetAll(RedisKeys.sessionRewards(pairKey, kind, sessionId));
        rewards.forEach((tierKey, amount) -> session.getRewardsIssued().putIfAbsent(tierKey, Integer.valueOf(amount)));
        return Optional.of(session);
    }

    @Override
    public List<GameSession> list(String pairKey, GameKind kind) {
        String indexKey = RedisKeys.sessionIndex(pairKey, kind);
        List<GameSession> out = new ArrayList<>();
        for (String sessionId : ops.zRangeAll(indexKey)) {
            Optional<GameSession> s = read(pairKey, kind, sessionId);
            if (s.isPresent()) {
                out.add(s.get());
            } else {
                // 文档已过期或被删除，顺手清理索引
                ops.zRem(indexKey, sessionId);
            }
        }
        return out;
    }

    @Override
    public void write(GameSession session) {
        String pairKey = session.getPairKey();
        GameKind kind = session.getKind();
        String id = session.getId();
        ops.setString(RedisKeys.session(pairKey, kind, id), codec.toJson(session), ttl);
        ops.setString(RedisKeys.sessionVersion(pairKey, kind, id), String.valueOf(session.getVersion()), ttl);
        ops.zAdd(RedisKeys.sessionIndex(pairKey, kind), id, session.getCreatedAt());
        ops.expire(RedisKeys.sessionIndex(pairKey, kind), ttl);
        recordRewards(pairKey, kind, id, session.getRewardsIssued());
        ops.publish(RedisKeys.changes(pairKey), message(kind, id));
    }

    @Override
    public boolean compareAndWrite(GameSession session, long expectedVersion) {
        String pairKey = session.getPairKey();
        GameKind kind = session.getKind();
        String id = session.getId();
        Long res = ops.eval(CAS_WRITE_LUA,
                List.of(RedisKeys.session(pairKey, kind, id),
                        RedisKeys.sessionVersion(pairKey, kind, id),
                        RedisKeys.sessionIndex(pairKey, kind)),
                List.of(codec.toJson(session),
                        String.valueOf(expectedVersion),
                        String.valueOf(session.getVersion()),
                        String.valueOf(session.getCreatedAt()),
                        String.valueOf(ttl.toMillis()),
                        id,
                        RedisKeys.changes(pairKey),
                        message(kind, id)),
                Long.class);
        return res != null && res == 1L;
    }

    @Override
    public void recordRewards(String pairKey, GameKind kind, String sessionId, Map<String, Integer> rewards) {
        if (rewards == null || rewards.isEmpty()) return;
        String key = RedisKeys.sessionRewards(pairKey, kind, sessionId);
        boolean added = false;
        for (Map.Entry<String, Integer> e : rewards.entrySet()) {
            added |= ops.hSetNx(key, e.getKey(), String.valueOf(e.getValue()));
        }
        ops.expire(key, ttl);
        if (added) {
            ops.publish(RedisKeys.changes(pairKey), message(kind, sessionId));
        }
    }

    @Override
    public void delete(String pairKey, GameKind kind, String sessionId) {
        ops.del(RedisKeys.session(pairKey, kind, sessionId),
                RedisKeys.sessionVersion(pairKey, kind, sessionId),
                RedisKeys.sessionRewards(pairKey, kind, sessionId));
        ops.zRem(RedisKeys.sessionIndex(pairKey, kind), sessionId);
        ops.publish(RedisKeys.changes(pairKey), message(kind, sessionId));
    }

    @Override
    public String claimSlot(String pairKey, GameKind kind, String slotKey, String sessionId, Duration claimTtl) {
        String key = RedisKeys.slotClaim(pairKey, kind, slotKey);
        if (ops.setStringNx(key, sessionId, claimTtl)) {
            return sessionId;
        }
        String holder = ops.getString(key);
        // 占用者恰好过期：视为自己抢到
        return holder == null ? sessionId : holder;
    }

    @Override
    public Subscription subscribe(String pairKey, ChangeListener listener) {
        ChannelTopic topic = new ChannelTopic(RedisKeys.changes(pairKey));
        MessageListener ml = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            int sep = body.indexOf('|');
            if (sep <= 0) {
                log.warn("无法识别的会话变更消息: {}", body);
                return;
            }
            try {
                listener.onChange(GameKind.fromWire(body.substring(0, sep)), body.substring(sep + 1));
            } catch (IllegalArgumentException e) {
                log.warn("无法识别的会话变更消息: {}, err={}", body, e.getMessage());
            }
        };
        listenerContainer.addMessageListener(ml, topic);
        return () -> listenerContainer.removeMessageListener(ml, topic);
    }

    static String message(GameKind kind, String sessionId) {
        return kind.wireName() + "|" + sessionId;
    }
}
