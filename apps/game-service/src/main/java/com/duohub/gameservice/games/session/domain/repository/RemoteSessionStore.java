package com.duohub.gameservice.games.session.domain.repository;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 远端会话存储：两台设备共享，无锁，路径为 (pairKey, kind, sessionId)。
 * 所有方法在网络不可达时抛出运行时异常，由同步器负责兜底。
 */
public interface RemoteSessionStore {

    Optional<GameSession> read(String pairKey, GameKind kind, String sessionId);

    List<GameSession> list(String pairKey, GameKind kind);

    /**
     * 无条件整文档写入
     */
    void write(GameSession session);

    /**
     * 条件写入：远端当前版本等于 expectedVersion 时才写入
     * （expectedVersion = -1 表示远端必须还不存在该会话）。
     *
     * @return 是否写入成功
     */
    boolean compareAndWrite(GameSession session, long expectedVersion);

    /**
     * 字段级合并奖励记账：已存在的 tierKey 不覆盖
     */
    void recordRewards(String pairKey, GameKind kind, String sessionId, Map<String, Integer> rewards);

    void delete(String pairKey, GameKind kind, String sessionId);

    /**
     * 抢占槽位，返回最终占有该槽位的会话ID（可能是自己，也可能是对方）
     */
    String claimSlot(String pairKey, GameKind kind, String slotKey, String sessionId, Duration ttl);

    /**
     * 订阅某对情侣的会话变更通知
     */
    Subscription subscribe(String pairKey, ChangeListener listener);

    @FunctionalInterface
    interface ChangeListener {
        void onChange(GameKind kind, String sessionId);
    }

    @FunctionalInterface
    interface Subscription {
        void close();
    }
}
