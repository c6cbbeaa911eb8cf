package com.duohub.gameservice.games.session.domain.repository;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 设备本地会话缓存（本进程独占）。
 * 读写都是副本：调用方修改拿到的对象不会影响缓存内容，必须再 put 回来。
 *
 * 除会话本身外还记录两项同步簿记：
 * - confirmedVersion：远端最后一次接受本设备写入时的版本，从未确认为 -1；
 * - pending：本地有尚未推到远端的变更（包括只改了奖励记账的情况）。
 */
public interface LocalSessionCache {

    long NEVER_CONFIRMED = -1L;

    Optional<GameSession> get(String sessionId);

    void put(GameSession session);

    void remove(String sessionId);

    List<GameSession> findByPair(String pairKey, GameKind kind);

    long confirmedVersion(String sessionId);

    void markConfirmed(String sessionId, long version);

    void markPending(String sessionId);

    void clearPending(String sessionId);

    Set<String> pending();
}
