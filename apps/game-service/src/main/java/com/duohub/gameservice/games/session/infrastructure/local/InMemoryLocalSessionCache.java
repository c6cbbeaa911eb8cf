package com.duohub.gameservice.games.session.infrastructure.local;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.repository.LocalSessionCache;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存版本地缓存（默认实现）。子类可在 {@link #persist} / {@link #erase} 里落盘。
 */
public class InMemoryLocalSessionCache implements LocalSessionCache {

    /** 缓存条目：会话副本 + 同步簿记 */
    protected static final class Entry {
        GameSession session;
        long confirmedVersion = NEVER_CONFIRMED;
        boolean pending;
    }

    protected final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<GameSession> get(String sessionId) {
        Entry e = entries.get(sessionId);
        return e == null || e.session == null ? Optional.empty() : Optional.of(e.session.copy());
    }

    @Override
    public void put(GameSession session) {
        Entry e = entries.computeIfAbsent(session.getId(), k -> new Entry());
        synchronized (e) {
            e.session = session.copy();
            persist(session.getId(), e);
        }
    }

    @Override
    public void remove(String sessionId) {
        if (entries.remove(sessionId) != null) {
            erase(sessionId);
        }
    }

    @Override
    public List<GameSession> findByPair(String pairKey, GameKind kind) {
        return entries.values().stream()
                .map(e -> e.session)
                .filter(Objects::nonNull)
                .filter(s -> pairKey.equals(s.getPairKey()) && s.getKind() == kind)
                .map(GameSession::copy)
                .sorted(Comparator.comparingLong(GameSession::getCreatedAt).thenComparing(GameSession::getId))
                .collect(Collectors.toList());
    }

    @Override
    public long confirmedVersion(String sessionId) {
        Entry e = entries.get(sessionId);
        return e == null ? NEVER_CONFIRMED : e.confirmedVersion;
    }

    @Override
    public void markConfirmed(String sessionId, long version) {
        update(sessionId, e -> e.confirmedVersion = Math.max(e.confirmedVersion, version));
    }

    @Override
    public void markPending(String sessionId) {
        update(sessionId, e -> e.pending = true);
    }

    @Override
    public void clearPending(String sessionId) {
        update(sessionId, e -> e.pending = false);
    }

    @Override
    public Set<String> pending() {
        Set<String> ids = new HashSet<>();
        entries.forEach((id, e) -> {
            if (e.pending) ids.add(id);
        });
        return ids;
    }

    private void update(String sessionId, java.util.function.Consumer<Entry> change) {
        Entry e = entries.get(sessionId);
        if (e == null) return;
        synchronized (e) {
            change.accept(e);
            persist(sessionId, e);
        }
    }

    /**
     * 条目变化后回调（持有条目锁）
     */
    protected void persist(String sessionId, Entry entry) {
    }

    protected void erase(String sessionId) {
    }
}
