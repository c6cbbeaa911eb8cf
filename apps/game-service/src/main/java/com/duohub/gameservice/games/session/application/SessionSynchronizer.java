package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.session.application.event.SessionEvent;
import com.duohub.gameservice.games.session.application.event.SessionEventBus;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.PairKeys;
import com.duohub.gameservice.games.session.domain.repository.AuthoritativeStore;
import com.duohub.gameservice.games.session.domain.repository.LocalSessionCache;
import com.duohub.gameservice.games.session.domain.repository.RemoteSessionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * SessionSynchronizer
 * -------------------------------------------------------
 * 本地缓存 + 远端存储 + 权威后端 的双写纪律：
 *
 * 写：
 *   1) 同步写本地缓存并标记待同步（版本高于 confirmedVersion 的部分是推测状态）；
 *   2) 异步条件写远端（expectedVersion = confirmedVersion），成功后推测状态转为已确认；
 *   3) 远端成功后再推权威后端。
 *   同一会话的推送按提交顺序串行；失败只记日志，等下一次 flushPending 重推，不回滚。
 *
 * 读：
 *   远端快照整体替换本地（rewardsIssued 取并集）。
 *   本地存在推测状态而远端已越过其基线版本时，丢弃本地推测状态。
 *
 * 仲裁：
 *   同槽位出现多局时按 {@link DeviceRaceArbitrator} 选出胜者，败者在三处都删除。
 *
 * 锁：
 *   本地副本的读改写（状态机走子、远端快照覆盖、丢弃）都持有同一把会话锁 {@link #lockOf}，
 *   否则走子可能基于已被覆盖的旧副本提交，而此时 confirmedVersion 已追上，条件写会被跳过。
 * -------------------------------------------------------
 */
@Slf4j
public class SessionSynchronizer {

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final LocalSessionCache local;
    private final RemoteSessionStore remote;
    private final AuthoritativeStore backend;
    private final DeviceRaceArbitrator arbitrator;
    private final SessionEventBus events;
    private final Executor syncExecutor;
    private final ScheduledExecutorService scheduler;
    private final SyncSettings settings;
    private final Clock clock;

    /** sessionId -> 推送链尾部；访问需持有自身锁 */
    private final Map<String, CompletableFuture<Void>> pushChains = new HashMap<>();

    /** sessionId -> 本地副本读改写锁 */
    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    public SessionSynchronizer(LocalSessionCache local,
                               RemoteSessionStore remote,
                               AuthoritativeStore backend,
                               DeviceRaceArbitrator arbitrator,
                               SessionEventBus events,
                               Executor syncExecutor,
                               ScheduledExecutorService scheduler,
                               SyncSettings settings,
                               Clock clock) {
        this.local = local;
        this.remote = remote;
        this.backend = backend;
        this.arbitrator = arbitrator;
        this.events = events;
        this.syncExecutor = syncExecutor;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * 会话锁：对本地副本做读改写的一方都要持有
     */
    public ReentrantLock lockOf(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, k -> new ReentrantLock());
    }

    private void underLock(String sessionId, Runnable action) {
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // =========================== 写路径 ===========================

    /**
     * 提交本地变更：本地立即可见，远端与后端异步跟进
     */
    public void commit(GameSession session) {
        local.put(session);
        local.markPending(session.getId());
        schedulePush(session.getId());
    }

    /**
     * 把会话的推送挂到该会话推送链的尾部
     */
    public CompletableFuture<Void> schedulePush(String sessionId) {
        // 先挂链再放行，推送不会在 pushChains 的监视器里执行
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> next;
        synchronized (pushChains) {
            CompletableFuture<Void> tail = pushChains.getOrDefault(sessionId, DONE);
            next = gate.thenCompose(x -> tail.handle((v, ex) -> (Void) null))
                    .thenRunAsync(() -> pushNow(sessionId), syncExecutor);
            pushChains.put(sessionId, next);
        }
        next.whenComplete((v, ex) -> {
            synchronized (pushChains) {
                pushChains.remove(sessionId, next);
            }
        });
        gate.complete(null);
        return next;
    }

    /**
     * 重推所有待同步的会话
     *
     * @return 本次重推的会话数
     */
    public int flushPending() {
        Set<String> ids = local.pending();
        if (!ids.isEmpty()) {
            log.debug("重推待同步会话: count={}", ids.size());
        }
        ids.forEach(this::schedulePush);
        return ids.size();
    }

    private void pushNow(String sessionId) {
        Optional<GameSession> cached = local.get(sessionId);
        if (cached.isEmpty()) {
            local.clearPending(sessionId);
            return;
        }
        GameSession session = cached.get();
        long base = local.confirmedVersion(sessionId);
        try {
            if (session.getVersion() > base) {
                if (!remote.compareAndWrite(session, base)) {
                    log.info("远端拒绝条件写入（对方已先写入），改用远端快照: sessionId={}, base={}, local={}",
                            sessionId, base, session.getVersion());
                    onWriteRejected(session);
                    return;
                }
                local.markConfirmed(sessionId, session.getVersion());
                pushToBackend(session);
            }
            if (!session.getRewardsIssued().isEmpty()) {
                remote.recordRewards(session.getPairKey(), session.getKind(), sessionId, session.getRewardsIssued());
            }
            clearPendingIfUnchanged(session);
            log.debug("会话已同步到远端: sessionId={}, version={}", sessionId, session.getVersion());
        } catch (Exception e) {
            log.warn("推送远端会话失败，保留为待同步: sessionId={}, version={}, err={}",
                    sessionId, session.getVersion(), e.toString());
        }
    }

    private void pushToBackend(GameSession session) {
        try {
            backend.push(session).ifPresent(canonical ->
                    log.debug("权威后端已接收: sessionId={}, version={}", canonical.getId(), canonical.getVersion()));
        } catch (Exception e) {
            log.warn("推送权威后端失败（不影响对局）: sessionId={}, err={}", session.getId(), e.toString());
        }
    }

    private void clearPendingIfUnchanged(GameSession pushed) {
        underLock(pushed.getId(), () -> local.get(pushed.getId()).ifPresent(now -> {
            boolean sameVersion = now.getVersion() == pushed.getVersion();
            boolean rewardsCovered = pushed.getRewardsIssued().keySet().containsAll(now.getRewardsIssued().keySet());
            if (sameVersion && rewardsCovered) {
                local.clearPending(pushed.getId());
            }
        }));
    }

    private void onWriteRejected(GameSession mine) {
        Optional<GameSession> authoritative = remote.read(mine.getPairKey(), mine.getKind(), mine.getId());
        underLock(mine.getId(), () -> {
            // 拿锁前本地可能又有新提交，以锁内的最新副本为准
            GameSession latest = local.get(mine.getId()).orElse(mine);
            if (authoritative.isPresent()) {
                adopt(authoritative.get(), latest);
            } else {
                discardLocal(latest, "远端已不存在该会话");
            }
        });
    }

    // =========================== 读路径 ===========================

    /**
     * 拉取某对情侣某类游戏的全部远端会话并与本地合并
     *
     * @return 合并后的本地视图；远端不可达时直接返回本地缓存
     */
    public List<GameSession> refresh(String pairKey, GameKind kind) {
        List<GameSession> remoteSessions;
        try {
            remoteSessions = remote.list(pairKey, kind);
        } catch (Exception e) {
            log.warn("读取远端会话失败，使用本地缓存: pairKey={}, kind={}, err={}", pairKey, kind, e.toString());
            return local.findByPair(pairKey, kind);
        }
        Set<String> remoteIds = remoteSessions.stream().map(GameSession::getId).collect(Collectors.toSet());
        for (GameSession r : remoteSessions) {
            reconcile(r);
        }
        for (GameSession mine : local.findByPair(pairKey, kind)) {
            if (remoteIds.contains(mine.getId())) continue;
            if (local.confirmedVersion(mine.getId()) != LocalSessionCache.NEVER_CONFIRMED) {
                discardLocal(mine, "远端已删除");
            } else {
                schedulePush(mine.getId());
            }
        }
        return local.findByPair(pairKey, kind);
    }

    /**
     * 收到单个会话的变更通知
     */
    public void refreshOne(String pairKey, GameKind kind, String sessionId) {
        try {
            Optional<GameSession> r = remote.read(pairKey, kind, sessionId);
            if (r.isPresent()) {
                reconcile(r.get());
            } else {
                local.get(sessionId)
                        .filter(s -> local.confirmedVersion(sessionId) != LocalSessionCache.NEVER_CONFIRMED)
                        .ifPresent(s -> discardLocal(s, "远端已删除"));
            }
        } catch (Exception e) {
            log.warn("读取远端会话失败: sessionId={}, err={}", sessionId, e.toString());
        }
    }

    /**
     * 用一份远端快照更新本地
     */
    public void reconcile(GameSession remoteSnap) {
        underLock(remoteSnap.getId(), () -> reconcileLocked(remoteSnap));
    }

    private void reconcileLocked(GameSession remoteSnap) {
        String id = remoteSnap.getId();
        Optional<GameSession> cur = local.get(id);
        if (cur.isEmpty()) {
            adopt(remoteSnap, null);
            return;
        }
        GameSession mine = cur.get();
        long base = local.confirmedVersion(id);
        boolean speculative = mine.getVersion() > base;
        if (speculative) {
            if (remoteSnap.getVersion() > base) {
                log.warn("本地推测状态与远端分叉，丢弃本地未确认变更: sessionId={}, base={}, local={}, remote={}",
                        id, base, mine.getVersion(), remoteSnap.getVersion());
                adopt(remoteSnap, mine);
            } else {
                schedulePush(id);
            }
            return;
        }
        if (remoteSnap.getVersion() > mine.getVersion()) {
            adopt(remoteSnap, mine);
        } else if (remoteSnap.getVersion() == mine.getVersion()) {
            if (mine.mergeRewards(remoteSnap.getRewardsIssued())) {
                local.put(mine);
            }
            if (!remoteSnap.getRewardsIssued().keySet().containsAll(mine.getRewardsIssued().keySet())) {
                local.markPending(id);
                schedulePush(id);
            }
        }
    }

    private void adopt(GameSession remoteSnap, GameSession mine) {
        underLock(remoteSnap.getId(), () -> adoptLocked(remoteSnap, mine));
    }

    private void adoptLocked(GameSession remoteSnap, GameSession mine) {
        GameSession merged = remoteSnap.copy();
        boolean localHadMore = mine != null && merged.mergeRewards(mine.getRewardsIssued());
        local.put(merged);
        local.markConfirmed(merged.getId(), remoteSnap.getVersion());
        if (localHadMore) {
            local.markPending(merged.getId());
            schedulePush(merged.getId());
        } else {
            local.clearPending(merged.getId());
        }
        events.publish(new SessionEvent(SessionEvent.Type.REFRESHED, merged, null, clock.millis()));
    }

    private void discardLocal(GameSession mine, String why) {
        log.info("删除本地会话: sessionId={}, kind={}, 原因={}", mine.getId(), mine.getKind(), why);
        underLock(mine.getId(), () -> local.remove(mine.getId()));
        events.publish(new SessionEvent(SessionEvent.Type.DISCARDED, mine, null, clock.millis()));
    }

    /**
     * 从权威后端恢复一局（本地与远端都丢失时），并回填远端
     */
    public Optional<GameSession> recover(GameKind kind, String sessionId) {
        Optional<GameSession> fromBackend = backend.fetch(kind, sessionId);
        if (fromBackend.isEmpty()) {
            return Optional.empty();
        }
        GameSession s = fromBackend.get();
        try {
            if (remote.read(s.getPairKey(), kind, sessionId).isEmpty()) {
                remote.write(s);
                log.info("已从权威后端回填远端: sessionId={}, version={}", sessionId, s.getVersion());
            }
        } catch (Exception e) {
            log.warn("回填远端失败: sessionId={}, err={}", sessionId, e.toString());
        }
        return Optional.of(adoptDiscovered(s));
    }

    // =========================== 建局仲裁 ===========================

    /**
     * 找到或创建某槽位的会话：
     * 创建方查一次远端，没有就创建；
     * 等待方查远端，等待后再查，再等待后再查，仍没有才创建。
     */
    public CompletableFuture<SlotResolution> findOrCreate(String self, String partner, GameKind kind,
                                                          String slotKey, Supplier<GameSession> factory) {
        String pairKey = PairKeys.of(self, partner);
        Optional<GameSession> cached = inSlot(local.findByPair(pairKey, kind), slotKey);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(new SlotResolution(cached.get(), false));
        }
        Supplier<Optional<GameSession>> lookup = () -> lookupRemote(pairKey, kind, slotKey);
        CompletableFuture<Optional<GameSession>> found = CompletableFuture.supplyAsync(lookup, syncExecutor);
        if (arbitrator.roleOf(self, partner) == DeviceRaceArbitrator.Role.WAITER) {
            log.debug("等待方：等待对方建局: pairKey={}, kind={}, slot={}", pairKey, kind, slotKey);
            found = found
                    .thenCompose(f -> f.isPresent() ? CompletableFuture.completedFuture(f) : delayed(settings.waiterFirstDelay(), lookup))
                    .thenCompose(f -> f.isPresent() ? CompletableFuture.completedFuture(f) : delayed(settings.waiterRetryDelay(), lookup));
        }
        return found.thenApply(f -> f
                .map(s -> new SlotResolution(adoptDiscovered(s), false))
                .orElseGet(() -> create(pairKey, kind, slotKey, factory)));
    }

    private Optional<GameSession> lookupRemote(String pairKey, GameKind kind, String slotKey) {
        try {
            List<GameSession> candidates = remote.list(pairKey, kind).stream()
                    .filter(s -> Objects.equals(s.getSlotKey(), slotKey))
                    .collect(Collectors.toList());
            return candidates.isEmpty() ? Optional.empty() : Optional.of(arbitrator.pickAuthoritative(candidates));
        } catch (Exception e) {
            log.warn("查询远端会话失败，按离线处理: pairKey={}, kind={}, err={}", pairKey, kind, e.toString());
            return Optional.empty();
        }
    }

    private SlotResolution create(String pairKey, GameKind kind, String slotKey, Supplier<GameSession> factory) {
        GameSession fresh = factory.get();
        if (settings.conditionalCreate()) {
            String holder = fresh.getId();
            try {
                holder = remote.claimSlot(pairKey, kind, slotKey, fresh.getId(), settings.slotClaimTtl());
            } catch (Exception e) {
                log.warn("抢占槽位失败，按离线创建: pairKey={}, slot={}, err={}", pairKey, slotKey, e.toString());
            }
            if (!fresh.getId().equals(holder)) {
                Optional<GameSession> claimed = readQuietly(pairKey, kind, holder);
                if (claimed.isPresent()) {
                    log.info("槽位已被对方占用，采用对方会话: slot={}, sessionId={}", slotKey, holder);
                    return new SlotResolution(adoptDiscovered(claimed.get()), false);
                }
                log.warn("槽位已被 {} 占用但尚未写入，仍在本地创建，稍后由仲裁收敛", holder);
            }
        }
        commit(fresh);
        log.info("新建会话: sessionId={}, kind={}, pairKey={}, slot={}", fresh.getId(), kind, pairKey, slotKey);
        events.publish(new SessionEvent(SessionEvent.Type.CREATED, fresh.copy(), fresh.getCreatedBy(), clock.millis()));
        return new SlotResolution(fresh.copy(), true);
    }

    private Optional<GameSession> readQuietly(String pairKey, GameKind kind, String sessionId) {
        try {
            return remote.read(pairKey, kind, sessionId);
        } catch (Exception e) {
            log.warn("读取远端会话失败: sessionId={}, err={}", sessionId, e.toString());
            return Optional.empty();
        }
    }

    private GameSession adoptDiscovered(GameSession found) {
        GameSession merged = found.copy();
        underLock(found.getId(), () -> {
            local.get(found.getId()).ifPresent(m -> merged.mergeRewards(m.getRewardsIssued()));
            local.put(merged);
            local.markConfirmed(merged.getId(), found.getVersion());
            local.clearPending(merged.getId());
        });
        events.publish(new SessionEvent(SessionEvent.Type.REFRESHED, merged.copy(), null, clock.millis()));
        return merged;
    }

    private static Optional<GameSession> inSlot(List<GameSession> sessions, String slotKey) {
        return sessions.stream().filter(s -> Objects.equals(s.getSlotKey(), slotKey)).findFirst();
    }

    private <T> CompletableFuture<T> delayed(Duration delay, Supplier<T> task) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return CompletableFuture.supplyAsync(task, syncExecutor);
        }
        CompletableFuture<T> f = new CompletableFuture<>();
        scheduler.schedule(() -> {
            try {
                f.complete(task.get());
            } catch (Throwable t) {
                f.completeExceptionally(t);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return f;
    }

    // =========================== 去重 ===========================

    /**
     * 同槽位多局时保留胜者，删除其余
     *
     * @return 被删除的会话
     */
    public List<GameSession> resolveDuplicates(String pairKey, GameKind kind) {
        Map<String, List<GameSession>> bySlot = local.findByPair(pairKey, kind).stream()
                .filter(s -> s.getStatus().playable())
                .collect(Collectors.groupingBy(s -> s.getSlotKey() == null ? "" : s.getSlotKey(),
                        LinkedHashMap::new, Collectors.toList()));
        List<GameSession> discarded = new ArrayList<>();
        for (Map.Entry<String, List<GameSession>> group : bySlot.entrySet()) {
            if (group.getValue().size() < 2) continue;
            GameSession winner = arbitrator.pickAuthoritative(group.getValue());
            for (GameSession loser : arbitrator.losers(group.getValue())) {
                log.info("同槽位出现多局，保留 {} 删除 {}: pairKey={}, kind={}, slot={}",
                        winner.getId(), loser.getId(), pairKey, kind, group.getKey());
                deleteEverywhere(loser);
                discarded.add(loser);
            }
        }
        return discarded;
    }

    private void deleteEverywhere(GameSession loser) {
        underLock(loser.getId(), () -> local.remove(loser.getId()));
        syncExecutor.execute(() -> {
            try {
                remote.delete(loser.getPairKey(), loser.getKind(), loser.getId());
            } catch (Exception e) {
                log.warn("删除远端会话失败，等待下次仲裁: sessionId={}, err={}", loser.getId(), e.toString());
            }
            try {
                backend.delete(loser.getKind(), loser.getId());
            } catch (Exception e) {
                log.warn("删除权威后端会话失败: sessionId={}, err={}", loser.getId(), e.toString());
            }
        });
        events.publish(new SessionEvent(SessionEvent.Type.DISCARDED, loser, null, clock.millis()));
    }

    // =========================== 轮询 ===========================

    /**
     * 开始轮询一对情侣的会话，同时订阅远端变更通知
     */
    public PollHandle startPolling(String pairKey, Set<GameKind> kinds) {
        RemoteSessionStore.Subscription subscription = null;
        try {
            subscription = remote.subscribe(pairKey,
                    (kind, sessionId) -> syncExecutor.execute(() -> refreshOne(pairKey, kind, sessionId)));
        } catch (Exception e) {
            log.warn("订阅远端变更失败，仅依赖轮询: pairKey={}, err={}", pairKey, e.toString());
        }
        long ms = Math.max(1L, settings.pollInterval().toMillis());
        ScheduledFuture<?> ticker = scheduler.scheduleWithFixedDelay(
                () -> pollOnce(pairKey, kinds), 0L, ms, TimeUnit.MILLISECONDS);
        log.info("开始轮询: pairKey={}, kinds={}, intervalMs={}", pairKey, kinds, ms);
        return new PollHandle(ticker, subscription);
    }

    /**
     * 一次轮询：重推待同步、刷新、去重
     */
    public void pollOnce(String pairKey, Set<GameKind> kinds) {
        try {
            flushPending();
            for (GameKind kind : kinds) {
                refresh(pairKey, kind);
                resolveDuplicates(pairKey, kind);
            }
        } catch (Exception e) {
            log.error("轮询异常: pairKey={}", pairKey, e);
        }
    }
}
