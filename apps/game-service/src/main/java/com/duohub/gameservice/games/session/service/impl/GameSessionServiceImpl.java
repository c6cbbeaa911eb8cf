package com.duohub.gameservice.games.session.service.impl;

import com.duohub.gameservice.games.ladder.content.WordPair;
import com.duohub.gameservice.games.ladder.content.WordPairBank;
import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.quiz.domain.QuizState;
import com.duohub.gameservice.games.session.application.PollHandle;
import com.duohub.gameservice.games.session.application.RewardIssuer;
import com.duohub.gameservice.games.session.application.RewardIssuer.Grant;
import com.duohub.gameservice.games.session.application.SessionFactory;
import com.duohub.gameservice.games.session.application.SessionSynchronizer;
import com.duohub.gameservice.games.session.application.SlotResolution;
import com.duohub.gameservice.games.session.application.event.SessionEvent;
import com.duohub.gameservice.games.session.application.event.SessionEventBus;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.Move;
import com.duohub.gameservice.games.session.domain.model.MovePayload;
import com.duohub.gameservice.games.session.domain.model.PairKeys;
import com.duohub.gameservice.games.session.domain.model.SessionState;
import com.duohub.gameservice.games.session.domain.model.SessionStatus;
import com.duohub.gameservice.games.session.domain.repository.LocalSessionCache;
import com.duohub.gameservice.games.session.domain.reward.RewardSchedule;
import com.duohub.gameservice.games.session.domain.reward.RewardScheduleRegistry;
import com.duohub.gameservice.games.session.domain.rule.GameRules;
import com.duohub.gameservice.games.session.domain.rule.GameRulesRegistry;
import com.duohub.gameservice.games.session.domain.rule.MoveVerdict;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;
import com.duohub.gameservice.games.session.service.GameSessionException;
import com.duohub.gameservice.games.session.service.GameSessionService;
import com.duohub.gameservice.games.session.service.MoveOutcome;
import com.duohub.gameservice.games.session.service.SessionErrorCode;
import com.duohub.partnernotifier.PartnerNotifier;
import com.duohub.partnernotifier.event.PartnerNotification;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 会话状态机实现。
 *
 * 走子检查顺序：
 *   会话存在 → 重复指纹（幂等返回）→ 惰性过期 → 状态可玩 → 参与者 / 回合 → 校验器。
 * 校验不通过：只记扣分，会话不变；
 * 校验通过：折叠 → 完成判定 → 交换回合或结束 → 本地提交（远端异步）→ 发奖 → 通知。
 */
@Slf4j
public class GameSessionServiceImpl implements GameSessionService {

    static final String INITIAL_SLOT_PREFIX = "initial-";
    static final String AFTER_SLOT_PREFIX = "after-";
    static final String REFILL_SLOT_PREFIX = "refill-";

    private final LocalSessionCache local;
    private final SessionSynchronizer synchronizer;
    private final GameRulesRegistry rulesRegistry;
    private final RewardScheduleRegistry schedules;
    private final RewardIssuer rewards;
    private final SessionFactory factory;
    private final WordPairBank wordPairs;
    private final PartnerNotifier notifier;
    private final SessionEventBus events;
    private final Clock clock;

    private final Map<String, PollHandle> watchers = new ConcurrentHashMap<>();

    public GameSessionServiceImpl(LocalSessionCache local,
                                  SessionSynchronizer synchronizer,
                                  GameRulesRegistry rulesRegistry,
                                  RewardScheduleRegistry schedules,
                                  RewardIssuer rewards,
                                  SessionFactory factory,
                                  WordPairBank wordPairs,
                                  PartnerNotifier notifier,
                                  SessionEventBus events,
                                  Clock clock) {
        this.local = local;
        this.synchronizer = synchronizer;
        this.rulesRegistry = rulesRegistry;
        this.schedules = schedules;
        this.rewards = rewards;
        this.factory = factory;
        this.wordPairs = wordPairs;
        this.notifier = notifier;
        this.events = events;
        this.clock = clock;
    }

    // =========================== 建局 ===========================

    @Override
    public CompletableFuture<GameSession> openSession(String self, String partner, GameKind kind) {
        if (!kind.singletonPerDay()) {
            throw new IllegalArgumentException("NOT_A_SINGLETON_KIND: " + kind.wireName());
        }
        String pairKey = PairKeys.of(self, partner);
        Optional<GameSession> active = playable(synchronizer.refresh(pairKey, kind)).stream().findFirst();
        if (active.isPresent()) {
            return CompletableFuture.completedFuture(active.get());
        }
        String slot = factory.today();
        return synchronizer.findOrCreate(self, partner, kind, slot, () -> factory.singleton(kind, self, partner, slot))
                .thenApply(res -> {
                    if (res.createdHere()) {
                        notifyPartner(PartnerNotification.Type.SESSION_CREATED, res.session(), self, "今天的新游戏已就绪");
                    }
                    return res.session();
                });
    }

    @Override
    public CompletableFuture<List<GameSession>> ensureLadders(String self, String partner) {
        String pairKey = PairKeys.of(self, partner);
        List<GameSession> known = expireDue(synchronizer.refresh(pairKey, GameKind.LADDER));
        int missing = GameKind.LADDER.maxActivePerPair() - playable(known).size();
        if (missing <= 0) {
            return CompletableFuture.completedFuture(playable(known));
        }
        // 先手顺序：创建方、等待方、创建方
        List<String> order = PairKeys.sorted(self, partner);
        List<String> slots = known.isEmpty() ? initialSlots() : refillSlots(known, missing);
        Set<String> inPlay = playable(known).stream()
                .map(s -> ((LadderState) s.getState()).getWordPairId())
                .collect(Collectors.toCollection(HashSet::new));
        List<WordPair> initial = wordPairs.initialPairs();
        List<CompletableFuture<SlotResolution>> futures = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            String slot = slots.get(i);
            String firstTurn = order.get(i % 2);
            WordPair pair = known.isEmpty() ? initial.get(i % initial.size()) : wordPairs.randomPair(inPlay);
            inPlay.add(pair.id());
            futures.add(synchronizer.findOrCreate(self, partner, GameKind.LADDER, slot,
                    () -> factory.ladder(self, partner, firstTurn, pair, slot)));
        }
        if (!known.isEmpty()) {
            log.info("单词阶梯不足，补齐: pairKey={}, active={}, slots={}", pairKey, playable(known).size(), slots);
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    futures.stream().map(CompletableFuture::join)
                            .filter(SlotResolution::createdHere)
                            .forEach(res -> notifyPartner(PartnerNotification.Type.SESSION_CREATED, res.session(), self,
                                    ((LadderState) res.session().getState()).getStartWord() + " → "
                                            + ((LadderState) res.session().getState()).getEndWord()));
                    return playable(local.findByPair(pairKey, GameKind.LADDER));
                });
    }

    private static List<String> initialSlots() {
        List<String> slots = new ArrayList<>();
        for (int i = 0; i < GameKind.LADDER.maxActivePerPair(); i++) {
            slots.add(INITIAL_SLOT_PREFIX + i);
        }
        return slots;
    }

    /**
     * 补齐用的槽位：refill-0 起第一个没用过的编号。两台设备看到同样的会话集合时算出同样的槽位。
     */
    private static List<String> refillSlots(List<GameSession> known, int missing) {
        Set<String> used = known.stream().map(GameSession::getSlotKey).collect(Collectors.toSet());
        List<String> slots = new ArrayList<>();
        for (int n = 0; slots.size() < missing; n++) {
            String slot = REFILL_SLOT_PREFIX + n;
            if (!used.contains(slot)) {
                slots.add(slot);
            }
        }
        return slots;
    }

    /**
     * 到期的会话先转为 EXPIRED，返回本地最新视图
     */
    private List<GameSession> expireDue(List<GameSession> sessions) {
        long now = clock.millis();
        List<GameSession> result = new ArrayList<>();
        for (GameSession s : sessions) {
            ReentrantLock lock = lockOf(s.getId());
            lock.lock();
            try {
                GameSession cur = local.get(s.getId()).orElse(s);
                expireIfDue(cur, now);
                result.add(cur);
            } finally {
                lock.unlock();
            }
        }
        return result;
    }

    // =========================== 走子 ===========================

    @Override
    public MoveOutcome submitMove(Move move) {
        ReentrantLock lock = lockOf(move.sessionId());
        lock.lock();
        try {
            GameSession session = requireLocal(move.sessionId());
            GameRules<?, ?> rules = rulesRegistry.require(session.getKind());
            if (!rules.payloadType().isInstance(move.payload())) {
                throw new IllegalArgumentException("PAYLOAD_KIND_MISMATCH: " + move.payload().kind().wireName()
                        + " -> " + session.getKind().wireName());
            }
            String fingerprint = move.fingerprint();
            if (session.getAppliedMoves().contains(fingerprint)) {
                log.debug("重复走子，按幂等返回: sessionId={}, fingerprint={}", session.getId(), fingerprint);
                return MoveOutcome.duplicate(session);
            }
            long now = clock.millis();
            ensurePlayable(session, move.submitter(), now);
            return play(rules, session, move, fingerprint, now);
        } finally {
            lock.unlock();
        }
    }

    private <S extends SessionState, P extends MovePayload> MoveOutcome play(GameRules<S, P> rules, GameSession session,
                                                                          Move move, String fingerprint, long now) {
        S state = rules.stateType().cast(session.getState());
        P payload = rules.payloadType().cast(move.payload());
        String submitter = move.submitter();
        String owner = session.getCurrentTurnOwner();
        if (owner != null && !owner.equals(submitter)) {
            Optional<RejectReason> reason = rules.outOfTurnReason(state, submitter);
            if (reason.isPresent()) {
                return MoveOutcome.rejected(session, reason.get(), List.of());
            }
            throw new GameSessionException(SessionErrorCode.NOT_YOUR_TURN, "owner=" + owner);
        }

        RewardSchedule schedule = schedules.require(session.getKind());
        MoveVerdict verdict = rules.validator().validate(state, payload, submitter);
        if (!verdict.valid()) {
            List<Grant> grants = new ArrayList<>();
            if (schedule.invalidPenalty() != 0) {
                rewards.record(session, "penalty:" + fingerprint, schedule.invalidPenalty(), schedule.penaltyReason())
                        .ifPresent(grants::add);
            }
            if (!grants.isEmpty()) {
                synchronizer.commit(session);
                rewards.dispatch(session.getId(), grants);
            }
            log.info("走子被拒绝: sessionId={}, submitter={}, reason={}", session.getId(), submitter, verdict.reason());
            return MoveOutcome.rejected(session.copy(), verdict.reason(), tierKeys(grants));
        }

        rules.apply(state, payload, submitter, now);
        if (session.getStatus() == SessionStatus.YIELDED) {
            rules.onTurnResumed(state);
            session.setStatus(SessionStatus.ACTIVE);
        }
        session.getAppliedMoves().add(fingerprint);
        session.setVersion(session.getVersion() + 1);
        session.setLastActor(submitter);

        List<Grant> grants = new ArrayList<>();
        if (schedule.perMove() != 0) {
            rewards.record(session, "move:" + fingerprint, schedule.perMove(), schedule.moveReason())
                    .ifPresent(grants::add);
        }
        boolean completed = rules.isComplete(state);
        if (completed) {
            session.setStatus(SessionStatus.COMPLETED);
            session.setCompletedAt(now);
            session.setCurrentTurnOwner(null);
            session.setLastAction("completed");
            grants.addAll(completionGrants(rules, state, session, schedule));
        } else {
            session.setCurrentTurnOwner(rules.nextTurnOwner(session, submitter));
            session.setLastAction("move");
        }

        synchronizer.commit(session);
        rewards.dispatch(session.getId(), grants);
        GameSession view = session.copy();
        log.info("走子成功: sessionId={}, kind={}, submitter={}, version={}, completed={}",
                view.getId(), view.getKind(), submitter, view.getVersion(), completed);

        notifyPartner(completed ? PartnerNotification.Type.COMPLETED : PartnerNotification.Type.MOVE_MADE,
                view, submitter, rules.summary(state));
        events.publish(new SessionEvent(completed ? SessionEvent.Type.COMPLETED : SessionEvent.Type.MOVE_APPLIED,
                view, submitter, now));
        if (completed && view.getKind() == GameKind.LADDER) {
            replenishLadders(view, submitter);
        }
        return completed ? MoveOutcome.completed(view, tierKeys(grants)) : MoveOutcome.accepted(view, tierKeys(grants));
    }

    private <S extends SessionState> List<Grant> completionGrants(GameRules<S, ?> rules, S state,
                                                                  GameSession session, RewardSchedule schedule) {
        List<Grant> grants = new ArrayList<>();
        if (schedule.completion() != 0) {
            rewards.record(session, "completion", schedule.completion(), schedule.completionReason())
                    .ifPresent(grants::add);
        }
        OptionalInt metric = rules.qualityMetric(state, session);
        if (metric.isPresent()) {
            schedule.tiers().match(metric.getAsInt()).ifPresent(tier -> {
                rewards.record(session, "tier:" + tier.key(), tier.amount(), tier.reason()).ifPresent(grants::add);
                if (tier.badge() != null) {
                    rewards.recordBadge(session, tier.badge()).ifPresent(grants::add);
                }
            });
        }
        return grants;
    }

    @Override
    public List<String> settleCompletion(String sessionId) {
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            GameSession session = requireLocal(sessionId);
            if (session.getStatus() != SessionStatus.COMPLETED) {
                throw new GameSessionException(SessionErrorCode.SESSION_NOT_COMPLETED, sessionId);
            }
            List<Grant> grants = settle(rulesRegistry.require(session.getKind()), session);
            if (!grants.isEmpty()) {
                synchronizer.commit(session);
                rewards.dispatch(sessionId, grants);
                log.info("补发完成奖励: sessionId={}, tiers={}", sessionId, tierKeys(grants));
            }
            return tierKeys(grants);
        } finally {
            lock.unlock();
        }
    }

    private <S extends SessionState, P extends MovePayload> List<Grant> settle(GameRules<S, P> rules, GameSession session) {
        S state = rules.stateType().cast(session.getState());
        return completionGrants(rules, state, session, schedules.require(session.getKind()));
    }

    /**
     * 单词阶梯完成后补一局：对方先手，题目尽量避开在玩的
     */
    private void replenishLadders(GameSession completed, String completer) {
        String pairKey = completed.getPairKey();
        List<GameSession> ladders = local.findByPair(pairKey, GameKind.LADDER);
        List<GameSession> active = playable(ladders);
        if (active.size() >= GameKind.LADDER.maxActivePerPair()) {
            return;
        }
        String slot = AFTER_SLOT_PREFIX + completed.getId();
        if (ladders.stream().anyMatch(s -> slot.equals(s.getSlotKey()))) {
            return;
        }
        Set<String> inPlay = active.stream()
                .map(s -> ((LadderState) s.getState()).getWordPairId())
                .collect(Collectors.toSet());
        String partner = completed.partnerOf(completer);
        GameSession next = factory.ladder(completer, partner, partner, wordPairs.randomPair(inPlay), slot);
        synchronizer.commit(next);
        GameSession view = next.copy();
        log.info("单词阶梯补局: pairKey={}, sessionId={}, firstTurn={}", pairKey, view.getId(), partner);
        events.publish(new SessionEvent(SessionEvent.Type.CREATED, view, completer, clock.millis()));
        LadderState st = (LadderState) view.getState();
        notifyPartner(PartnerNotification.Type.SESSION_CREATED, view, completer,
                "新的单词阶梯 " + st.getStartWord() + " → " + st.getEndWord() + "，你先走");
    }

    // =========================== 让步 ===========================

    @Override
    public GameSession yieldTurn(String sessionId, String participant) {
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            GameSession session = requireLocal(sessionId);
            GameRules<?, ?> rules = rulesRegistry.require(session.getKind());
            if (!rules.supportsYield()) {
                throw new GameSessionException(SessionErrorCode.YIELD_NOT_SUPPORTED, session.getKind().wireName());
            }
            long now = clock.millis();
            ensurePlayable(session, participant, now);
            if (!participant.equals(session.getCurrentTurnOwner())) {
                throw new GameSessionException(SessionErrorCode.NOT_YOUR_TURN, "owner=" + session.getCurrentTurnOwner());
            }
            recordYield(rules, session, participant, now);
            String partner = session.partnerOf(participant);
            session.setStatus(SessionStatus.YIELDED);
            session.setCurrentTurnOwner(partner);
            session.setVersion(session.getVersion() + 1);
            session.setLastAction("yielded");
            session.setLastActor(participant);
            synchronizer.commit(session);

            GameSession view = session.copy();
            log.info("让出回合: sessionId={}, from={}, to={}", sessionId, participant, partner);
            notifyPartner(PartnerNotification.Type.YIELDED, view, participant, "对方把回合让给了你");
            events.publish(new SessionEvent(SessionEvent.Type.YIELDED, view, participant, now));
            return view;
        } finally {
            lock.unlock();
        }
    }

    private <S extends SessionState, P extends MovePayload> void recordYield(GameRules<S, P> rules, GameSession session,
                                                                          String participant, long now) {
        rules.onYield(rules.stateType().cast(session.getState()), participant, now);
    }

    // =========================== 查询 ===========================

    @Override
    public GameSession getSession(String sessionId) {
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            GameSession session = requireLocal(sessionId);
            expireIfDue(session, clock.millis());
            return session;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GameSession locateSession(GameKind kind, String sessionId) {
        if (local.get(sessionId).isEmpty()) {
            synchronizer.recover(kind, sessionId)
                    .orElseThrow(() -> new GameSessionException(SessionErrorCode.SESSION_NOT_FOUND, sessionId));
        }
        GameSession session = getSession(sessionId);
        if (session.getKind() != kind) {
            throw new GameSessionException(SessionErrorCode.WRONG_KIND, kind.wireName());
        }
        return session;
    }

    @Override
    public List<GameSession> listSessions(String pairKey, GameKind kind) {
        List<GameSession> result = expireDue(synchronizer.refresh(pairKey, kind));
        result.sort(Comparator.comparingLong(GameSession::getCreatedAt).thenComparing(GameSession::getId));
        return result;
    }

    @Override
    public boolean hasUserAnswered(String sessionId, String userId) {
        GameSession session = getSession(sessionId);
        if (!(session.getState() instanceof QuizState quiz)) {
            throw new GameSessionException(SessionErrorCode.WRONG_KIND, session.getKind().wireName());
        }
        return quiz.hasAnswered(userId);
    }

    // =========================== 轮询 ===========================

    @Override
    public PollHandle watchPair(String self, String partner) {
        String pairKey = PairKeys.of(self, partner);
        return watchers.computeIfAbsent(pairKey,
                k -> synchronizer.startPolling(k, EnumSet.allOf(GameKind.class)));
    }

    @Override
    public void unwatchPair(String self, String partner) {
        PollHandle handle = watchers.remove(PairKeys.of(self, partner));
        if (handle != null) {
            handle.cancel();
        }
    }

    /**
     * 停止所有轮询
     */
    public void shutdown() {
        watchers.values().forEach(PollHandle::cancel);
        watchers.clear();
    }

    // =========================== 内部 ===========================

    private GameSession requireLocal(String sessionId) {
        return local.get(sessionId)
                .orElseThrow(() -> new GameSessionException(SessionErrorCode.SESSION_NOT_FOUND, sessionId));
    }

    private void ensurePlayable(GameSession session, String actor, long now) {
        if (expireIfDue(session, now)) {
            throw new GameSessionException(SessionErrorCode.SESSION_EXPIRED, session.getId());
        }
        if (!session.getStatus().playable()) {
            throw new GameSessionException(SessionErrorCode.SESSION_CLOSED, session.getStatus().name());
        }
        if (!session.hasParticipant(actor)) {
            throw new GameSessionException(SessionErrorCode.NOT_A_PARTICIPANT, actor);
        }
    }

    /**
     * 惰性过期：到期的可玩会话在访问时转为 EXPIRED
     */
    private boolean expireIfDue(GameSession session, long now) {
        if (!session.getStatus().playable() || session.getExpiresAt() <= 0 || now < session.getExpiresAt()) {
            return false;
        }
        session.setStatus(SessionStatus.EXPIRED);
        session.setCurrentTurnOwner(null);
        session.setVersion(session.getVersion() + 1);
        session.setLastAction("expired");
        session.setLastActor(null);
        synchronizer.commit(session);
        log.info("会话已过期: sessionId={}, kind={}", session.getId(), session.getKind());
        events.publish(new SessionEvent(SessionEvent.Type.EXPIRED, session.copy(), null, now));
        return true;
    }

    private List<GameSession> playable(List<GameSession> sessions) {
        long now = clock.millis();
        return sessions.stream()
                .filter(s -> s.getStatus().playable() && (s.getExpiresAt() <= 0 || now < s.getExpiresAt()))
                .sorted(Comparator.comparingLong(GameSession::getCreatedAt).thenComparing(GameSession::getId))
                .collect(Collectors.toList());
    }

    private void notifyPartner(PartnerNotification.Type type, GameSession session, String sender, String summary) {
        try {
            notifier.notifyPartner(PartnerNotification.of(type, session.getPairKey(), session.getId(),
                    session.getKind().wireName(), sender, session.partnerOf(sender), summary));
        } catch (Exception e) {
            log.warn("伴侣通知发送失败: sessionId={}, type={}, err={}", session.getId(), type, e.toString());
        }
    }

    /**
     * 与同步器共用会话锁：远端快照覆盖本地时不会插进一次走子的读改写中间
     */
    private ReentrantLock lockOf(String sessionId) {
        return synchronizer.lockOf(sessionId);
    }

    private static List<String> tierKeys(List<Grant> grants) {
        return grants.stream().map(Grant::tierKey).collect(Collectors.toList());
    }
}
