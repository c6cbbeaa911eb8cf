package com.duohub.gameservice.games.session.service.impl;

import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.ladder.domain.LadderWord;
import com.duohub.gameservice.games.memoryflip.domain.CardPair;
import com.duohub.gameservice.games.memoryflip.domain.MemoryCard;
import com.duohub.gameservice.games.memoryflip.domain.MemoryFlipState;
import com.duohub.gameservice.games.quiz.domain.QuizAnswers;
import com.duohub.gameservice.games.quiz.domain.QuizState;
import com.duohub.gameservice.games.session.application.event.SessionEvent;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.Move;
import com.duohub.gameservice.games.session.domain.model.SessionStatus;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;
import com.duohub.gameservice.games.session.infrastructure.local.InMemoryLocalSessionCache;
import com.duohub.gameservice.games.session.service.GameSessionException;
import com.duohub.gameservice.games.session.service.MoveOutcome;
import com.duohub.gameservice.games.session.service.SessionErrorCode;
import com.duohub.gameservice.games.session.support.Device;
import com.duohub.gameservice.games.session.support.InMemoryAuthoritativeStore;
import com.duohub.gameservice.games.session.support.InMemoryRemoteSessionStore;
import com.duohub.gameservice.games.session.support.MutableClock;
import com.duohub.gameservice.games.session.support.RecordingRewardLedger;
import com.duohub.partnernotifier.event.PartnerNotification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class GameSessionServiceImplTest {

    private static final String PAIR = "alice_bob";

    private MutableClock clock;
    private InMemoryRemoteSessionStore remote;
    private InMemoryAuthoritativeStore backend;
    private RecordingRewardLedger ledger;
    private Device alice;
    private Device bob;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T02:00:00Z"), ZoneId.of("Asia/Shanghai"));
        remote = new InMemoryRemoteSessionStore();
        backend = new InMemoryAuthoritativeStore();
        ledger = new RecordingRewardLedger();
        alice = new Device("alice", "bob", remote, backend, ledger, clock);
        bob = new Device("bob", "alice", remote, backend, ledger, clock);
    }

    @AfterEach
    void tearDown() {
        alice.close();
        bob.close();
    }

    // ---------------- 单词阶梯 ----------------

    @Test
    void initialLaddersAlternateFirstTurnAndAreSharedByBothDevices() {
        List<GameSession> created = alice.service.ensureLadders("alice", "bob").join();
        assertThat(created).extracting(GameSession::getSlotKey, GameSession::getCurrentTurnOwner)
                .containsExactlyInAnyOrder(
                        tuple("initial-0", "alice"),
                        tuple("initial-1", "bob"),
                        tuple("initial-2", "alice"));

        List<GameSession> seenByBob = bob.service.ensureLadders("bob", "alice").join();
        assertThat(seenByBob).extracting(GameSession::getId)
                .containsExactlyInAnyOrderElementsOf(created.stream().map(GameSession::getId).collect(Collectors.toList()));
        assertThat(remote.size()).isEqualTo(3);
        assertThat(alice.notifier.sent).hasSize(3)
                .allMatch(n -> n.getType() == PartnerNotification.Type.SESSION_CREATED && "bob".equals(n.getRecipientId()));
        assertThat(bob.notifier.sent).isEmpty();
    }

    @Test
    void ladderPlayedAcrossDevicesCompletesWithAllRewardsAndReplenishes() {
        alice.service.ensureLadders("alice", "bob").join();
        bob.service.ensureLadders("bob", "alice").join();
        String id = ladderInSlot(alice, "initial-0").getId();

        MoveOutcome first = alice.service.submitMove(move(id, "alice", new LadderWord("cot")));
        assertThat(first.result()).isEqualTo(MoveOutcome.Result.ACCEPTED);
        assertThat(first.session().getCurrentTurnOwner()).isEqualTo("bob");

        bob.service.listSessions(PAIR, GameKind.LADDER);
        MoveOutcome second = bob.service.submitMove(move(id, "bob", new LadderWord("COG")));
        assertThat(second.result()).isEqualTo(MoveOutcome.Result.ACCEPTED);

        alice.service.listSessions(PAIR, GameKind.LADDER);
        MoveOutcome last = alice.service.submitMove(move(id, "alice", new LadderWord("DOG")));

        assertThat(last.result()).isEqualTo(MoveOutcome.Result.COMPLETED);
        assertThat(last.grantedTiers()).contains("completion", "tier:optimal-bonus");
        GameSession done = last.session();
        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getCurrentTurnOwner()).isNull();
        assertThat(((LadderState) done.getState()).getWordChain()).containsExactly("CAT", "COT", "COG", "DOG");
        assertThat(done.getRewardsIssued().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(70);
        assertThat(ledger.total()).isEqualTo(70);
        assertThat(remote.peek(id).orElseThrow().getVersion()).isEqualTo(3L);

        // 完成后补一局，对方先手
        GameSession replenished = ladderInSlot(alice, "after-" + id);
        assertThat(replenished.getCurrentTurnOwner()).isEqualTo("bob");
        assertThat(alice.service.listSessions(PAIR, GameKind.LADDER))
                .filteredOn(s -> s.getStatus().playable()).hasSize(3);

        List<GameSession> bobView = bob.service.listSessions(PAIR, GameKind.LADDER);
        assertThat(bobView).hasSize(4);
        assertThat(bobView).filteredOn(s -> s.getId().equals(id))
                .singleElement().extracting(GameSession::getStatus).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void ladderCompletedPastOptimalPathEarnsNoBonus() {
        alice.service.ensureLadders("alice", "bob").join();
        bob.service.ensureLadders("bob", "alice").join();
        String id = ladderInSlot(alice, "initial-0").getId();

        // CAT → HAT → HOT → COT → COG → DOG，比最优路径多两步
        List<String> words = List.of("HAT", "HOT", "COT", "COG", "DOG");
        MoveOutcome last = null;
        for (int i = 0; i < words.size(); i++) {
            Device mover = i % 2 == 0 ? alice : bob;
            mover.service.listSessions(PAIR, GameKind.LADDER);
            last = mover.service.submitMove(move(id, mover.user, new LadderWord(words.get(i))));
        }

        assertThat(last.result()).isEqualTo(MoveOutcome.Result.COMPLETED);
        assertThat(last.grantedTiers()).contains("completion").doesNotContain("tier:optimal-bonus");
        assertThat(((LadderState) last.session().getState()).stepCount()).isEqualTo(5);
        assertThat(last.session().getRewardsIssued()).doesNotContainKey("tier:optimal-bonus");
        assertThat(ledger.total()).isEqualTo(5 * 10 + 30);
    }

    @Test
    void expiredLaddersAreToppedBackUpToThree() {
        List<String> initialIds = alice.service.ensureLadders("alice", "bob").join().stream()
                .map(GameSession::getId).collect(Collectors.toList());
        bob.service.ensureLadders("bob", "alice").join();
        String id = ladderInSlot(alice, "initial-0").getId();
        alice.service.submitMove(move(id, "alice", new LadderWord("COT")));

        clock.advance(Duration.ofDays(8));
        List<GameSession> refilled = alice.service.ensureLadders("alice", "bob").join();

        assertThat(refilled).extracting(GameSession::getSlotKey, GameSession::getCurrentTurnOwner)
                .containsExactlyInAnyOrder(
                        tuple("refill-0", "alice"),
                        tuple("refill-1", "bob"),
                        tuple("refill-2", "alice"));
        assertThat(refilled).extracting(GameSession::getId).doesNotContainAnyElementsOf(initialIds);
        assertThat(remote.peek(id).orElseThrow().getStatus()).isEqualTo(SessionStatus.EXPIRED);

        List<GameSession> seenByBob = bob.service.ensureLadders("bob", "alice").join();
        assertThat(seenByBob).extracting(GameSession::getId)
                .containsExactlyInAnyOrderElementsOf(refilled.stream().map(GameSession::getId).collect(Collectors.toList()));
        assertThat(remote.size()).isEqualTo(6);
    }

    @Test
    void outOfTurnMoveIsRejected() {
        alice.service.ensureLadders("alice", "bob").join();
        bob.service.ensureLadders("bob", "alice").join();
        String id = ladderInSlot(bob, "initial-0").getId();

        assertThatThrownBy(() -> bob.service.submitMove(move(id, "bob", new LadderWord("COT"))))
                .isInstanceOf(GameSessionException.class)
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.NOT_YOUR_TURN);
        assertThatThrownBy(() -> bob.service.submitMove(move(id, "carol", new LadderWord("COT"))))
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.NOT_A_PARTICIPANT);
        assertThat(bob.service.getSession(id).getVersion()).isZero();
    }

    @Test
    void resubmittedMoveIsReportedAsDuplicate() {
        alice.service.ensureLadders("alice", "bob").join();
        String id = ladderInSlot(alice, "initial-0").getId();

        alice.service.submitMove(move(id, "alice", new LadderWord("COT")));
        int awards = ledger.awards.size();
        MoveOutcome again = alice.service.submitMove(move(id, "alice", new LadderWord("COT")));

        assertThat(again.result()).isEqualTo(MoveOutcome.Result.DUPLICATE);
        assertThat(again.session().getVersion()).isEqualTo(1L);
        assertThat(ledger.awards).hasSize(awards);
    }

    @Test
    void invalidWordCostsPenaltyOnceAndLeavesSessionUnchanged() {
        alice.service.ensureLadders("alice", "bob").join();
        String id = ladderInSlot(alice, "initial-0").getId();

        MoveOutcome rejected = alice.service.submitMove(move(id, "alice", new LadderWord("CXT")));
        assertThat(rejected.result()).isEqualTo(MoveOutcome.Result.REJECTED);
        assertThat(rejected.reason()).isEqualTo(RejectReason.NOT_A_VALID_WORD);
        assertThat(rejected.grantedTiers()).containsExactly("penalty:alice/word:CXT");
        assertThat(rejected.session().getVersion()).isZero();
        assertThat(rejected.session().getCurrentTurnOwner()).isEqualTo("alice");

        MoveOutcome repeated = alice.service.submitMove(move(id, "alice", new LadderWord("CXT")));
        assertThat(repeated.grantedTiers()).isEmpty();
        assertThat(ledger.awards).extracting(RecordingRewardLedger.Award::amount).containsExactly(-2);
        assertThat(remote.peek(id).orElseThrow().getRewardsIssued()).containsEntry("penalty:alice/word:CXT", -2);

        MoveOutcome notAdjacent = alice.service.submitMove(move(id, "alice", new LadderWord("DOG")));
        assertThat(notAdjacent.reason()).isEqualTo(RejectReason.NOT_ONE_EDIT_AWAY);
    }

    @Test
    void yieldHandsTurnToPartnerUntilTheyMove() {
        alice.service.ensureLadders("alice", "bob").join();
        bob.service.ensureLadders("bob", "alice").join();
        String id = ladderInSlot(alice, "initial-0").getId();

        GameSession yielded = alice.service.yieldTurn(id, "alice");
        assertThat(yielded.getStatus()).isEqualTo(SessionStatus.YIELDED);
        assertThat(yielded.getCurrentTurnOwner()).isEqualTo("bob");
        assertThat(((LadderState) yielded.getState()).getYieldedBy()).isEqualTo("alice");
        assertThatThrownBy(() -> alice.service.submitMove(move(id, "alice", new LadderWord("COT"))))
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.NOT_YOUR_TURN);

        bob.service.listSessions(PAIR, GameKind.LADDER);
        MoveOutcome moved = bob.service.submitMove(move(id, "bob", new LadderWord("COT")));
        assertThat(moved.session().getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(moved.session().getCurrentTurnOwner()).isEqualTo("alice");
        assertThat(((LadderState) moved.session().getState()).getYieldedBy()).isNull();
        assertThat(((LadderState) moved.session().getState()).getYieldCount()).isEqualTo(1);
        assertThat(alice.notifier.sent).extracting(PartnerNotification::getType).contains(PartnerNotification.Type.YIELDED);
    }

    @Test
    void payloadOfAnotherKindIsRefused() {
        alice.service.ensureLadders("alice", "bob").join();
        String id = ladderInSlot(alice, "initial-0").getId();

        assertThatThrownBy(() -> alice.service.submitMove(move(id, "alice", new QuizAnswers(List.of(1, 2, 3)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PAYLOAD_KIND_MISMATCH");
    }

    // ---------------- 默契问答 ----------------

    @Test
    void perfectQuizGrantsTopTierAndBadgeExactlyOnce() {
        GameSession quiz = alice.service.openSession("alice", "bob", GameKind.QUIZ).join();
        GameSession sameQuiz = bob.service.openSession("bob", "alice", GameKind.QUIZ).join();
        assertThat(sameQuiz.getId()).isEqualTo(quiz.getId());
        assertThat(quiz.getCurrentTurnOwner()).isNull();
        String id = quiz.getId();

        alice.service.submitMove(move(id, "alice", new QuizAnswers(List.of(0, 1, 2, 3, 0))));
        assertThat(alice.service.hasUserAnswered(id, "alice")).isTrue();
        assertThat(alice.service.hasUserAnswered(id, "bob")).isFalse();
        assertThat(alice.service.getSession(id).getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(alice.notifier.sent).extracting(PartnerNotification::getType, PartnerNotification::getRecipientId)
                .contains(tuple(PartnerNotification.Type.MOVE_MADE, "bob"));

        MoveOutcome twice = alice.service.submitMove(move(id, "alice", new QuizAnswers(List.of(2, 2, 2, 2, 2))));
        assertThat(twice.result()).isEqualTo(MoveOutcome.Result.REJECTED);
        assertThat(twice.reason()).isEqualTo(RejectReason.ALREADY_ANSWERED);

        bob.service.listSessions(PAIR, GameKind.QUIZ);
        MoveOutcome done = bob.service.submitMove(move(id, "bob", new QuizAnswers(List.of(0, 1, 2, 3, 0))));
        assertThat(done.result()).isEqualTo(MoveOutcome.Result.COMPLETED);
        assertThat(((QuizState) done.session().getState()).getMatchPercentage()).isEqualTo(100);
        assertThat(done.grantedTiers()).containsExactly("tier:sync-100", "badge:PERFECT_SYNC");

        assertThat(bob.service.settleCompletion(id)).isEmpty();
        alice.service.listSessions(PAIR, GameKind.QUIZ);
        assertThat(alice.service.settleCompletion(id)).isEmpty();

        assertThat(ledger.badges).containsExactly(id + ":PERFECT_SYNC");
        assertThat(ledger.awards).extracting(RecordingRewardLedger.Award::tierKey).containsExactly("tier:sync-100");
        assertThat(ledger.total()).isEqualTo(50);
    }

    @Test
    void fourOfFiveMatchingAnswersPayTheEightyTierWithoutBadge() {
        String id = alice.service.openSession("alice", "bob", GameKind.QUIZ).join().getId();
        bob.service.openSession("bob", "alice", GameKind.QUIZ).join();

        MoveOutcome wrongCount = alice.service.submitMove(move(id, "alice", new QuizAnswers(List.of(0, 1, 2))));
        assertThat(wrongCount.reason()).isEqualTo(RejectReason.WRONG_ANSWER_COUNT);

        alice.service.submitMove(move(id, "alice", new QuizAnswers(List.of(3, 1, 0, 2, 1))));
        bob.service.listSessions(PAIR, GameKind.QUIZ);
        MoveOutcome done = bob.service.submitMove(move(id, "bob", new QuizAnswers(List.of(3, 1, 0, 2, 0))));

        assertThat(done.result()).isEqualTo(MoveOutcome.Result.COMPLETED);
        assertThat(((QuizState) done.session().getState()).getMatchPercentage()).isEqualTo(80);
        assertThat(done.grantedTiers()).containsExactly("tier:sync-80");
        assertThat(ledger.badges).isEmpty();
        assertThat(ledger.total()).isEqualTo(40);
    }

    @Test
    void settlingUnfinishedSessionFails() {
        GameSession quiz = alice.service.openSession("alice", "bob", GameKind.QUIZ).join();
        assertThatThrownBy(() -> alice.service.settleCompletion(quiz.getId()))
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.SESSION_NOT_COMPLETED);
        assertThatThrownBy(() -> alice.service.yieldTurn(quiz.getId(), "alice"))
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.YIELD_NOT_SUPPORTED);
    }

    @Test
    void expiredSessionRejectsMovesAndTomorrowGetsANewOne() {
        GameSession quiz = alice.service.openSession("alice", "bob", GameKind.QUIZ).join();
        clock.advance(Duration.ofHours(25));

        assertThatThrownBy(() -> alice.service.submitMove(move(quiz.getId(), "alice", new QuizAnswers(List.of(0, 0, 0, 0, 0)))))
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.SESSION_EXPIRED);
        assertThat(alice.service.getSession(quiz.getId()).getStatus()).isEqualTo(SessionStatus.EXPIRED);
        assertThat(remote.peek(quiz.getId()).orElseThrow().getStatus()).isEqualTo(SessionStatus.EXPIRED);
        assertThat(alice.seen).extracting(SessionEvent::type).contains(SessionEvent.Type.EXPIRED);

        GameSession tomorrow = alice.service.openSession("alice", "bob", GameKind.QUIZ).join();
        assertThat(tomorrow.getId()).isNotEqualTo(quiz.getId());
        assertThat(tomorrow.getSlotKey()).isEqualTo("2026-03-02");
    }

    // ---------------- 记忆翻牌 ----------------

    @Test
    void waiterAdoptsCreatorsMemoryFlipDeck() {
        GameSession created = alice.service.openSession("alice", "bob", GameKind.MEMORY_FLIP).join();
        GameSession adopted = bob.service.openSession("bob", "alice", GameKind.MEMORY_FLIP).join();

        assertThat(adopted.getId()).isEqualTo(created.getId());
        assertThat(((MemoryFlipState) adopted.getState()).getCards())
                .extracting(MemoryCard::getId)
                .containsExactlyElementsOf(((MemoryFlipState) created.getState()).getCards().stream()
                        .map(MemoryCard::getId).collect(Collectors.toList()));
        assertThat(remote.size()).isEqualTo(1);
    }

    @Test
    void waiterCreatesWhenCreatorNeverShowsUp() {
        GameSession mine = bob.service.openSession("bob", "alice", GameKind.MEMORY_FLIP).join();
        assertThat(mine.getCreatedBy()).isEqualTo("bob");

        GameSession later = alice.service.openSession("alice", "bob", GameKind.MEMORY_FLIP).join();
        assertThat(later.getId()).isEqualTo(mine.getId());
    }

    @Test
    void memoryFlipIsTurnFreeAndTierDependsOnDaysTaken() {
        String id = alice.service.openSession("alice", "bob", GameKind.MEMORY_FLIP).join().getId();
        bob.service.openSession("bob", "alice", GameKind.MEMORY_FLIP).join();
        List<CardPair> pairs = pairsOf((MemoryFlipState) alice.service.getSession(id).getState());

        alice.service.submitMove(move(id, "alice", pairs.get(0)));
        bob.service.listSessions(PAIR, GameKind.MEMORY_FLIP);
        bob.service.submitMove(move(id, "bob", pairs.get(1)));
        alice.service.listSessions(PAIR, GameKind.MEMORY_FLIP);

        clock.advance(Duration.ofHours(25));
        MoveOutcome done = alice.service.submitMove(move(id, "alice", pairs.get(2)));

        assertThat(done.result()).isEqualTo(MoveOutcome.Result.COMPLETED);
        assertThat(done.grantedTiers()).contains("completion", "tier:next-day");
        assertThat(done.session().getRewardsIssued()).containsEntry("tier:next-day", 20).containsEntry("completion", 50);
        assertThat(ledger.total()).isEqualTo(3 * 10 + 50 + 20);
    }

    @Test
    void partnerSnapshotLandingMidMoveDoesNotLeaveDevicesDiverged() throws Exception {
        InterceptingCache cache = new InterceptingCache();
        try (Device phone = new Device("alice", "bob", remote, backend, ledger, clock, cache)) {
            String id = phone.service.openSession("alice", "bob", GameKind.MEMORY_FLIP).join().getId();
            bob.service.openSession("bob", "alice", GameKind.MEMORY_FLIP).join();
            List<CardPair> pairs = pairsOf((MemoryFlipState) phone.service.getSession(id).getState());
            bob.service.submitMove(move(id, "bob", pairs.get(0)));

            // alice 读到旧副本之后，另一线程立刻拉取 bob 的新快照
            CountDownLatch refreshed = new CountDownLatch(1);
            AtomicBoolean refreshedInsideMove = new AtomicBoolean();
            cache.afterNextGet(() -> {
                new Thread(() -> {
                    phone.synchronizer.refreshOne(PAIR, GameKind.MEMORY_FLIP, id);
                    refreshed.countDown();
                }).start();
                try {
                    refreshedInsideMove.set(refreshed.await(300, TimeUnit.MILLISECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            phone.service.submitMove(move(id, "alice", pairs.get(1)));
            assertThat(refreshed.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(refreshedInsideMove).isFalse();

            phone.service.listSessions(PAIR, GameKind.MEMORY_FLIP);
            phone.synchronizer.flushPending();

            GameSession mine = phone.local.get(id).orElseThrow();
            GameSession shared = remote.peek(id).orElseThrow();
            assertThat(mine.getVersion()).isEqualTo(shared.getVersion());
            assertThat(mine.getAppliedMoves()).isEqualTo(shared.getAppliedMoves());
            assertThat(phone.local.confirmedVersion(id)).isEqualTo(shared.getVersion());
            assertThat(phone.local.pending()).isEmpty();
            assertThat(phone.seen).extracting(SessionEvent::type).contains(SessionEvent.Type.REFRESHED);
        }
    }

    // ---------------- 查询 ----------------

    @Test
    void unknownSessionIsNotFound() {
        assertThatThrownBy(() -> alice.service.getSession("nope"))
                .hasFieldOrPropertyWithValue("code", SessionErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    void freshDeviceRecoversSessionFromBackend() {
        GameSession quiz = alice.service.openSession("alice", "bob", GameKind.QUIZ).join();
        remote.delete(PAIR, GameKind.QUIZ, quiz.getId());

        try (Device newPhone = new Device("bob", "alice", remote, backend, ledger, clock)) {
            assertThatThrownBy(() -> newPhone.service.locateSession(GameKind.LADDER, quiz.getId()))
                    .hasFieldOrPropertyWithValue("code", SessionErrorCode.SESSION_NOT_FOUND);

            GameSession recovered = newPhone.service.locateSession(GameKind.QUIZ, quiz.getId());
            assertThat(recovered.getId()).isEqualTo(quiz.getId());
            assertThat(remote.peek(quiz.getId())).isPresent();
            assertThatThrownBy(() -> newPhone.service.locateSession(GameKind.MEMORY_FLIP, quiz.getId()))
                    .hasFieldOrPropertyWithValue("code", SessionErrorCode.WRONG_KIND);
        }
    }

    /**
     * 读取之后执行一次回调，用来在“读到本地副本”与“提交”之间插入并发操作
     */
    static class InterceptingCache extends InMemoryLocalSessionCache {

        private volatile Runnable afterNextGet;

        void afterNextGet(Runnable hook) {
            this.afterNextGet = hook;
        }

        @Override
        public Optional<GameSession> get(String sessionId) {
            Optional<GameSession> found = super.get(sessionId);
            Runnable hook = afterNextGet;
            if (hook != null) {
                afterNextGet = null;
                hook.run();
            }
            return found;
        }
    }

    private GameSession ladderInSlot(Device d, String slot) {
        return d.local.findByPair(PAIR, GameKind.LADDER).stream()
                .filter(s -> slot.equals(s.getSlotKey()))
                .findFirst()
                .orElseThrow();
    }

    private static Move move(String sessionId, String who, com.duohub.gameservice.games.session.domain.model.MovePayload payload) {
        return new Move(UUID.randomUUID().toString(), sessionId, who, payload);
    }

    private static List<CardPair> pairsOf(MemoryFlipState state) {
        Map<String, List<MemoryCard>> byPair = state.getCards().stream()
                .collect(Collectors.groupingBy(MemoryCard::getPairId));
        return byPair.values().stream()
                .map(cards -> new CardPair(cards.get(0).getId(), cards.get(1).getId()))
                .collect(Collectors.toList());
    }
}
