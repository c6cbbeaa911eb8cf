package com.duohub.gameservice.games.session.config;

import com.duohub.gameservice.games.ladder.content.WordPairBank;
import com.duohub.gameservice.games.ladder.domain.ClasspathWordVocabulary;
import com.duohub.gameservice.games.ladder.domain.WordVocabulary;
import com.duohub.gameservice.games.ladder.rule.LadderMoveValidator;
import com.duohub.gameservice.games.ladder.rule.LadderRules;
import com.duohub.gameservice.games.memoryflip.content.MemoryDeckFactory;
import com.duohub.gameservice.games.memoryflip.rule.MemoryFlipRules;
import com.duohub.gameservice.games.quiz.content.QuizContentSource;
import com.duohub.gameservice.games.quiz.rule.QuizRules;
import com.duohub.gameservice.games.session.application.DeviceRaceArbitrator;
import com.duohub.gameservice.games.session.application.RewardIssuer;
import com.duohub.gameservice.games.session.application.SessionFactory;
import com.duohub.gameservice.games.session.application.SessionSynchronizer;
import com.duohub.gameservice.games.session.application.SyncSettings;
import com.duohub.gameservice.games.session.application.event.SessionEventBus;
import com.duohub.gameservice.games.session.application.event.SessionEventListener;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.repository.AuthoritativeStore;
import com.duohub.gameservice.games.session.domain.repository.LocalSessionCache;
import com.duohub.gameservice.games.session.domain.repository.RemoteSessionStore;
import com.duohub.gameservice.games.session.domain.repository.RewardLedger;
import com.duohub.gameservice.games.session.domain.reward.RewardScheduleRegistry;
import com.duohub.gameservice.games.session.domain.rule.GameRulesRegistry;
import com.duohub.gameservice.games.session.infrastructure.codec.SessionCodec;
import com.duohub.gameservice.games.session.infrastructure.ledger.FeignRewardLedger;
import com.duohub.gameservice.games.session.infrastructure.ledger.RewardLedgerGateway;
import com.duohub.gameservice.games.session.infrastructure.local.FileLocalSessionCache;
import com.duohub.gameservice.games.session.infrastructure.local.InMemoryLocalSessionCache;
import com.duohub.gameservice.games.session.infrastructure.notify.LoggingPartnerNotifier;
import com.duohub.gameservice.games.session.service.impl.GameSessionServiceImpl;
import com.duohub.partnernotifier.PartnerNotifier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.stream.Collectors;

/**
 * SessionEngineConfig
 * ---------------------------------------
 * 会话引擎的装配：规则、奖励表、缓存、同步器、状态机。
 * 引擎本身是普通 Java 类，这里只负责把基础设施拼起来（测试里可以直接 new）。
 */
@Configuration
public class SessionEngineConfig {

    @Bean
    public Clock sessionClock(@Value("${duohub.zone:Asia/Shanghai}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    // ---------------- 规则 ----------------

    @Bean
    public WordVocabulary wordVocabulary() {
        return new ClasspathWordVocabulary();
    }

    @Bean
    public GameRulesRegistry gameRulesRegistry(WordVocabulary vocabulary) {
        return new GameRulesRegistry(List.of(
                new LadderRules(new LadderMoveValidator(vocabulary)),
                new QuizRules(),
                new MemoryFlipRules()));
    }

    @Bean
    public RewardScheduleRegistry rewardScheduleRegistry() {
        return RewardScheduleRegistry.defaults();
    }

    @Bean
    public SessionCodec sessionCodec(GameRulesRegistry rules) {
        return new SessionCodec(rules);
    }

    // ---------------- 内容 ----------------

    @Bean
    public WordPairBank wordPairBank() {
        return new WordPairBank(new SecureRandom());
    }

    @Bean
    public SessionFactory sessionFactory(Clock sessionClock,
                                         GameRulesRegistry rules,
                                         @Value("${duohub.quiz.question-count:5}") int questionCount,
                                         @Value("${duohub.memory-flip.pairs:8}") int pairs,
                                         @Value("${duohub.session.ttl.ladder:7d}") Duration ladderTtl,
                                         @Value("${duohub.session.ttl.quiz:1d}") Duration quizTtl,
                                         @Value("${duohub.session.ttl.memory-flip:3d}") Duration memoryFlipTtl) {
        Map<GameKind, Duration> ttls = new EnumMap<>(GameKind.class);
        ttls.put(GameKind.LADDER, ladderTtl);
        ttls.put(GameKind.QUIZ, quizTtl);
        ttls.put(GameKind.MEMORY_FLIP, memoryFlipTtl);
        Random random = new SecureRandom();
        return new SessionFactory(sessionClock, rules, new QuizContentSource(questionCount),
                new MemoryDeckFactory(random, pairs), ttls);
    }

    // ---------------- 存储与同步 ----------------

    /**
     * 配置了 duohub.local-cache.dir 时落盘，否则仅内存
     */
    @Bean
    public LocalSessionCache localSessionCache(@Value("${duohub.local-cache.dir:}") String dir, SessionCodec codec) {
        if (dir == null || dir.isBlank()) {
            return new InMemoryLocalSessionCache();
        }
        return new FileLocalSessionCache(Path.of(dir), codec);
    }

    @Bean
    public DeviceRaceArbitrator deviceRaceArbitrator(
            @Value("${duohub.sync.tie-break:ID}") DeviceRaceArbitrator.TieBreak tieBreak) {
        return new DeviceRaceArbitrator(tieBreak);
    }

    @Bean
    public SessionEventBus sessionEventBus(ObjectProvider<SessionEventListener> listeners) {
        return new SessionEventBus(listeners.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public SyncSettings syncSettings(@Value("${duohub.sync.waiter-first-delay:2s}") Duration waiterFirstDelay,
                                     @Value("${duohub.sync.waiter-retry-delay:2s}") Duration waiterRetryDelay,
                                     @Value("${duohub.sync.poll-interval:30s}") Duration pollInterval,
                                     @Value("${duohub.sync.conditional-create:false}") boolean conditionalCreate,
                                     @Value("${duohub.sync.slot-claim-ttl:2d}") Duration slotClaimTtl) {
        return new SyncSettings(waiterFirstDelay, waiterRetryDelay, pollInterval, conditionalCreate, slotClaimTtl);
    }

    @Bean
    public SessionSynchronizer sessionSynchronizer(LocalSessionCache local,
                                                   RemoteSessionStore remote,
                                                   AuthoritativeStore backend,
                                                   DeviceRaceArbitrator arbitrator,
                                                   SessionEventBus events,
                                                   @Qualifier("sessionSyncExecutor") ThreadPoolExecutor syncExecutor,
                                                   @Qualifier("sessionPollScheduler") ScheduledThreadPoolExecutor pollScheduler,
                                                   SyncSettings settings,
                                                   Clock sessionClock) {
        return new SessionSynchronizer(local, remote, backend, arbitrator, events,
                syncExecutor, pollScheduler, settings, sessionClock);
    }

    // ---------------- 奖励 ----------------

    @Bean
    public RewardLedger rewardLedger(RewardLedgerGateway gateway,
                                     @Qualifier("sessionSyncExecutor") ThreadPoolExecutor syncExecutor) {
        return new FeignRewardLedger(gateway, syncExecutor);
    }

    @Bean
    public RewardIssuer rewardIssuer(RewardLedger ledger) {
        return new RewardIssuer(ledger);
    }

    // ---------------- 状态机 ----------------

    /**
     * 未启用 Kafka 推送时退化为日志通知
     */
    @Bean
    public GameSessionServiceImpl gameSessionService(LocalSessionCache local,
                                                     SessionSynchronizer synchronizer,
                                                     GameRulesRegistry rules,
                                                     RewardScheduleRegistry schedules,
                                                     RewardIssuer rewardIssuer,
                                                     SessionFactory sessionFactory,
                                                     WordPairBank wordPairBank,
                                                     ObjectProvider<PartnerNotifier> notifiers,
                                                     SessionEventBus events,
                                                     Clock sessionClock) {
        PartnerNotifier notifier = notifiers.getIfAvailable(LoggingPartnerNotifier::new);
        return new GameSessionServiceImpl(local, synchronizer, rules, schedules, rewardIssuer, sessionFactory,
                wordPairBank, notifier, events, sessionClock);
    }
}
