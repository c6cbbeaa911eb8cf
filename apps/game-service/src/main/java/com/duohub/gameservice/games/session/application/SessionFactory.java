package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.ladder.content.WordPair;
import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.memoryflip.content.MemoryDeckFactory;
import com.duohub.gameservice.games.quiz.content.QuizContentSource;
import com.duohub.gameservice.games.quiz.domain.QuizState;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.PairKeys;
import com.duohub.gameservice.games.session.domain.model.SessionState;
import com.duohub.gameservice.games.session.domain.model.SessionStatus;
import com.duohub.gameservice.games.session.domain.rule.GameRulesRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * 按内容源生成新会话（版本 0，状态 ACTIVE）。
 */
public class SessionFactory {

    private final Clock clock;
    private final GameRulesRegistry rules;
    private final QuizContentSource quizContent;
    private final MemoryDeckFactory deckFactory;
    private final Map<GameKind, Duration> ttls;

    public SessionFactory(Clock clock, GameRulesRegistry rules, QuizContentSource quizContent,
                          MemoryDeckFactory deckFactory, Map<GameKind, Duration> ttls) {
        this.clock = clock;
        this.rules = rules;
        this.quizContent = quizContent;
        this.deckFactory = deckFactory;
        this.ttls = ttls;
    }

    /** 单例游戏的槽位：本地日期 yyyy-MM-dd */
    public String today() {
        return LocalDate.now(clock).toString();
    }

    public GameSession ladder(String creator, String partner, String firstTurn, WordPair pair, String slotKey) {
        LadderState state = LadderState.start(pair.id(), pair.startWord(), pair.endWord(),
                pair.language(), pair.optimalSteps());
        return build(GameKind.LADDER, creator, partner, firstTurn, slotKey, state);
    }

    public GameSession singleton(GameKind kind, String creator, String partner, String slotKey) {
        switch (kind) {
            case QUIZ:
                QuizContentSource.QuizSpec spec = quizContent.forDay(LocalDate.now(clock));
                return build(kind, creator, partner, null, slotKey, QuizState.start(spec.quizId(), spec.questionCount()));
            case MEMORY_FLIP:
                return build(kind, creator, partner, null, slotKey, deckFactory.newDeck());
            default:
                throw new IllegalArgumentException("NOT_A_SINGLETON_KIND: " + kind);
        }
    }

    private GameSession build(GameKind kind, String creator, String partner, String firstTurn,
                              String slotKey, SessionState state) {
        long now = clock.millis();
        GameSession s = new GameSession();
        s.setId(UUID.randomUUID().toString());
        s.setParticipants(PairKeys.sorted(creator, partner));
        s.setPairKey(PairKeys.of(creator, partner));
        s.setKind(kind);
        s.setSlotKey(slotKey);
        s.setState(state);
        s.setStatus(SessionStatus.ACTIVE);
        s.setCreatedAt(now);
        s.setCreatedBy(creator);
        s.setExpiresAt(now + ttls.getOrDefault(kind, Duration.ofDays(1)).toMillis());
        s.setVersion(0L);
        s.setLastAction("created");
        s.setLastActor(creator);
        s.setCurrentTurnOwner(rules.require(kind).initialTurnOwner(s, firstTurn));
        return s;
    }
}
