package com.duohub.gameservice.games.memoryflip.rule;

import com.duohub.gameservice.games.memoryflip.domain.CardPair;
import com.duohub.gameservice.games.memoryflip.domain.MemoryCard;
import com.duohub.gameservice.games.memoryflip.domain.MemoryFlipState;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.rule.GameRules;
import com.duohub.gameservice.games.session.domain.rule.MoveValidator;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * 记忆翻牌规则：不限回合，两人一起把所有牌配对。
 * 质量指标 = 从开局到完成经过的整天数。
 */
public class MemoryFlipRules implements GameRules<MemoryFlipState, CardPair> {

    private static final long DAY_MS = Duration.ofDays(1).toMillis();

    private final MemoryFlipMoveValidator validator = new MemoryFlipMoveValidator();

    @Override
    public GameKind kind() {
        return GameKind.MEMORY_FLIP;
    }

    @Override
    public Class<MemoryFlipState> stateType() {
        return MemoryFlipState.class;
    }

    @Override
    public Class<CardPair> payloadType() {
        return CardPair.class;
    }

    @Override
    public MoveValidator<MemoryFlipState, CardPair> validator() {
        return validator;
    }

    @Override
    public void apply(MemoryFlipState state, CardPair payload, String submitter, long now) {
        for (String cardId : new String[]{payload.card1Id(), payload.card2Id()}) {
            MemoryCard card = state.card(cardId).orElseThrow();
            card.setStatus(MemoryCard.Status.MATCHED);
            card.setMatchedBy(submitter);
            card.setMatchedAt(now);
        }
        state.setMatchedPairs(state.getMatchedPairs() + 1);
    }

    @Override
    public boolean isComplete(MemoryFlipState state) {
        return state.getTotalPairs() > 0 && state.getMatchedPairs() >= state.getTotalPairs();
    }

    @Override
    public OptionalInt qualityMetric(MemoryFlipState state, GameSession session) {
        if (session.getCompletedAt() == null) {
            return OptionalInt.empty();
        }
        long elapsed = Math.max(0, session.getCompletedAt() - session.getCreatedAt());
        return OptionalInt.of((int) (elapsed / DAY_MS));
    }

    @Override
    public String initialTurnOwner(GameSession session, String firstTurn) {
        return null;
    }

    @Override
    public String nextTurnOwner(GameSession session, String submitter) {
        return null;
    }

    @Override
    public String summary(MemoryFlipState state) {
        return "记忆翻牌已配对 " + state.getMatchedPairs() + "/" + state.getTotalPairs();
    }
}
