package com.duohub.gameservice.games.memoryflip.rule;

import com.duohub.gameservice.games.memoryflip.domain.CardPair;
import com.duohub.gameservice.games.memoryflip.domain.MemoryCard;
import com.duohub.gameservice.games.memoryflip.domain.MemoryFlipState;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryFlipMoveValidatorTest {

    private final MemoryFlipRules rules = new MemoryFlipRules();
    private MemoryFlipState state;

    @BeforeEach
    void setUp() {
        state = new MemoryFlipState();
        state.setCards(new java.util.ArrayList<>(List.of(
                new MemoryCard("a1", 0, "❤️", "p0", MemoryCard.Status.HIDDEN, null, null),
                new MemoryCard("b1", 1, "🌹", "p1", MemoryCard.Status.HIDDEN, null, null),
                new MemoryCard("a2", 2, "❤️", "p0", MemoryCard.Status.HIDDEN, null, null),
                new MemoryCard("b2", 3, "🌹", "p1", MemoryCard.Status.HIDDEN, null, null))));
        state.setTotalPairs(2);
    }

    @Test
    void rejectsInOrder() {
        assertThat(rules.validator().validate(state, new CardPair("a1", "a1"), "alice").reason())
                .isEqualTo(RejectReason.SAME_CARD);
        assertThat(rules.validator().validate(state, new CardPair("a1", "zz"), "alice").reason())
                .isEqualTo(RejectReason.UNKNOWN_CARD);
        assertThat(rules.validator().validate(state, new CardPair("a1", "b1"), "alice").reason())
                .isEqualTo(RejectReason.NOT_A_PAIR);
    }

    @Test
    void matchedCardsCannotBeFlippedAgain() {
        rules.apply(state, new CardPair("a2", "a1"), "bob", 5L);
        assertThat(state.card("a1").orElseThrow().getMatchedBy()).isEqualTo("bob");
        assertThat(rules.validator().validate(state, new CardPair("a1", "a2"), "alice").reason())
                .isEqualTo(RejectReason.CARD_NOT_HIDDEN);
    }

    @Test
    void fingerprintIgnoresCardOrder() {
        assertThat(new CardPair("a1", "a2").fingerprint()).isEqualTo(new CardPair("a2", "a1").fingerprint());
    }

    @Test
    void completesWhenAllPairsMatchedAndMeasuresWholeDays() {
        rules.apply(state, new CardPair("a1", "a2"), "alice", 1L);
        assertThat(rules.isComplete(state)).isFalse();
        rules.apply(state, new CardPair("b1", "b2"), "bob", 2L);
        assertThat(rules.isComplete(state)).isTrue();

        GameSession session = new GameSession();
        session.setCreatedAt(0L);
        session.setCompletedAt(Duration.ofHours(47).toMillis());
        assertThat(rules.qualityMetric(state, session)).hasValue(1);
    }
}
