package com.duohub.gameservice.games.session.interfaces.http.dto;

import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.ladder.domain.LadderWord;
import com.duohub.gameservice.games.memoryflip.domain.CardPair;
import com.duohub.gameservice.games.quiz.domain.QuizAnswers;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.PairKeys;
import com.duohub.gameservice.games.session.domain.model.SessionStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoveRequestTest {

    @Test
    void payloadFollowsSessionKind() {
        MoveRequest req = new MoveRequest();
        req.setWord(" cot ");
        req.setAnswers(List.of(1, 0));
        req.setCard1Id("c1");
        req.setCard2Id("c2");

        assertThat(req.toPayload(GameKind.LADDER)).isEqualTo(new LadderWord("COT"));
        assertThat(req.toPayload(GameKind.QUIZ)).isInstanceOf(QuizAnswers.class);
        assertThat(req.toPayload(GameKind.MEMORY_FLIP)).isEqualTo(new CardPair("c1", "c2"));
    }

    @Test
    void missingCardsAreRejected() {
        assertThatThrownBy(() -> new MoveRequest().toPayload(GameKind.MEMORY_FLIP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void viewReportsTurnFromViewerPerspective() {
        GameSession s = new GameSession();
        s.setId("s-1");
        s.setPairKey("alice_bob");
        s.setParticipants(PairKeys.sorted("alice", "bob"));
        s.setKind(GameKind.LADDER);
        s.setStatus(SessionStatus.ACTIVE);
        s.setState(LadderState.start("cat-dog", "CAT", "DOG", "en", 3));
        s.setCurrentTurnOwner("bob");
        s.getRewardsIssued().put("move:a", 10);
        s.getRewardsIssued().put("penalty:b", -2);

        assertThat(SessionView.of(s, "bob").yourTurn()).isTrue();
        assertThat(SessionView.of(s, "alice").yourTurn()).isFalse();
        assertThat(SessionView.of(s, "alice").rewardTotal()).isEqualTo(8);
        assertThat(SessionView.of(s, "alice").kind()).isEqualTo("ladder");

        s.setStatus(SessionStatus.COMPLETED);
        assertThat(SessionView.of(s, "bob").yourTurn()).isFalse();
    }
}
