package com.duohub.gameservice.games.session.infrastructure.codec;

import com.alibaba.fastjson2.JSONObject;
import com.duohub.gameservice.games.ladder.content.WordPair;
import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.memoryflip.content.MemoryDeckFactory;
import com.duohub.gameservice.games.memoryflip.domain.MemoryFlipState;
import com.duohub.gameservice.games.quiz.content.QuizContentSource;
import com.duohub.gameservice.games.session.application.SessionFactory;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.SessionStatus;
import com.duohub.gameservice.games.session.support.Device;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionCodecTest {

    private final SessionCodec codec = new SessionCodec(Device.rules());
    private final SessionFactory factory = new SessionFactory(
            Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC), Device.rules(),
            new QuizContentSource(3), new MemoryDeckFactory(new Random(1), 2), Map.of());

    @Test
    void ladderDocumentCarriesWireKindAndParsesBack() {
        GameSession s = factory.ladder("alice", "bob", "bob", new WordPair("cat-dog", "CAT", "DOG", "en", 3), "initial-1");
        s.getAppliedMoves().add("bob/word:COT");
        s.getRewardsIssued().put("move:bob/word:COT", 10);
        ((LadderState) s.getState()).getWordChain().add("COT");

        JSONObject doc = codec.toDocument(s);
        assertThat(doc.getString("kind")).isEqualTo("ladder");
        assertThat(doc.getJSONObject("state").getString("kind")).isEqualTo("ladder");

        GameSession back = codec.fromJson(codec.toJson(s));
        assertThat(back.getKind()).isEqualTo(GameKind.LADDER);
        assertThat(back.getState()).isInstanceOf(LadderState.class);
        assertThat(((LadderState) back.getState()).getWordChain()).containsExactly("CAT", "COT");
        assertThat(back.getCurrentTurnOwner()).isEqualTo("bob");
        assertThat(back.getAppliedMoves()).containsExactly("bob/word:COT");
        assertThat(back.getRewardsIssued()).containsEntry("move:bob/word:COT", 10);
        assertThat(back.getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void memoryFlipDeckSurvivesEncoding() {
        GameSession s = factory.singleton(GameKind.MEMORY_FLIP, "alice", "bob", "2026-03-01");
        GameSession back = codec.fromDocument(codec.toDocument(s));
        MemoryFlipState original = (MemoryFlipState) s.getState();
        MemoryFlipState parsed = (MemoryFlipState) back.getState();
        assertThat(parsed.getCards()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(original.getCards());
        assertThat(back.getKind()).isEqualTo(GameKind.MEMORY_FLIP);
    }

    @Test
    void stateOfAnotherKindIsCorrupt() {
        GameSession ladder = factory.ladder("alice", "bob", "alice", new WordPair("cat-dog", "CAT", "DOG", "en", 3), "initial-0");
        JSONObject doc = codec.toDocument(ladder);
        doc.put("kind", "quiz");

        assertThatThrownBy(() -> codec.fromDocument(doc))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CORRUPT_SNAPSHOT");
    }

    @Test
    void turnOwnerOutsideParticipantsIsCorrupt() {
        GameSession ladder = factory.ladder("alice", "bob", "alice", new WordPair("cat-dog", "CAT", "DOG", "en", 3), "initial-0");
        ladder.setCurrentTurnOwner("carol");

        assertThatThrownBy(() -> codec.fromJson(codec.toJson(ladder)))
                .hasMessageContaining("turn owner");
    }

    @Test
    void sessionIdThatIsNotAUuidIsCorrupt() {
        GameSession quiz = factory.singleton(GameKind.QUIZ, "alice", "bob", "2026-03-01");
        JSONObject doc = codec.toDocument(quiz);
        doc.put("id", "../../etc/escape");

        assertThatThrownBy(() -> codec.fromDocument(doc))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("malformed sessionId");
    }

    @Test
    void emptyOrUntaggedDocumentIsRejected() {
        assertThatThrownBy(() -> codec.fromJson(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CORRUPT_SNAPSHOT");
        assertThatThrownBy(() -> codec.fromJson("{}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
