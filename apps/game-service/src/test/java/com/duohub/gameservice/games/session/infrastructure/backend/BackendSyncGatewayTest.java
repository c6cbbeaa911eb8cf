package com.duohub.gameservice.games.session.infrastructure.backend;

import com.duohub.gameservice.games.memoryflip.content.MemoryDeckFactory;
import com.duohub.gameservice.games.quiz.content.QuizContentSource;
import com.duohub.gameservice.games.session.application.SessionFactory;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.infrastructure.codec.SessionCodec;
import com.duohub.gameservice.games.session.support.Device;
import com.duohub.gameservice.infrastructure.client.backend.SessionBackendClient;
import com.duohub.web.common.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendSyncGatewayTest {

    private SessionBackendClient client;
    private SessionCodec codec;
    private BackendSyncGateway gateway;
    private GameSession session;

    @BeforeEach
    void setUp() {
        client = mock(SessionBackendClient.class);
        codec = new SessionCodec(Device.rules());
        gateway = new BackendSyncGateway(client, codec);
        session = new SessionFactory(Clock.systemUTC(), Device.rules(), new QuizContentSource(3),
                new MemoryDeckFactory(new Random(3), 2), Map.of())
                .singleton(GameKind.MEMORY_FLIP, "alice", "bob", "2026-03-01");
    }

    @Test
    void pushSendsWireDocumentAndReturnsCanonicalView() {
        GameSession canonical = session.copy();
        canonical.setVersion(7L);
        when(client.upsert(eq("memory-flip"), eq(session.getId()), anyMap()))
                .thenReturn(ApiResponse.<Map<String, Object>>success(codec.toDocument(canonical)));

        assertThat(gateway.push(session).map(GameSession::getVersion)).contains(7L);
        verify(client).upsert(eq("memory-flip"), eq(session.getId()), any());
    }

    @Test
    void missingOrUnparsableRecordFetchesAsEmpty() {
        when(client.fetch("quiz", "s-1")).thenReturn(ApiResponse.notFound("no such session"));
        assertThat(gateway.fetch(GameKind.QUIZ, "s-1")).isEmpty();

        when(client.fetch("quiz", "s-2")).thenReturn(ApiResponse.<Map<String, Object>>success(Map.of("kind", "quiz")));
        assertThat(gateway.fetch(GameKind.QUIZ, "s-2")).isEmpty();
    }
}
