package com.duohub.gameservice.games.session.infrastructure.backend;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.repository.AuthoritativeStore;
import com.duohub.gameservice.games.session.infrastructure.codec.SessionCodec;
import com.duohub.gameservice.infrastructure.client.backend.SessionBackendClient;
import com.duohub.web.common.ApiResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * 权威后端网关：Feign 调用 + 熔断。
 * 后端只是记录系统，任何失败都降级为 empty / 跳过，不影响对局。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendSyncGateway implements AuthoritativeStore {

    private final SessionBackendClient client;
    private final SessionCodec codec;

    @Override
    @CircuitBreaker(name = "sessionBackend", fallbackMethod = "pushFallback")
    public Optional<GameSession> push(GameSession session) {
        ApiResponse<Map<String, Object>> resp = client.upsert(session.getKind().wireName(), session.getId(),
                codec.toDocument(session));
        return canonical(resp, session.getId());
    }

    @Override
    @CircuitBreaker(name = "sessionBackend", fallbackMethod = "fetchFallback")
    public Optional<GameSession> fetch(GameKind kind, String sessionId) {
        return canonical(client.fetch(kind.wireName(), sessionId), sessionId);
    }

    @Override
    @CircuitBreaker(name = "sessionBackend", fallbackMethod = "deleteFallback")
    public void delete(GameKind kind, String sessionId) {
        ApiResponse<Void> resp = client.delete(kind.wireName(), sessionId);
        if (resp == null || resp.code() != ApiResponse.OK) {
            log.warn("权威后端删除未成功: sessionId={}, resp={}", sessionId, resp);
        }
    }

    private Optional<GameSession> canonical(ApiResponse<Map<String, Object>> resp, String sessionId) {
        if (resp == null || !resp.hasData()) {
            log.debug("权威后端无数据: sessionId={}, code={}", sessionId, resp == null ? null : resp.code());
            return Optional.empty();
        }
        try {
            return Optional.of(codec.fromDocument(resp.data()));
        } catch (IllegalArgumentException e) {
            log.warn("权威后端返回的快照无法解析: sessionId={}, err={}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<GameSession> pushFallback(GameSession session, Throwable ex) {
        log.warn("推送权威后端失败，已降级: sessionId={}, err={}", session.getId(), ex.toString());
        return Optional.empty();
    }

    private Optional<GameSession> fetchFallback(GameKind kind, String sessionId, Throwable ex) {
        log.warn("读取权威后端失败，已降级: sessionId={}, err={}", sessionId, ex.toString());
        return Optional.empty();
    }

    private void deleteFallback(GameKind kind, String sessionId, Throwable ex) {
        log.warn("删除权威后端会话失败，已降级: sessionId={}, err={}", sessionId, ex.toString());
    }
}
