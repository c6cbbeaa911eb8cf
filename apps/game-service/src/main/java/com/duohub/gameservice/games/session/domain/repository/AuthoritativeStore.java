package com.duohub.gameservice.games.session.domain.repository;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;

import java.util.Optional;

/**
 * 权威后端（分析与迁移用的记录系统，实时对局以远端存储为准）。
 */
public interface AuthoritativeStore {

    /**
     * 推送整份快照，返回后端规范化后的视图；失败时 empty
     */
    Optional<GameSession> push(GameSession session);

    Optional<GameSession> fetch(GameKind kind, String sessionId);

    void delete(GameKind kind, String sessionId);
}
