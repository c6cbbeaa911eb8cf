package com.duohub.gameservice.games.session.service;

import lombok.Getter;

/**
 * 会话状态错误。继承 IllegalStateException，由 WebExceptionAdvice 统一映射。
 */
@Getter
public class GameSessionException extends IllegalStateException {

    private final SessionErrorCode code;

    public GameSessionException(SessionErrorCode code, String detail) {
        super(detail == null ? code.name() : code.name() + ": " + detail);
        this.code = code;
    }
}
