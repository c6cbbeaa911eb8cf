package com.duohub.gameservice.games.session.service;

/**
 * 会话状态错误码：总是报给调用方，不自动重试。
 */
public enum SessionErrorCode {
    SESSION_NOT_FOUND,
    NOT_YOUR_TURN,
    SESSION_EXPIRED,
    /** 会话已结束（完成或过期），不能再走子 */
    SESSION_CLOSED,
    SESSION_NOT_COMPLETED,
    NOT_A_PARTICIPANT,
    YIELD_NOT_SUPPORTED,
    WRONG_KIND
}
