package com.duohub.gameservice.games.session.domain.model;

/**
 * 走子载荷（按 kind 区分）。
 */
public interface MovePayload {

    GameKind kind();

    /**
     * 载荷指纹：同一个参与者重复提交同一指纹视为网络重试，按幂等处理。
     */
    String fingerprint();
}
