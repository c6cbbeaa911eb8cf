package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.session.domain.model.GameSession;

/**
 * 建局仲裁结果：拿到的会话，以及是否由本设备新建。
 */
public record SlotResolution(GameSession session, boolean createdHere) {
}
