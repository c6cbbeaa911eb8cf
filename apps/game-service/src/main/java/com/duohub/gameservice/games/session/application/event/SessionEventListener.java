package com.duohub.gameservice.games.session.application.event;

@FunctionalInterface
public interface SessionEventListener {

    void onEvent(SessionEvent event);
}
