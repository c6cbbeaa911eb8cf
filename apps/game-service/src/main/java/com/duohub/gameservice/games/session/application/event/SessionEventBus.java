package com.duohub.gameservice.games.session.application.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内事件分发。监听器抛异常只记日志，不影响其它监听器和调用方。
 */
@Slf4j
public class SessionEventBus {

    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();

    public SessionEventBus() {
    }

    public SessionEventBus(List<SessionEventListener> initial) {
        listeners.addAll(initial);
    }

    public void register(SessionEventListener listener) {
        listeners.add(listener);
    }

    public void unregister(SessionEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(SessionEvent event) {
        for (SessionEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (Exception e) {
                log.error("会话事件监听器异常: type={}, sessionId={}",
                        event.type(), event.session() == null ? null : event.session().getId(), e);
            }
        }
    }
}
