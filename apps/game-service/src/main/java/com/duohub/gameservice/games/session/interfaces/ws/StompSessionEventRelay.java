package com.duohub.gameservice.games.session.interfaces.ws;

import com.duohub.gameservice.games.session.application.event.SessionEvent;
import com.duohub.gameservice.games.session.application.event.SessionEventListener;
import com.duohub.gameservice.games.session.interfaces.http.dto.SessionView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 会话事件 → STOMP 广播：/topic/pairs.{pairKey}
 * 消息体：{type, actor, at, session}，session 不带观察者视角（yourTurn 恒为 false，由前端自行判断）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompSessionEventRelay implements SessionEventListener {

    public record SessionEventMessage(String type, String actor, long at, SessionView session) {
    }

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onEvent(SessionEvent event) {
        if (event.session() == null) return;
        String destination = "/topic/pairs." + event.session().getPairKey();
        SessionEventMessage msg = new SessionEventMessage(event.type().name(), event.actor(), event.at(),
                SessionView.of(event.session(), null));
        messagingTemplate.convertAndSend(destination, msg);
        log.debug("会话事件已广播: dest={}, type={}, sessionId={}", destination, event.type(), event.session().getId());
    }
}
