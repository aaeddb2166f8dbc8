package com.ludo.websocket;

import com.ludo.service.GameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Takes a disconnected session off its game's roster.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionDisconnectListener {

    private final GameService gameService;
    private final GameWebSocketHandler webSocketHandler;

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("SessionDisconnectEvent without a session id");
            return;
        }
        log.debug("Session {} disconnected", sessionId);
        try {
            gameService.leave(sessionId).ifPresent(webSocketHandler::broadcastGameUpdate);
        } catch (RuntimeException e) {
            log.error("Error removing disconnected session {}", sessionId, e);
        }
    }
}
