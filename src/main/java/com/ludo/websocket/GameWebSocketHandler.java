package com.ludo.websocket;

import com.ludo.model.Game;
import com.ludo.model.Player;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Delivers game updates and errors to individual WebSocket sessions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketHandler {

    static final String GAME_UPDATED_QUEUE = "/queue/game.updated";
    static final String ERROR_QUEUE = "/queue/errors";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Send the full game state to every player of the game.
     */
    public void broadcastGameUpdate(Game game) {
        GameMessage message = GameMessage.gameUpdate(game);
        for (Player player : game.getPlayers()) {
            sendToSession(player.getSessionId(), GAME_UPDATED_QUEUE, message);
        }
        log.debug("Broadcast game update for game {} to {} players", game.getId(), game.getPlayers().size());
    }

    /**
     * Send an error to the requesting session only.
     */
    public void sendError(String sessionId, String error) {
        sendError(sessionId, error, null);
    }

    /**
     * Send a rule rejection, with its machine-readable code, to the requesting session.
     */
    public void sendError(String sessionId, String error, String code) {
        sendToSession(sessionId, ERROR_QUEUE, new GameErrorMessage(error, code));
    }

    private void sendToSession(String sessionId, String destination, Object payload) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        try {
            messagingTemplate.convertAndSendToUser(sessionId, destination, payload,
                    headerAccessor.getMessageHeaders());
        } catch (MessagingException e) {
            log.error("Error sending {} to session {}", destination, sessionId, e);
        }
    }

    // Message DTOs

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static GameMessage gameUpdate(Game game) {
            return GameMessage.builder()
                    .type("game:updated")
                    .payload(game)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameErrorMessage {
        private String error;
        private String code;
    }
}
