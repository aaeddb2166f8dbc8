package com.ludo.websocket;

import com.ludo.exception.GameRuleException;
import com.ludo.model.Color;
import com.ludo.service.GameService;
import com.ludo.service.JoinResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for player actions. Successful actions broadcast the game to its
 * players; rejected ones answer the requester only.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketController {

    static final String UNEXPECTED_ERROR = "An unexpected error occurred";

    private final GameService gameService;
    private final GameWebSocketHandler webSocketHandler;

    @MessageMapping("/game.create")
    public void handleCreate(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "create", () -> publish(gameService.createGame(sessionId)));
    }

    @MessageMapping("/game.join")
    public void handleJoin(@Valid @Payload JoinMessage message, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "join " + message.getGameId(),
                () -> publish(gameService.joinGame(sessionId, message.getGameId())));
    }

    @MessageMapping("/game.color")
    public void handleChooseColor(@Payload(required = false) ColorMessage message,
                                  SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        Color color = message == null ? null : Color.fromValue(message.getColor());
        handle(sessionId, "choose color " + color,
                () -> webSocketHandler.broadcastGameUpdate(gameService.chooseColor(sessionId, color)));
    }

    @MessageMapping("/game.roll")
    public void handleRoll(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "roll dice",
                () -> webSocketHandler.broadcastGameUpdate(gameService.rollDice(sessionId)));
    }

    @MessageMapping("/game.roll-result")
    public void handleRollResult(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "confirm roll result",
                () -> webSocketHandler.broadcastGameUpdate(gameService.confirmRollResult(sessionId)));
    }

    @MessageMapping("/game.move-initial")
    public void handleMoveFromInitial(@Valid @Payload PawnMessage message, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "move from initial " + message.getPawnIndex(),
                () -> webSocketHandler.broadcastGameUpdate(gameService.moveFromInitial(sessionId, message.getPawnIndex())));
    }

    @MessageMapping("/game.move-road")
    public void handleMoveOnRoad(@Valid @Payload PawnMessage message, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "move on road " + message.getPawnIndex(),
                () -> webSocketHandler.broadcastGameUpdate(gameService.moveOnRoad(sessionId, message.getPawnIndex())));
    }

    @MessageMapping("/game.move-final")
    public void handleMoveToFinal(@Valid @Payload PawnMessage message, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "move to final " + message.getPawnIndex(),
                () -> webSocketHandler.broadcastGameUpdate(gameService.moveToFinal(sessionId, message.getPawnIndex())));
    }

    @MessageMapping("/game.moved")
    public void handleMoved(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        handle(sessionId, "move acknowledged",
                () -> gameService.acknowledgeMove(sessionId).ifPresent(webSocketHandler::broadcastGameUpdate));
    }

    @MessageExceptionHandler(MethodArgumentNotValidException.class)
    public void handleInvalidPayload(MethodArgumentNotValidException e, SimpMessageHeaderAccessor headerAccessor) {
        log.warn("Invalid payload from session {}: {}", headerAccessor.getSessionId(), e.getMessage());
        webSocketHandler.sendError(headerAccessor.getSessionId(), "Invalid payload");
    }

    private void publish(JoinResult result) {
        webSocketHandler.broadcastGameUpdate(result.game());
        if (result.hasPreviousGame()) {
            webSocketHandler.broadcastGameUpdate(result.previousGame());
        }
    }

    private void handle(String sessionId, String action, Runnable handler) {
        log.debug("Session {} requested {}", sessionId, action);
        try {
            handler.run();
        } catch (GameRuleException e) {
            log.warn("Rejected {} from session {}: {}", action, sessionId, e.getMessage());
            webSocketHandler.sendError(sessionId, e.getMessage(), e.getRejection().getCode());
        } catch (RuntimeException e) {
            log.error("Error processing {} from session {}", action, sessionId, e);
            webSocketHandler.sendError(sessionId, UNEXPECTED_ERROR);
        }
    }

    // Message DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JoinMessage {
        @NotBlank
        private String gameId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColorMessage {
        private String color;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PawnMessage {
        @NotNull
        private Integer pawnIndex;
    }
}
