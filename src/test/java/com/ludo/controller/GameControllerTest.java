package com.ludo.controller;

import com.ludo.exception.GameRuleException;
import com.ludo.exception.Rejection;
import com.ludo.model.Board;
import com.ludo.model.Game;
import com.ludo.service.GameQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GameController REST API.
 */
@ExtendWith(MockitoExtension.class)
class GameControllerTest {

    @Mock private GameQueryService gameQueryService;

    @InjectMocks
    private GameController controller;

    @Nested
    @DisplayName("GET /api/games/board")
    class GetBoardTests {

        @Test
        @DisplayName("should return a fresh board layout")
        void shouldReturnBoard() {
            Board board = Board.builder().build();
            when(gameQueryService.getBoardLayout()).thenReturn(board);

            ResponseEntity<Board> response = controller.getBoardLayout();

            assertEquals(200, response.getStatusCode().value());
            assertSame(board, response.getBody());
        }
    }

    @Nested
    @DisplayName("GET /api/games/{gameId}")
    class GetGameTests {

        @Test
        @DisplayName("should return game state for given id")
        void shouldReturnGame() {
            Game game = Game.builder().id("game-1").build();
            when(gameQueryService.getGame("game-1")).thenReturn(game);

            ResponseEntity<Game> response = controller.getGame("game-1");

            assertEquals(200, response.getStatusCode().value());
            assertEquals("game-1", response.getBody().getId());
        }

        @Test
        @DisplayName("should propagate unknown game ids")
        void shouldPropagateUnknownGame() {
            when(gameQueryService.getGame("missing")).thenThrow(new GameRuleException(Rejection.INVALID_GAME));

            GameRuleException ex = assertThrows(GameRuleException.class, () -> controller.getGame("missing"));
            assertEquals(Rejection.INVALID_GAME, ex.getRejection());
        }
    }
}
