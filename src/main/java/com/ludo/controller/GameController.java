package com.ludo.controller;

import com.ludo.model.Board;
import com.ludo.model.Game;
import com.ludo.service.GameQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only REST API. All game actions go through the WebSocket controller.
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class GameController {

    private final GameQueryService gameQueryService;

    /**
     * Layout of a fresh board.
     */
    @GetMapping("/board")
    public ResponseEntity<Board> getBoardLayout() {
        return ResponseEntity.ok(gameQueryService.getBoardLayout());
    }

    /**
     * Current state of a game.
     */
    @GetMapping("/{gameId}")
    public ResponseEntity<Game> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(gameQueryService.getGame(gameId));
    }
}
