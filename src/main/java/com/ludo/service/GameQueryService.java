package com.ludo.service;

import com.ludo.exception.GameRuleException;
import com.ludo.exception.Rejection;
import com.ludo.model.Board;
import com.ludo.model.Game;
import com.ludo.repository.GameRepository;
import com.ludo.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service responsible for game lookups and read-only operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameQueryService {

    private final GameRepository gameRepository;
    private final SessionRepository sessionRepository;
    private final BoardService boardService;

    /**
     * Get game by ID.
     */
    public Game getGame(String gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> new GameRuleException(Rejection.INVALID_GAME));
    }

    /**
     * Id of the game the session is bound to.
     */
    public String resolveGameId(String sessionId) {
        return sessionRepository.findGameId(sessionId)
                .orElseThrow(() -> new GameRuleException(Rejection.NOT_IN_GAME));
    }

    public Optional<String> findGameId(String sessionId) {
        return sessionRepository.findGameId(sessionId);
    }

    public Optional<Game> findGame(String gameId) {
        return gameRepository.findById(gameId);
    }

    /**
     * A fresh board layout, for clients drawing the board before joining.
     */
    public Board getBoardLayout() {
        return boardService.createBoard();
    }
}
