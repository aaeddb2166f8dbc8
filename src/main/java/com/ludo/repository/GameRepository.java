package com.ludo.repository;

import com.ludo.model.Game;

import java.util.Optional;

/**
 * Store of whole game aggregates, keyed by game id.
 */
public interface GameRepository {

    /**
     * Write the aggregate and refresh its idle expiry.
     */
    Game save(Game game);

    /**
     * Load a game. Empty when the key is missing, expired or holds a malformed aggregate.
     */
    Optional<Game> findById(String gameId);

    void deleteById(String gameId);
}
