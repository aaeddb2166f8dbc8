package com.ludo.repository;

import java.util.Optional;

/**
 * Index from connected session to the game it plays in.
 */
public interface SessionRepository {

    void bind(String sessionId, String gameId);

    Optional<String> findGameId(String sessionId);

    void unbind(String sessionId);
}
