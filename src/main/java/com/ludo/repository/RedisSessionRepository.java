package com.ludo.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Redis-backed {@link SessionRepository}. Entries live as long as the session stays in its game.
 */
@Repository
@RequiredArgsConstructor
public class RedisSessionRepository implements SessionRepository {

    private final StringRedisTemplate redis;

    @Override
    public void bind(String sessionId, String gameId) {
        redis.opsForValue().set(RedisKeys.session(sessionId), gameId);
    }

    @Override
    public Optional<String> findGameId(String sessionId) {
        return Optional.ofNullable(redis.opsForValue().get(RedisKeys.session(sessionId)));
    }

    @Override
    public void unbind(String sessionId) {
        redis.delete(RedisKeys.session(sessionId));
    }
}
