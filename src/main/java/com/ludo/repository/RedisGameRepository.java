package com.ludo.repository;

import com.ludo.model.Game;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed {@link GameRepository}. Aggregates are stored as JSON strings with an idle TTL.
 */
@Repository
@Slf4j
public class RedisGameRepository implements GameRepository {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisGameRepository(StringRedisTemplate redis,
                               ObjectMapper objectMapper,
                               @Value("${ludo.game.ttl-seconds:3600}") long ttlSeconds) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    @Override
    public Game save(Game game) {
        redis.opsForValue().set(RedisKeys.game(game.getId()), objectMapper.writeValueAsString(game), ttl);
        return game;
    }

    @Override
    public Optional<Game> findById(String gameId) {
        String json = redis.opsForValue().get(RedisKeys.game(gameId));
        if (json == null) {
            return Optional.empty();
        }
        Game game;
        try {
            game = objectMapper.readValue(json, Game.class);
        } catch (JacksonException | IllegalArgumentException e) {
            log.warn("Discarding unreadable game {}: {}", gameId, e.getMessage());
            return Optional.empty();
        }
        if (!isWellFormed(game)) {
            log.warn("Discarding malformed game {}", gameId);
            return Optional.empty();
        }
        return Optional.of(game);
    }

    @Override
    public void deleteById(String gameId) {
        redis.delete(RedisKeys.game(gameId));
    }

    boolean isWellFormed(Game game) {
        return game.getId() != null
                && game.getPlayers() != null
                && game.getPlayers().size() <= Game.SEATS
                && game.getDice() != null
                && game.getWinners() != null
                && game.getBoard() != null
                && game.getBoard().isWellFormed();
    }
}
