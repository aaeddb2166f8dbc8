package com.ludo.service;

import com.ludo.model.Board;
import com.ludo.model.Color;
import com.ludo.model.Game;
import com.ludo.model.MoveKind;
import com.ludo.model.MoveRecord;
import com.ludo.model.Pawn;
import com.ludo.model.Player;
import com.ludo.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for every player action. Actions on one game run one at a time under that
 * game's lock; each is validated before anything is mutated, then saved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final GameRepository gameRepository;
    private final GameQueryService gameQueryService;
    private final GameLifecycleService lifecycleService;
    private final GameValidationService validationService;
    private final DiceService diceService;
    private final MoveService moveService;
    private final StackingService stackingService;
    private final TurnManagementService turnManagementService;
    private final WinConditionService winConditionService;

    private final ConcurrentHashMap<String, ReentrantLock> gameLocks = new ConcurrentHashMap<>();

    // ---- Lifecycle ----

    /**
     * Create a game for the session, leaving the game it was in before.
     */
    public JoinResult createGame(String sessionId) {
        Optional<String> previousId = gameQueryService.findGameId(sessionId);
        Game previous = previousId
                .flatMap(id -> withGameLock(id, () -> leaveGame(id, sessionId)))
                .orElse(null);

        Game game = lifecycleService.createGame(sessionId);
        return new JoinResult(game, previous);
    }

    /**
     * Join an existing game, leaving the game the session was in before.
     */
    public JoinResult joinGame(String sessionId, String gameId) {
        Optional<String> previousId = gameQueryService.findGameId(sessionId)
                .filter(id -> !id.equals(gameId));

        List<String> lockOrder = new ArrayList<>(new TreeSet<>(
                previousId.map(id -> List.of(gameId, id)).orElse(List.of(gameId))));

        return withGameLocks(lockOrder, () -> {
            Game game = gameQueryService.getGame(gameId);
            lifecycleService.validateJoin(game, sessionId);

            Game previous = previousId
                    .flatMap(id -> leaveGame(id, sessionId))
                    .orElse(null);

            return new JoinResult(lifecycleService.joinGame(game, sessionId), previous);
        });
    }

    public Game chooseColor(String sessionId, Color color) {
        String gameId = gameQueryService.resolveGameId(sessionId);
        return withGameLock(gameId, () -> {
            Game game = gameQueryService.getGame(gameId);
            return lifecycleService.chooseColor(game, sessionId, color);
        });
    }

    /**
     * Remove the session from its game, e.g. on disconnect.
     *
     * @return the game when it still has players
     */
    public Optional<Game> leave(String sessionId) {
        Optional<String> gameId = gameQueryService.findGameId(sessionId);
        lifecycleService.unbindSession(sessionId);
        if (gameId.isEmpty()) {
            return Optional.empty();
        }
        return withGameLock(gameId.get(), () -> leaveGame(gameId.get(), sessionId));
    }

    private Optional<Game> leaveGame(String gameId, String sessionId) {
        Optional<Game> remaining = gameQueryService.findGame(gameId)
                .flatMap(game -> lifecycleService.removePlayer(game, sessionId));
        if (remaining.isEmpty() || remaining.get().isFinished()) {
            gameLocks.remove(gameId);
        }
        return remaining;
    }

    // ---- Dice ----

    public Game rollDice(String sessionId) {
        String gameId = gameQueryService.resolveGameId(sessionId);
        return withGameLock(gameId, () -> {
            Game game = gameQueryService.getGame(gameId);
            validationService.validateDiceRoll(game, sessionId);

            diceService.roll(game);
            return gameRepository.save(game);
        });
    }

    /**
     * The roll animation finished: mark the pawns that can act, or pass the turn when none can.
     */
    public Game confirmRollResult(String sessionId) {
        String gameId = gameQueryService.resolveGameId(sessionId);
        return withGameLock(gameId, () -> {
            Game game = gameQueryService.getGame(gameId);
            Player player = validationService.validateRollResult(game, sessionId);

            if (!diceService.assignActions(game, player.getColor())) {
                log.debug("Game {}: no {} pawn can move on {}", gameId, player.getColor(), game.getDice().getResult());
                turnManagementService.passTurn(game);
            }
            return gameRepository.save(game);
        });
    }

    // ---- Moves ----

    public Game moveFromInitial(String sessionId, int pawnIndex) {
        return move(sessionId, MoveKind.ENTRY, pawnIndex);
    }

    public Game moveOnRoad(String sessionId, int pawnIndex) {
        return move(sessionId, MoveKind.ROAD, pawnIndex);
    }

    public Game moveToFinal(String sessionId, int pawnIndex) {
        return move(sessionId, MoveKind.HOME, pawnIndex);
    }

    private Game move(String sessionId, MoveKind kind, int pawnIndex) {
        String gameId = gameQueryService.resolveGameId(sessionId);
        return withGameLock(gameId, () -> {
            Game game = gameQueryService.getGame(gameId);
            Pawn pawn = validationService.validateMove(game, sessionId, kind, pawnIndex);

            switch (kind) {
                case ENTRY -> moveService.moveFromInitial(game, pawn);
                case ROAD -> moveService.moveOnRoad(game, pawn);
                case HOME -> moveService.moveInLane(game, pawn);
            }
            return gameRepository.save(game);
        });
    }

    /**
     * The move animation finished. Only the current player's acknowledgement of a pending
     * move counts; anything else is ignored.
     *
     * @return the updated game, or empty when the acknowledgement was ignored
     */
    public Optional<Game> acknowledgeMove(String sessionId) {
        String gameId = gameQueryService.resolveGameId(sessionId);
        return withGameLock(gameId, () -> {
            Game game = gameQueryService.getGame(gameId);
            Board board = game.getBoard();
            MoveRecord move = board.getMovePawn();
            if (move == null || !sessionId.equals(game.getCurrent())) {
                log.debug("Game {}: ignoring move acknowledgement from {}", gameId, sessionId);
                return Optional.empty();
            }

            stackingService.prune(board, move);
            board.setMovePawn(null);
            game.getDice().setAbleToRoll(true);

            boolean colorFinished = winConditionService.checkColorFinished(game, move.getColor());
            if (winConditionService.isGameOver(game)) {
                lifecycleService.purge(game);
                gameLocks.remove(gameId);
                return Optional.of(game);
            }

            turnManagementService.endMove(game, colorFinished);
            return Optional.of(gameRepository.save(game));
        });
    }

    private <T> T withGameLock(String gameId, Supplier<T> action) {
        return withGameLocks(List.of(gameId), action);
    }

    /**
     * Run the action holding the locks of all given games, acquired in the given order.
     */
    private <T> T withGameLocks(List<String> gameIds, Supplier<T> action) {
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (String gameId : gameIds) {
                ReentrantLock lock = gameLocks.computeIfAbsent(gameId, id -> new ReentrantLock());
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }
}
