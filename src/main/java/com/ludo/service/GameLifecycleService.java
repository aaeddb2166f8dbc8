package com.ludo.service;

import com.ludo.exception.GameRuleException;
import com.ludo.exception.Rejection;
import com.ludo.model.Board;
import com.ludo.model.Color;
import com.ludo.model.Dice;
import com.ludo.model.Game;
import com.ludo.model.MoveRecord;
import com.ludo.model.Pawn;
import com.ludo.model.Player;
import com.ludo.repository.GameRepository;
import com.ludo.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service responsible for game lifecycle: creation, joining, seating, leaving and purging.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameLifecycleService {

    private final GameRepository gameRepository;
    private final SessionRepository sessionRepository;
    private final BoardService boardService;
    private final GameValidationService validationService;
    private final TurnManagementService turnManagementService;
    private final StackingService stackingService;
    private final WinConditionService winConditionService;

    /**
     * Create a new game with the session as its only player and current turn holder.
     */
    public Game createGame(String sessionId) {
        List<Player> players = new ArrayList<>();
        players.add(Player.builder().sessionId(sessionId).build());

        Game game = Game.builder()
                .id(UUID.randomUUID().toString())
                .players(players)
                .board(boardService.createBoard())
                .current(sessionId)
                .build();

        game = gameRepository.save(game);
        sessionRepository.bind(sessionId, game.getId());
        log.info("Created game {} for session {}", game.getId(), sessionId);
        return game;
    }

    public void validateJoin(Game game, String sessionId) {
        if (game.isFull()) {
            throw new GameRuleException(Rejection.GAME_FULL);
        }
        if (game.hasPlayer(sessionId)) {
            throw new GameRuleException(Rejection.ALREADY_IN_GAME);
        }
    }

    /**
     * Seat the session in the game, without a color yet. A game left without a turn holder
     * gives the turn to the newcomer.
     */
    public Game joinGame(Game game, String sessionId) {
        validateJoin(game, sessionId);
        game.getPlayers().add(Player.builder().sessionId(sessionId).build());
        if (game.getCurrent() == null) {
            game.setCurrent(sessionId);
        }

        game = gameRepository.save(game);
        sessionRepository.bind(sessionId, game.getId());
        log.info("Session {} joined game {} ({} players)", sessionId, game.getId(), game.getPlayers().size());
        return game;
    }

    /**
     * Assign a color. Once four distinct colors are seated and the current player is due
     * to roll, rolling opens.
     */
    public Game chooseColor(Game game, String sessionId, Color color) {
        Player player = validationService.validateColorChoice(game, sessionId, color);
        player.setColor(color);

        if (game.isSeated() && game.isAwaitingRoll()) {
            game.getDice().setAbleToRoll(true);
        }
        log.info("Session {} chose {} in game {}", sessionId, color, game.getId());
        return gameRepository.save(game);
    }

    /**
     * Take the session off the roster. The game is deleted when nobody is left. Rolling
     * closes until the table is seated again; a departing turn holder forfeits the rest
     * of the turn to the next unfinished player.
     *
     * @return the game when it still has players
     */
    public Optional<Game> removePlayer(Game game, String sessionId) {
        List<Player> players = game.getPlayers();
        int seat = indexOf(players, sessionId);
        boolean wasCurrent = seat >= 0 && sessionId.equals(game.getCurrent());
        String successor = wasCurrent ? turnManagementService.nextPlayer(game) : null;
        if (seat >= 0) {
            players.remove(seat);
        }

        if (players.isEmpty()) {
            gameRepository.deleteById(game.getId());
            log.info("Game {} deleted, last player {} left", game.getId(), sessionId);
            return Optional.empty();
        }

        if (seat >= 0) {
            game.getDice().setAbleToRoll(false);
        }
        if (wasCurrent) {
            abandonTurn(game);
            game.setCurrent(sessionId.equals(successor) ? null : successor);
            log.debug("Game {} turn passes from departed {} to {}", game.getId(), sessionId, game.getCurrent());

            if (winConditionService.isGameOver(game)) {
                purge(game);
                return Optional.of(game);
            }
        }
        log.info("Session {} left game {} ({} players)", sessionId, game.getId(), players.size());
        return Optional.of(gameRepository.save(game));
    }

    /**
     * Settle whatever the departing turn holder left in flight: an unacknowledged move is
     * completed, pending actions and the roll chain are dropped.
     */
    private void abandonTurn(Game game) {
        Board board = game.getBoard();
        MoveRecord move = board.getMovePawn();
        if (move != null) {
            stackingService.prune(board, move);
            board.setMovePawn(null);
            winConditionService.checkColorFinished(game, move.getColor());
        }
        board.getPawns().values().forEach(pawns -> pawns.forEach(Pawn::clearAction));

        Dice dice = game.getDice();
        dice.setCount(0);
        dice.setRollAnimation(false);
    }

    public void unbindSession(String sessionId) {
        sessionRepository.unbind(sessionId);
    }

    /**
     * Drop a finished game and the session index entries of its players.
     */
    public void purge(Game game) {
        gameRepository.deleteById(game.getId());
        game.getPlayers().forEach(p -> sessionRepository.unbind(p.getSessionId()));
        log.info("Game {} finished with winners {}, purged", game.getId(), game.getWinners());
    }

    private int indexOf(List<Player> players, String sessionId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getSessionId().equals(sessionId)) {
                return i;
            }
        }
        return -1;
    }
}
