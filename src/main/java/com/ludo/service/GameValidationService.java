package com.ludo.service;

import com.ludo.exception.GameRuleException;
import com.ludo.exception.Rejection;
import com.ludo.model.Color;
import com.ludo.model.Game;
import com.ludo.model.MoveKind;
import com.ludo.model.Pawn;
import com.ludo.model.Player;
import com.ludo.model.SquareId;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Authorizes incoming actions against the current game state. Every check is free of
 * side effects and throws a {@link GameRuleException} on the first failure.
 */
@Service
public class GameValidationService {

    /**
     * The session is a player of an unfinished game and its color has not finished yet.
     */
    public Player validateMember(Game game, String sessionId) {
        Player player = game.findPlayer(sessionId)
                .orElseThrow(() -> new GameRuleException(Rejection.NOT_IN_GAME));

        if (game.isFinished()) {
            throw new GameRuleException(Rejection.GAME_FINISHED);
        }
        int place = game.getWinners().placeOf(player.getColor());
        if (place > 0) {
            throw new GameRuleException(Rejection.ALREADY_FINISHED, place);
        }
        return player;
    }

    public Player validateColorChoice(Game game, String sessionId, Color color) {
        Player player = validateMember(game, sessionId);
        if (color == null) {
            throw new GameRuleException(Rejection.INVALID_COLOR);
        }
        if (game.isSeated() || (player.getColor() != null && game.isStarted())) {
            throw new GameRuleException(Rejection.COLORS_LOCKED);
        }
        if (game.isColorTaken(color)) {
            throw new GameRuleException(Rejection.COLOR_TAKEN);
        }
        return player;
    }

    public Player validateDiceRoll(Game game, String sessionId) {
        Player player = validateMember(game, sessionId);
        validateTurn(game, sessionId);
        if (!game.getDice().isAbleToRoll()) {
            throw new GameRuleException(Rejection.NOT_ROLLABLE);
        }
        validateFullTable(game);
        return player;
    }

    public Player validateRollResult(Game game, String sessionId) {
        Player player = validateMember(game, sessionId);
        validateTurn(game, sessionId);
        validateFullTable(game);
        if (!game.getDice().isRollAnimation()) {
            throw new GameRuleException(Rejection.NO_PENDING_ROLL);
        }
        return player;
    }

    /**
     * Checks a pawn move of the given kind and returns the pawn to move.
     */
    public Pawn validateMove(Game game, String sessionId, MoveKind kind, int pawnIndex) {
        Player player = validateMember(game, sessionId);
        validateTurn(game, sessionId);
        validateFullTable(game);

        List<Pawn> pawns = game.getBoard().pawnsOf(player.getColor());
        Pawn pawn = pawns.stream()
                .filter(p -> p.getIndex() == pawnIndex)
                .findFirst()
                .orElseThrow(() -> new GameRuleException(Rejection.INVALID_PAWN));

        if (!pawn.canPerform(kind)) {
            throw new GameRuleException(Rejection.PAWN_NOT_MOVABLE);
        }

        int result = game.getDice().getResult();
        if (kind == MoveKind.ENTRY && !DiceService.isEntryRoll(result)) {
            throw new GameRuleException(Rejection.INELIGIBLE_ROLL);
        }
        if (kind == MoveKind.HOME && result > SquareId.HOME_INDEX - pawn.getSquareId().getIndex()) {
            throw new GameRuleException(Rejection.OVERSHOOT);
        }
        return pawn;
    }

    private void validateTurn(Game game, String sessionId) {
        if (!sessionId.equals(game.getCurrent())) {
            throw new GameRuleException(Rejection.NOT_YOUR_TURN);
        }
    }

    private void validateFullTable(Game game) {
        if (!game.isSeated()) {
            throw new GameRuleException(Rejection.NOT_ENOUGH_PLAYERS);
        }
    }
}
