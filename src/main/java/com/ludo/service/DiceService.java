package com.ludo.service;

import com.ludo.model.Color;
import com.ludo.model.Dice;
import com.ludo.model.Game;
import com.ludo.model.MoveKind;
import com.ludo.model.Pawn;
import com.ludo.model.PendingAction;
import com.ludo.model.SquareId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

/**
 * Dice rolls, move eligibility for a roll, and the six-grants-another-roll rule.
 */
@Service
@Slf4j
public class DiceService {

    private final Random random;

    public DiceService() {
        this(new SecureRandom());
    }

    DiceService(Random random) {
        this.random = random;
    }

    /**
     * Roll the die for the current player.
     */
    public int roll(Game game) {
        Dice dice = game.getDice();
        dice.setAbleToRoll(false);
        dice.setRollAnimation(true);
        dice.setResult(random.nextInt(6) + 1);
        dice.setCount(dice.getCount() + 1);
        log.debug("Game {} rolled {} (roll {} of chain)", game.getId(), dice.getResult(), dice.getCount());
        return dice.getResult();
    }

    /**
     * Give every pawn of the color that can act on the last roll its pending action.
     *
     * @return {@code true} if at least one pawn can move
     */
    public boolean assignActions(Game game, Color color) {
        int result = game.getDice().getResult();
        List<Pawn> pawns = game.getBoard().pawnsOf(color);
        boolean movable = false;

        for (Pawn pawn : pawns) {
            pawn.clearAction();
            MoveKind kind = eligibleMove(pawn, result);
            if (kind != null) {
                pawn.setAction(new PendingAction(kind, pawn.getIndex()));
                movable = true;
            }
        }
        game.getDice().setRollAnimation(false);
        return movable;
    }

    MoveKind eligibleMove(Pawn pawn, int result) {
        SquareId at = pawn.getSquareId();
        if (at.isInitial()) {
            return isEntryRoll(result) ? MoveKind.ENTRY : null;
        }
        if (at.isLane()) {
            if (at.isHome()) {
                return null;
            }
            return result <= SquareId.HOME_INDEX - at.getIndex() ? MoveKind.HOME : null;
        }
        return MoveKind.ROAD;
    }

    public static boolean isEntryRoll(int result) {
        return result == 1 || result == 6;
    }

    /**
     * A six keeps the turn, up to {@link Dice#MAX_ROLLS} rolls in one chain.
     */
    public boolean grantsBonusRoll(Dice dice) {
        return dice.getResult() == 6 && dice.getCount() < Dice.MAX_ROLLS;
    }
}
