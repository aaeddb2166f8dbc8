package com.ludo.service;

import com.ludo.model.Color;
import com.ludo.model.Game;
import com.ludo.model.Pawn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for recording finishing colors.
 */
@Service
@Slf4j
public class WinConditionService {

    /**
     * Record the color in the next winners slot once all of its pawns are home.
     *
     * @return {@code true} if the color was placed by this call
     */
    public boolean checkColorFinished(Game game, Color color) {
        if (color == null || game.getWinners().contains(color)) {
            return false;
        }
        List<Pawn> pawns = game.getBoard().pawnsOf(color);
        if (pawns.isEmpty() || !pawns.stream().allMatch(Pawn::isEndReached)) {
            return false;
        }
        int place = game.getWinners().record(color);
        log.info("Game {}: {} finished in place {}", game.getId(), color, place);
        return true;
    }

    public boolean isGameOver(Game game) {
        return game.getWinners().isComplete();
    }
}
