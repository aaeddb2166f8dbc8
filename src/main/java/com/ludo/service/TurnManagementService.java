package com.ludo.service;

import com.ludo.model.Dice;
import com.ludo.model.Game;
import com.ludo.model.Player;
import com.ludo.model.Winners;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for turn succession.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnManagementService {

    private final DiceService diceService;

    /**
     * Session id of the next player after the current one, skipping colors that already finished.
     * The scan probes each seat at most once.
     */
    public String nextPlayer(Game game) {
        List<Player> players = game.getPlayers();
        Winners winners = game.getWinners();
        int currentIndex = indexOf(players, game.getCurrent());

        for (int probe = 1; probe <= players.size(); probe++) {
            Player candidate = players.get(Math.floorMod(currentIndex + probe, players.size()));
            if (!winners.contains(candidate.getColor())) {
                return candidate.getSessionId();
            }
        }
        throw new IllegalStateException("No active players remaining");
    }

    /**
     * Hand the turn to the next player with a fresh roll chain.
     */
    public void passTurn(Game game) {
        Dice dice = game.getDice();
        dice.setCount(0);
        dice.setAbleToRoll(true);
        String next = nextPlayer(game);
        log.debug("Game {} turn passes from {} to {}", game.getId(), game.getCurrent(), next);
        game.setCurrent(next);
    }

    /**
     * Close a completed move: the mover rolls again after a six within the roll cap,
     * otherwise the turn passes. A color that has just finished always passes.
     */
    public void endMove(Game game, boolean colorFinished) {
        game.getDice().setAbleToRoll(true);
        if (colorFinished || !diceService.grantsBonusRoll(game.getDice())) {
            passTurn(game);
        }
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
