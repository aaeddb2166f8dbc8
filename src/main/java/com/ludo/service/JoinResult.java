package com.ludo.service;

import com.ludo.model.Game;

/**
 * Outcome of entering a game: the game entered and, when the session left another game
 * that still has players, that game too.
 */
public record JoinResult(Game game, Game previousGame) {

    public boolean hasPreviousGame() {
        return previousGame != null;
    }
}
