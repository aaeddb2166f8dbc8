package com.ludo.exception;

/**
 * Reasons an action is refused. Rejections never mutate the game.
 */
public enum Rejection {
    NOT_IN_GAME("not-in-game", "Not in game"),
    INVALID_GAME("invalid-game", "Invalid game id"),
    GAME_FINISHED("game-finished", "Game is already finished"),
    ALREADY_FINISHED("already-finished-color", "You are already the top %d"),
    GAME_FULL("game-full", "Game is full"),
    ALREADY_IN_GAME("already-in-game", "Already in game"),
    INVALID_COLOR("invalid-color", "Invalid color"),
    COLOR_TAKEN("color-taken", "Color already taken"),
    COLORS_LOCKED("colors-locked", "Colors cannot be changed once the game has started"),
    NOT_YOUR_TURN("not-your-turn", "Not your turn"),
    NOT_ENOUGH_PLAYERS("not-enough-players", "Not enough players"),
    NOT_ROLLABLE("dice-not-rollable", "Dice cannot be rolled right now"),
    NO_PENDING_ROLL("no-pending-roll", "There is no dice result to confirm"),
    INVALID_PAWN("invalid-pawn-index", "Invalid pawn index"),
    PAWN_NOT_MOVABLE("pawn-not-movable", "Pawn cannot be moved"),
    INELIGIBLE_ROLL("ineligible-roll", "Dice roll is neither 1 nor 6"),
    OVERSHOOT("overshoot", "Dice result is too high");

    private final String code;
    private final String message;

    Rejection(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String format(Object... args) {
        return args.length == 0 ? message : String.format(message, args);
    }
}
