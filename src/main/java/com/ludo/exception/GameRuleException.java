package com.ludo.exception;

/**
 * An action refused by the rules. Thrown before any state is touched.
 */
public class GameRuleException extends IllegalStateException {

    private final Rejection rejection;

    public GameRuleException(Rejection rejection, Object... args) {
        super(rejection.format(args));
        this.rejection = rejection;
    }

    public Rejection getRejection() {
        return rejection;
    }
}
