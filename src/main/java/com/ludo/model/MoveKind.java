package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three kinds of pawn move, one per position class. The wire value is the
 * inbound event that performs the move.
 */
public enum MoveKind {
    ENTRY("game:move-initial"),
    ROAD("game:move-road"),
    HOME("game:move-final");

    private final String event;

    MoveKind(String event) {
        this.event = event;
    }

    @JsonValue
    public String getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return event;
    }
}
