package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display state of a grouping marker.
 */
public enum MarkerState {
    /** Pawn just joined the group. */
    ADDED("added"),
    /** Pawn is leaving; dropped once the move is acknowledged. */
    REMOVED("removed"),
    /** Settled. */
    ANIMATED("animated");

    private final String value;

    MarkerState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
