package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Corner of a square a color is drawn in when several colors share it.
 * Declaration order is the claim preference order.
 */
public enum Quadrant {
    TOP_LEFT("top-left"),
    TOP_RIGHT("top-right"),
    BOTTOM_LEFT("bottom-left"),
    BOTTOM_RIGHT("bottom-right");

    private final String value;

    Quadrant(String value) {
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
