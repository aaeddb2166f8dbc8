package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four pawn colors, in seating and board-segment order.
 */
public enum Color {
    RED("red"),
    GREEN("green"),
    YELLOW("yellow"),
    BLUE("blue");

    private final String value;

    Color(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a wire value, or {@code null} when it names no color.
     */
    public static Color fromValue(String value) {
        for (Color color : values()) {
            if (color.value.equalsIgnoreCase(value) || color.name().equalsIgnoreCase(value)) {
                return color;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
