package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Stable identifier of a board cell: {@code initial-<color>-<0..3>},
 * {@code road-<0..51>} or {@code final-<color>-<0..5>}.
 * <p>
 * Instances are only created through the factories, which reject malformed ids.
 */
@Getter
@EqualsAndHashCode
public final class SquareId {

    public static final int ROAD_LENGTH = 52;
    public static final int INITIAL_LENGTH = 4;
    public static final int FINAL_LENGTH = 6;
    public static final int HOME_INDEX = FINAL_LENGTH - 1;

    private final Zone zone;
    private final Color color;
    private final int index;

    private SquareId(Zone zone, Color color, int index) {
        this.zone = zone;
        this.color = color;
        this.index = index;
    }

    public static SquareId road(int index) {
        if (index < 0 || index >= ROAD_LENGTH) {
            throw new IllegalArgumentException("Road index out of range: " + index);
        }
        return new SquareId(Zone.ROAD, null, index);
    }

    public static SquareId initial(Color color, int index) {
        if (index < 0 || index >= INITIAL_LENGTH) {
            throw new IllegalArgumentException("Initial index out of range: " + index);
        }
        return new SquareId(Zone.INITIAL, requireColor(color), index);
    }

    public static SquareId lane(Color color, int index) {
        if (index < 0 || index >= FINAL_LENGTH) {
            throw new IllegalArgumentException("Final lane index out of range: " + index);
        }
        return new SquareId(Zone.FINAL, requireColor(color), index);
    }

    /**
     * Parse the string form of a square id.
     *
     * @throws IllegalArgumentException if the value is not a valid square id
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SquareId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Square id must not be null");
        }
        String[] parts = value.split("-");
        try {
            Zone zone = Zone.fromPrefix(parts[0]);
            if (zone == Zone.ROAD) {
                if (parts.length != 2) {
                    throw new IllegalArgumentException("Malformed square id: " + value);
                }
                return road(Integer.parseInt(parts[1]));
            }
            if (parts.length != 3) {
                throw new IllegalArgumentException("Malformed square id: " + value);
            }
            Color color = Color.fromValue(parts[1]);
            int index = Integer.parseInt(parts[2]);
            return zone == Zone.INITIAL ? initial(color, index) : lane(color, index);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed square id: " + value, e);
        }
    }

    private static Color requireColor(Color color) {
        if (color == null) {
            throw new IllegalArgumentException("Zone square requires a color");
        }
        return color;
    }

    public boolean isRoad() {
        return zone == Zone.ROAD;
    }

    public boolean isInitial() {
        return zone == Zone.INITIAL;
    }

    public boolean isLane() {
        return zone == Zone.FINAL;
    }

    public boolean isHome() {
        return zone == Zone.FINAL && index == HOME_INDEX;
    }

    @JsonValue
    public String getValue() {
        return zone == Zone.ROAD
                ? zone.getPrefix() + "-" + index
                : zone.getPrefix() + "-" + color.getValue() + "-" + index;
    }

    @Override
    public String toString() {
        return getValue();
    }
}
