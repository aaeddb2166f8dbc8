package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * First, second and third place. The fourth color is implicitly last.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Winners {

    public static final int SLOTS = 3;

    @JsonProperty("1")
    private Color first;

    @JsonProperty("2")
    private Color second;

    @JsonProperty("3")
    private Color third;

    /**
     * Place (1-3) held by the color, or 0.
     */
    public int placeOf(Color color) {
        if (color == null) return 0;
        if (color == first) return 1;
        if (color == second) return 2;
        if (color == third) return 3;
        return 0;
    }

    public boolean contains(Color color) {
        return placeOf(color) > 0;
    }

    @JsonIgnore
    public boolean isComplete() {
        return first != null && second != null && third != null;
    }

    /**
     * Write the color into the next free slot.
     *
     * @return the place assigned
     * @throws IllegalStateException if the color is already placed or all slots are taken
     */
    public int record(Color color) {
        if (contains(color)) {
            throw new IllegalStateException("Color already placed: " + color);
        }
        if (first == null) {
            first = color;
            return 1;
        }
        if (second == null) {
            second = color;
            return 2;
        }
        if (third == null) {
            third = color;
            return 3;
        }
        throw new IllegalStateException("All winner slots are taken");
    }
}
