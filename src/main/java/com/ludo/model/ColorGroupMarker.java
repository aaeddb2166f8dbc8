package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marks a pawn sharing a cell with pawns of other colors, and the corner its color is drawn in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ColorGroupMarker {

    private Color color;

    private int index;

    private Quadrant position;

    private MarkerState type;

    @JsonIgnore
    public boolean isRemoved() {
        return type == MarkerState.REMOVED;
    }

    public boolean matches(Pawn pawn) {
        return color == pawn.getColor() && index == pawn.getIndex();
    }
}
