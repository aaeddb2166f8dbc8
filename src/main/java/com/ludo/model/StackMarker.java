package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marks a pawn stacked on a cell with pawns of its own color. One marker per color is the main one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StackMarker {

    private Color color;

    @JsonProperty("id")
    private int index;

    private MarkerState type;

    @JsonProperty("isMain")
    private boolean main;

    @JsonIgnore
    public boolean isRemoved() {
        return type == MarkerState.REMOVED;
    }

    public boolean matches(Pawn pawn) {
        return color == pawn.getColor() && index == pawn.getIndex();
    }
}
