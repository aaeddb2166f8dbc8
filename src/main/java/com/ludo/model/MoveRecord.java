package com.ludo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Descriptor of the last pawn move, kept until the mover acknowledges the animation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveRecord {

    private Color color;

    private int index;

    private SquareId startingSquareId;

    @Builder.Default
    private List<SquareId> squaresIds = new ArrayList<>();

    /** Captured pawn, if any. */
    private PawnRef smash;
}
