package com.ludo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One of the four pawns of a color.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Pawn {

    private Color color;

    /** 0-3, fixed at creation. */
    private int index;

    private SquareId squareId;

    private boolean endReached;

    private PendingAction action;

    public boolean isOn(SquareId square) {
        return squareId != null && squareId.equals(square);
    }

    public boolean canPerform(MoveKind kind) {
        return action != null && action.getKind() == kind;
    }

    public void clearAction() {
        action = null;
    }

    /**
     * Send the pawn back to its own holding cell.
     */
    public void returnToInitial() {
        squareId = SquareId.initial(color, index);
        endReached = false;
    }

    public PawnRef toRef() {
        return new PawnRef(color, index);
    }
}
