package com.ludo.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity of a pawn, used for the captured pawn of a move.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PawnRef {

    private Color color;

    private int index;
}
