package com.ludo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dice state of the current turn chain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Dice {

    /** Maximum number of rolls in one turn chain. */
    public static final int MAX_ROLLS = 3;

    /** Rolls made in this turn chain (0-3). */
    private int count;

    /** Last result, 1-6. */
    @Builder.Default
    private int result = 1;

    private boolean ableToRoll;

    private boolean rollAnimation;

    public static Dice fresh() {
        return Dice.builder().build();
    }
}
