package com.ludo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A board cell. Only road cells carry the owning segment color and the flags.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Square {

    private SquareId id;

    private Color color;

    /** Capture-immune. */
    private boolean safeZone;

    /** Where pawns of {@link #color} leave the ring into their lane. */
    private boolean exit;

    /** Where pawns of {@link #color} join the ring. Always safe. */
    private boolean entrance;
}
