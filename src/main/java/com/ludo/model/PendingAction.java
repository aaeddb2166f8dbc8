package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The move a pawn may perform on the current roll, written as
 * {@code [<move event>, <pawn index>]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"kind", "pawnIndex"})
public class PendingAction {

    private MoveKind kind;

    private int pawnIndex;
}
