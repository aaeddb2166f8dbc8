package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Board layout, pawn positions and the presentation metadata of co-located pawns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Board {

    @Builder.Default
    private List<Square> road = new ArrayList<>();

    @Builder.Default
    private Map<Color, List<Square>> initialZone = new LinkedHashMap<>();

    @Builder.Default
    private Map<Color, List<Square>> finalZone = new LinkedHashMap<>();

    @Builder.Default
    private Map<Color, List<Pawn>> pawns = new LinkedHashMap<>();

    private MoveRecord movePawn;

    /** Cells shared by several colors. */
    @JsonProperty("mitosis")
    @Builder.Default
    private Map<SquareId, List<ColorGroupMarker>> colorGroups = new LinkedHashMap<>();

    /** Cells stacking pawns of one color. */
    @JsonProperty("karyogamy")
    @Builder.Default
    private Map<SquareId, List<StackMarker>> stacks = new LinkedHashMap<>();

    public List<Pawn> pawnsOf(Color color) {
        return pawns.getOrDefault(color, List.of());
    }

    /**
     * Every pawn on the cell, in color order.
     */
    public List<Pawn> pawnsOn(SquareId squareId) {
        List<Pawn> result = new ArrayList<>();
        for (Color color : Color.values()) {
            for (Pawn pawn : pawnsOf(color)) {
                if (pawn.isOn(squareId)) {
                    result.add(pawn);
                }
            }
        }
        return result;
    }

    public Square roadAt(int offset) {
        return road.get(Math.floorMod(offset, road.size()));
    }

    public Square roadSquare(SquareId squareId) {
        return road.get(squareId.getIndex());
    }

    public Square entranceOf(Color color) {
        return road.stream()
                .filter(s -> s.getColor() == color && s.isEntrance())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No entrance for " + color));
    }

    /**
     * Structural sanity of a board read back from storage.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (road == null || road.size() != SquareId.ROAD_LENGTH || pawns == null) {
            return false;
        }
        for (int i = 0; i < road.size(); i++) {
            Square square = road.get(i);
            if (square == null || square.getId() == null || !square.getId().equals(SquareId.road(i))) {
                return false;
            }
        }
        for (Color color : Color.values()) {
            List<Pawn> colorPawns = pawns.get(color);
            if (colorPawns == null || colorPawns.size() != SquareId.INITIAL_LENGTH) {
                return false;
            }
            for (int i = 0; i < colorPawns.size(); i++) {
                Pawn pawn = colorPawns.get(i);
                if (pawn == null || pawn.getIndex() != i || pawn.getColor() != color || pawn.getSquareId() == null) {
                    return false;
                }
                SquareId at = pawn.getSquareId();
                if (!at.isRoad() && at.getColor() != color) {
                    return false;
                }
            }
        }
        return colorGroups != null && stacks != null;
    }
}
