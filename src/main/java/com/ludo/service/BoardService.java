package com.ludo.service;

import com.ludo.model.Board;
import com.ludo.model.Color;
import com.ludo.model.Pawn;
import com.ludo.model.Square;
import com.ludo.model.SquareId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the static board layout and the initial pawn placement.
 * <p>
 * The shared road is split into one 13-cell segment per color, in color order.
 * Within a segment, offset 3 is safe, offset 6 is the color's exit into its lane
 * and offset 8 is the color's (safe) entrance.
 */
@Service
@Slf4j
public class BoardService {

    public static final int SEGMENT_LENGTH = SquareId.ROAD_LENGTH / Color.values().length;
    public static final int SAFE_OFFSET = 3;
    public static final int EXIT_OFFSET = 6;
    public static final int ENTRANCE_OFFSET = 8;

    public Board createBoard() {
        Board board = Board.builder()
                .road(generateRoad())
                .initialZone(generateZone(SquareId.INITIAL_LENGTH, true))
                .finalZone(generateZone(SquareId.FINAL_LENGTH, false))
                .pawns(generatePawns())
                .build();
        log.debug("Generated board with {} road squares", board.getRoad().size());
        return board;
    }

    private List<Square> generateRoad() {
        List<Square> road = new ArrayList<>(SquareId.ROAD_LENGTH);
        Color[] colors = Color.values();
        for (int c = 0; c < colors.length; c++) {
            for (int offset = 0; offset < SEGMENT_LENGTH; offset++) {
                road.add(Square.builder()
                        .id(SquareId.road(c * SEGMENT_LENGTH + offset))
                        .color(colors[c])
                        .safeZone(offset == SAFE_OFFSET || offset == ENTRANCE_OFFSET)
                        .exit(offset == EXIT_OFFSET)
                        .entrance(offset == ENTRANCE_OFFSET)
                        .build());
            }
        }
        return road;
    }

    private Map<Color, List<Square>> generateZone(int size, boolean initial) {
        Map<Color, List<Square>> zone = new LinkedHashMap<>();
        for (Color color : Color.values()) {
            List<Square> squares = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                SquareId id = initial ? SquareId.initial(color, i) : SquareId.lane(color, i);
                squares.add(Square.builder().id(id).color(color).build());
            }
            zone.put(color, squares);
        }
        return zone;
    }

    private Map<Color, List<Pawn>> generatePawns() {
        Map<Color, List<Pawn>> pawns = new LinkedHashMap<>();
        for (Color color : Color.values()) {
            List<Pawn> colorPawns = new ArrayList<>(SquareId.INITIAL_LENGTH);
            for (int i = 0; i < SquareId.INITIAL_LENGTH; i++) {
                colorPawns.add(Pawn.builder()
                        .color(color)
                        .index(i)
                        .squareId(SquareId.initial(color, i))
                        .build());
            }
            pawns.put(color, colorPawns);
        }
        return pawns;
    }
}
