package com.ludo.service;

import com.ludo.model.Board;
import com.ludo.model.Color;
import com.ludo.model.Game;
import com.ludo.model.MoveRecord;
import com.ludo.model.Pawn;
import com.ludo.model.Square;
import com.ludo.model.SquareId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves pawn moves: entry onto the ring, a walk along the ring (possibly turning
 * into the private lane), and advancing inside the lane. Legality is checked beforehand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MoveService {

    /** Lane counter value before the mover has crossed its own exit. */
    static final int LANE_DISABLED = -2;

    private final CaptureService captureService;
    private final StackingService stackingService;

    /**
     * Move a pawn from its holding cell onto its color's entrance.
     */
    public MoveRecord moveFromInitial(Game game, Pawn pawn) {
        Board board = game.getBoard();
        SquareId start = pawn.getSquareId();
        clearActions(board, pawn.getColor());

        Square entrance = board.entranceOf(pawn.getColor());
        pawn.setSquareId(entrance.getId());

        MoveRecord record = record(pawn, start, List.of(entrance.getId()));
        board.setMovePawn(record);
        stackingService.arrive(board, pawn);
        log.debug("Game {}: {} pawn {} entered at {}", game.getId(), pawn.getColor(), pawn.getIndex(), entrance.getId());
        return record;
    }

    /**
     * Walk a ring pawn forward by the dice result, capturing on an unsafe ring destination.
     */
    public MoveRecord moveOnRoad(Game game, Pawn pawn) {
        Board board = game.getBoard();
        SquareId start = pawn.getSquareId();
        stackingService.leave(board, pawn);

        List<SquareId> path = roadPath(board, pawn, game.getDice().getResult());
        SquareId destination = path.get(path.size() - 1);
        pawn.setSquareId(destination);
        pawn.setEndReached(destination.isHome());
        clearActions(board, pawn.getColor());

        MoveRecord record = record(pawn, start, path);
        board.setMovePawn(record);
        captureService.capture(board, pawn).ifPresent(record::setSmash);
        stackingService.arrive(board, pawn);
        log.debug("Game {}: {} pawn {} moved {} -> {}", game.getId(), pawn.getColor(), pawn.getIndex(), start, path);
        return record;
    }

    /**
     * Advance a pawn inside its lane. The roll never overshoots home here.
     */
    public MoveRecord moveInLane(Game game, Pawn pawn) {
        Board board = game.getBoard();
        SquareId start = pawn.getSquareId();
        stackingService.leave(board, pawn);

        List<SquareId> path = lanePath(pawn, game.getDice().getResult());
        SquareId destination = path.get(path.size() - 1);
        pawn.setSquareId(destination);
        pawn.setEndReached(destination.isHome());
        clearActions(board, pawn.getColor());

        MoveRecord record = record(pawn, start, path);
        board.setMovePawn(record);
        stackingService.arrive(board, pawn);
        log.debug("Game {}: {} pawn {} moved {} -> {}", game.getId(), pawn.getColor(), pawn.getIndex(), start, path);
        return record;
    }

    /**
     * Cells visited walking {@code steps} cells from the pawn's ring cell. Once the walk
     * crosses the pawn's own exit, every further step lands in its lane, starting at index 0.
     * The ring wraps after its last cell.
     */
    List<SquareId> roadPath(Board board, Pawn pawn, int steps) {
        Color color = pawn.getColor();
        int offset = pawn.getSquareId().getIndex();
        int laneIndex = isOwnExit(board.roadAt(offset), color) ? LANE_DISABLED + 1 : LANE_DISABLED;

        List<SquareId> path = new ArrayList<>(steps);
        for (int step = 0; step < steps; step++) {
            offset = (offset + 1) % board.getRoad().size();
            Square cell = board.roadAt(offset);
            if (laneIndex > LANE_DISABLED || isOwnExit(cell, color)) {
                laneIndex++;
            }
            path.add(laneIndex >= 0 ? SquareId.lane(color, laneIndex) : cell.getId());
        }
        return path;
    }

    List<SquareId> lanePath(Pawn pawn, int steps) {
        int from = pawn.getSquareId().getIndex();
        List<SquareId> path = new ArrayList<>(steps);
        for (int i = from + 1; i <= from + steps; i++) {
            path.add(SquareId.lane(pawn.getColor(), i));
        }
        return path;
    }

    private boolean isOwnExit(Square square, Color color) {
        return square.getColor() == color && square.isExit();
    }

    private void clearActions(Board board, Color color) {
        board.pawnsOf(color).forEach(Pawn::clearAction);
    }

    private MoveRecord record(Pawn pawn, SquareId start, List<SquareId> path) {
        return MoveRecord.builder()
                .color(pawn.getColor())
                .index(pawn.getIndex())
                .startingSquareId(start)
                .squaresIds(new ArrayList<>(path))
                .build();
    }
}
