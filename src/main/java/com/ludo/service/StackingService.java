package com.ludo.service;

import com.ludo.model.Board;
import com.ludo.model.Color;
import com.ludo.model.ColorGroupMarker;
import com.ludo.model.MarkerState;
import com.ludo.model.MoveRecord;
import com.ludo.model.Pawn;
import com.ludo.model.Quadrant;
import com.ludo.model.SquareId;
import com.ludo.model.StackMarker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the grouping markers of co-located pawns. Markers only drive rendering;
 * they never affect legality or captures.
 * <p>
 * Two groupings are tracked per cell: pawns of different colors sharing it
 * ({@link Board#getColorGroups()}, one corner per color) and pawns of one color
 * stacked on it ({@link Board#getStacks()}, one main marker per color).
 */
@Service
@Slf4j
public class StackingService {

    /**
     * Flag the pawn's markers on its current cell as leaving. Call before the pawn moves.
     */
    public void leave(Board board, Pawn pawn) {
        SquareId at = pawn.getSquareId();

        List<ColorGroupMarker> groups = board.getColorGroups().get(at);
        if (groups != null) {
            groups.stream()
                    .filter(m -> m.matches(pawn) && !m.isRemoved())
                    .findFirst()
                    .ifPresent(m -> m.setType(MarkerState.REMOVED));
        }

        List<StackMarker> stack = board.getStacks().get(at);
        if (stack != null) {
            stack.stream()
                    .filter(m -> m.matches(pawn) && !m.isRemoved())
                    .findFirst()
                    .ifPresent(m -> {
                        m.setType(MarkerState.REMOVED);
                        m.setMain(false);
                        promoteMain(stack, pawn.getColor());
                    });
        }
    }

    /**
     * Record the pawn on its new cell when it now shares it. Call after the pawn moved.
     */
    public void arrive(Board board, Pawn pawn) {
        SquareId at = pawn.getSquareId();
        List<Pawn> occupants = board.pawnsOn(at);
        if (occupants.size() < 2) {
            return;
        }
        addColorGroups(board, at, occupants);
        addStacks(board, at, occupants);
    }

    /**
     * Drop leaving markers once the move animation is acknowledged, settle the markers
     * of the vacated and the newly occupied cells, and forget cells no longer shared.
     */
    public void prune(Board board, MoveRecord move) {
        Set<SquareId> touched = new LinkedHashSet<>();
        touched.add(move.getStartingSquareId());
        board.pawnsOf(move.getColor()).stream()
                .filter(p -> p.getIndex() == move.getIndex())
                .findFirst()
                .ifPresent(p -> touched.add(p.getSquareId()));

        pruneColorGroups(board, touched);
        pruneStacks(board, touched);
    }

    private void addColorGroups(Board board, SquareId at, List<Pawn> occupants) {
        if (distinctColors(occupants) < 2) {
            return;
        }
        List<ColorGroupMarker> markers = board.getColorGroups().computeIfAbsent(at, k -> new ArrayList<>());

        for (Color color : Color.values()) {
            List<Pawn> colorPawns = occupants.stream().filter(p -> p.getColor() == color).toList();
            if (colorPawns.isEmpty()) {
                continue;
            }
            Quadrant position = quadrantFor(markers, color);
            for (Pawn pawn : colorPawns) {
                boolean recorded = markers.stream().anyMatch(m -> m.matches(pawn) && !m.isRemoved());
                if (!recorded) {
                    markers.add(ColorGroupMarker.builder()
                            .color(color)
                            .index(pawn.getIndex())
                            .position(position)
                            .type(MarkerState.ADDED)
                            .build());
                }
            }
        }
    }

    /**
     * Corner already held by the color on this cell, else the first free one.
     */
    Quadrant quadrantFor(List<ColorGroupMarker> markers, Color color) {
        for (ColorGroupMarker marker : markers) {
            if (marker.getColor() == color && !marker.isRemoved()) {
                return marker.getPosition();
            }
        }
        for (Quadrant quadrant : Quadrant.values()) {
            boolean claimed = markers.stream().anyMatch(m -> !m.isRemoved() && m.getPosition() == quadrant);
            if (!claimed) {
                return quadrant;
            }
        }
        throw new IllegalStateException("No free quadrant for " + color);
    }

    private void addStacks(Board board, SquareId at, List<Pawn> occupants) {
        for (Color color : Color.values()) {
            List<Pawn> colorPawns = occupants.stream().filter(p -> p.getColor() == color).toList();
            if (colorPawns.size() < 2) {
                continue;
            }
            List<StackMarker> markers = board.getStacks().computeIfAbsent(at, k -> new ArrayList<>());
            for (Pawn pawn : colorPawns) {
                boolean recorded = markers.stream().anyMatch(m -> m.matches(pawn) && !m.isRemoved());
                if (!recorded) {
                    markers.add(StackMarker.builder()
                            .color(color)
                            .index(pawn.getIndex())
                            .type(MarkerState.ADDED)
                            .build());
                }
            }
            promoteMain(markers, color);
        }
    }

    private void promoteMain(List<StackMarker> markers, Color color) {
        List<StackMarker> active = markers.stream()
                .filter(m -> m.getColor() == color && !m.isRemoved())
                .toList();
        if (!active.isEmpty() && active.stream().noneMatch(StackMarker::isMain)) {
            active.get(0).setMain(true);
        }
    }

    private void pruneColorGroups(Board board, Set<SquareId> touched) {
        Iterator<Map.Entry<SquareId, List<ColorGroupMarker>>> it = board.getColorGroups().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<SquareId, List<ColorGroupMarker>> entry = it.next();
            List<ColorGroupMarker> markers = entry.getValue();
            markers.removeIf(ColorGroupMarker::isRemoved);
            if (touched.contains(entry.getKey())) {
                markers.forEach(m -> m.setType(MarkerState.ANIMATED));
            }
            if (markers.isEmpty() || distinctColors(board.pawnsOn(entry.getKey())) < 2) {
                it.remove();
            }
        }
    }

    private void pruneStacks(Board board, Set<SquareId> touched) {
        Iterator<Map.Entry<SquareId, List<StackMarker>>> it = board.getStacks().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<SquareId, List<StackMarker>> entry = it.next();
            List<Pawn> occupants = board.pawnsOn(entry.getKey());
            List<StackMarker> markers = entry.getValue();
            markers.removeIf(m -> m.isRemoved()
                    || occupants.stream().filter(p -> p.getColor() == m.getColor()).count() < 2);
            if (touched.contains(entry.getKey())) {
                markers.forEach(m -> m.setType(MarkerState.ANIMATED));
            }
            if (markers.isEmpty()) {
                it.remove();
            }
        }
    }

    private long distinctColors(List<Pawn> pawns) {
        return pawns.stream().map(Pawn::getColor).distinct().count();
    }
}
