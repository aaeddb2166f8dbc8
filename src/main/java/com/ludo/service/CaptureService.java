package com.ludo.service;

import com.ludo.model.Board;
import com.ludo.model.Pawn;
import com.ludo.model.PawnRef;
import com.ludo.model.SquareId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Service responsible for captures at the destination of a road move.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CaptureService {

    private final StackingService stackingService;

    /**
     * The opposing pawn the mover captures, if any: the destination is an unsafe road
     * cell holding exactly the mover and one pawn of another color.
     */
    public Optional<Pawn> findVictim(Board board, Pawn mover) {
        SquareId at = mover.getSquareId();
        if (!at.isRoad() || board.roadSquare(at).isSafeZone()) {
            return Optional.empty();
        }
        List<Pawn> occupants = board.pawnsOn(at);
        if (occupants.size() != 2) {
            return Optional.empty();
        }
        return occupants.stream()
                .filter(p -> p.getColor() != mover.getColor())
                .findFirst();
    }

    /**
     * Send the captured pawn back to its own holding cell.
     *
     * @return identity of the captured pawn, if a capture happened
     */
    public Optional<PawnRef> capture(Board board, Pawn mover) {
        return findVictim(board, mover).map(victim -> {
            SquareId at = victim.getSquareId();
            stackingService.leave(board, victim);
            victim.returnToInitial();
            log.debug("{} pawn {} captured {} pawn {} on {}",
                    mover.getColor(), mover.getIndex(), victim.getColor(), victim.getIndex(), at);
            return victim.toRef();
        });
    }
}
