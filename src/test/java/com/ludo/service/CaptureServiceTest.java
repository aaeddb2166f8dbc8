package com.ludo.service;

import com.ludo.model.Board;
import com.ludo.model.Color;
import com.ludo.model.Pawn;
import com.ludo.model.PawnRef;
import com.ludo.model.SquareId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for capture detection.
 */
class CaptureServiceTest {

    private CaptureService captureService;
    private Board board;
    private Pawn red;

    @BeforeEach
    void setUp() {
        captureService = new CaptureService(new StackingService());
        board = new BoardService().createBoard();
        red = board.pawnsOf(Color.RED).get(0);
    }

    @Test
    @DisplayName("should capture a lone opponent on an unsafe ring cell")
    void shouldCapture() {
        red.setSquareId(SquareId.road(13));
        Pawn blue = board.pawnsOf(Color.BLUE).get(2);
        blue.setSquareId(SquareId.road(13));

        Optional<PawnRef> captured = captureService.capture(board, red);

        assertEquals(Optional.of(new PawnRef(Color.BLUE, 2)), captured);
        assertEquals(SquareId.initial(Color.BLUE, 2), blue.getSquareId());
        assertEquals(SquareId.road(13), red.getSquareId());
    }

    @Test
    @DisplayName("should never capture on a safe cell")
    void shouldNotCaptureOnSafeCell() {
        red.setSquareId(SquareId.road(16));
        board.pawnsOf(Color.GREEN).get(0).setSquareId(SquareId.road(16));

        assertTrue(captureService.capture(board, red).isEmpty());
        assertEquals(SquareId.road(16), board.pawnsOf(Color.GREEN).get(0).getSquareId());
    }

    @Test
    @DisplayName("should never capture on an entrance")
    void shouldNotCaptureOnEntrance() {
        red.setSquareId(SquareId.road(21));
        board.pawnsOf(Color.GREEN).get(0).setSquareId(SquareId.road(21));

        assertTrue(captureService.findVictim(board, red).isEmpty());
    }

    @Test
    @DisplayName("should not capture a pair of opponents")
    void shouldNotCaptureTwoOpponents() {
        red.setSquareId(SquareId.road(13));
        board.pawnsOf(Color.YELLOW).get(0).setSquareId(SquareId.road(13));
        board.pawnsOf(Color.YELLOW).get(1).setSquareId(SquareId.road(13));

        assertTrue(captureService.findVictim(board, red).isEmpty());
    }

    @Test
    @DisplayName("should not capture a pawn of the own color")
    void shouldNotCaptureOwnColor() {
        red.setSquareId(SquareId.road(13));
        board.pawnsOf(Color.RED).get(1).setSquareId(SquareId.road(13));

        assertTrue(captureService.findVictim(board, red).isEmpty());
    }

    @Test
    @DisplayName("should never capture in a lane")
    void shouldNotCaptureInLane() {
        red.setSquareId(SquareId.lane(Color.RED, 2));

        assertTrue(captureService.findVictim(board, red).isEmpty());
    }
}
