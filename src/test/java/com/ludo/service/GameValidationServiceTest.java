package com.ludo.service;

import com.ludo.exception.GameRuleException;
import com.ludo.exception.Rejection;
import com.ludo.model.Color;
import com.ludo.model.Game;
import com.ludo.model.MoveKind;
import com.ludo.model.Pawn;
import com.ludo.model.PendingAction;
import com.ludo.model.Player;
import com.ludo.model.SquareId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for action authorization.
 */
class GameValidationServiceTest {

    private GameValidationService validationService;
    private Game game;

    @BeforeEach
    void setUp() {
        validationService = new GameValidationService();
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < Game.SEATS; i++) {
            players.add(new Player("s" + i, Color.values()[i]));
        }
        game = Game.builder()
                .id("game-1")
                .players(players)
                .board(new BoardService().createBoard())
                .current("s0")
                .build();
        game.getDice().setAbleToRoll(true);
    }

    private void assertRejected(Rejection expected, Executable action) {
        GameRuleException e = assertThrows(GameRuleException.class, action);
        assertEquals(expected, e.getRejection());
    }

    private Pawn redPawn(int index) {
        return game.getBoard().pawnsOf(Color.RED).get(index);
    }

    @Nested
    @DisplayName("Membership")
    class MembershipTests {

        @Test
        @DisplayName("should reject a session outside the game")
        void shouldRejectStranger() {
            assertRejected(Rejection.NOT_IN_GAME, () -> validationService.validateMember(game, "stranger"));
        }

        @Test
        @DisplayName("should reject any action once three colors finished")
        void shouldRejectFinishedGame() {
            game.getWinners().record(Color.GREEN);
            game.getWinners().record(Color.YELLOW);
            game.getWinners().record(Color.BLUE);

            assertRejected(Rejection.GAME_FINISHED, () -> validationService.validateMember(game, "s0"));
        }

        @Test
        @DisplayName("should tell a finished color its place")
        void shouldRejectFinishedColor() {
            game.getWinners().record(Color.YELLOW);
            game.getWinners().record(Color.GREEN);

            GameRuleException e = assertThrows(GameRuleException.class,
                    () -> validationService.validateMember(game, "s1"));
            assertEquals(Rejection.ALREADY_FINISHED, e.getRejection());
            assertEquals("You are already the top 2", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Color choice")
    class ColorChoiceTests {

        @BeforeEach
        void unseat() {
            game.getPlayers().forEach(p -> p.setColor(null));
            game.getPlayers().get(1).setColor(Color.GREEN);
        }

        @Test
        @DisplayName("should accept a free color")
        void shouldAcceptFreeColor() {
            assertEquals("s0", validationService.validateColorChoice(game, "s0", Color.RED).getSessionId());
        }

        @Test
        @DisplayName("should reject a missing color")
        void shouldRejectMissingColor() {
            assertRejected(Rejection.INVALID_COLOR, () -> validationService.validateColorChoice(game, "s0", null));
        }

        @Test
        @DisplayName("should reject a color held by another player")
        void shouldRejectTakenColor() {
            assertRejected(Rejection.COLOR_TAKEN, () -> validationService.validateColorChoice(game, "s0", Color.GREEN));
        }

        @Test
        @DisplayName("should reject changes once every seat has a color")
        void shouldRejectOnceSeated() {
            for (int i = 0; i < Game.SEATS; i++) {
                game.getPlayers().get(i).setColor(Color.values()[i]);
            }

            assertRejected(Rejection.COLORS_LOCKED, () -> validationService.validateColorChoice(game, "s0", Color.BLUE));
        }

        @Test
        @DisplayName("should keep a color once play has begun, even with a seat free")
        void shouldRejectSwitchAfterStart() {
            game.getBoard().pawnsOf(Color.GREEN).get(0).setSquareId(SquareId.road(21));

            assertRejected(Rejection.COLORS_LOCKED, () -> validationService.validateColorChoice(game, "s1", Color.RED));
        }

        @Test
        @DisplayName("should let a newcomer take a free color after play has begun")
        void shouldSeatNewcomerAfterStart() {
            game.getDice().setCount(2);

            assertEquals("s0", validationService.validateColorChoice(game, "s0", Color.RED).getSessionId());
        }
    }

    @Nested
    @DisplayName("Dice")
    class DiceTests {

        @Test
        @DisplayName("should let the current player roll")
        void shouldAcceptRoll() {
            assertDoesNotThrow(() -> validationService.validateDiceRoll(game, "s0"));
        }

        @Test
        @DisplayName("should reject a roll out of turn")
        void shouldRejectOutOfTurn() {
            assertRejected(Rejection.NOT_YOUR_TURN, () -> validationService.validateDiceRoll(game, "s2"));
        }

        @Test
        @DisplayName("should reject a roll while rolling is locked")
        void shouldRejectLockedDice() {
            game.getDice().setAbleToRoll(false);

            assertRejected(Rejection.NOT_ROLLABLE, () -> validationService.validateDiceRoll(game, "s0"));
        }

        @Test
        @DisplayName("should reject a roll without four players")
        void shouldRejectShortTable() {
            game.getPlayers().remove(3);

            assertRejected(Rejection.NOT_ENOUGH_PLAYERS, () -> validationService.validateDiceRoll(game, "s0"));
        }

        @Test
        @DisplayName("should reject turn actions while a seat has no color")
        void shouldRejectColorlessSeat() {
            game.getPlayers().set(3, Player.builder().sessionId("s9").build());
            game.getDice().setRollAnimation(true);

            assertRejected(Rejection.NOT_ENOUGH_PLAYERS, () -> validationService.validateDiceRoll(game, "s0"));
            assertRejected(Rejection.NOT_ENOUGH_PLAYERS, () -> validationService.validateRollResult(game, "s0"));
            assertRejected(Rejection.NOT_ENOUGH_PLAYERS,
                    () -> validationService.validateMove(game, "s0", MoveKind.ROAD, 0));
        }

        @Test
        @DisplayName("should reject confirming a result when no roll is in flight")
        void shouldRejectConfirmWithoutRoll() {
            assertRejected(Rejection.NO_PENDING_ROLL, () -> validationService.validateRollResult(game, "s0"));

            game.getDice().setRollAnimation(true);
            assertDoesNotThrow(() -> validationService.validateRollResult(game, "s0"));
        }
    }

    @Nested
    @DisplayName("Moves")
    class MoveTests {

        @Test
        @DisplayName("should return the pawn carrying the matching action")
        void shouldAcceptMove() {
            game.getDice().setResult(6);
            redPawn(2).setAction(new PendingAction(MoveKind.ENTRY, 2));

            assertSame(redPawn(2), validationService.validateMove(game, "s0", MoveKind.ENTRY, 2));
        }

        @Test
        @DisplayName("should reject an unknown pawn index")
        void shouldRejectIndex() {
            assertRejected(Rejection.INVALID_PAWN,
                    () -> validationService.validateMove(game, "s0", MoveKind.ROAD, 4));
        }

        @Test
        @DisplayName("should reject a pawn without the matching action")
        void shouldRejectUnmovablePawn() {
            redPawn(1).setAction(new PendingAction(MoveKind.ROAD, 1));

            assertRejected(Rejection.PAWN_NOT_MOVABLE,
                    () -> validationService.validateMove(game, "s0", MoveKind.ENTRY, 1));
            assertRejected(Rejection.PAWN_NOT_MOVABLE,
                    () -> validationService.validateMove(game, "s0", MoveKind.ROAD, 0));
        }

        @Test
        @DisplayName("should reject an entry unless the roll is 1 or 6")
        void shouldRejectEntryRoll() {
            game.getDice().setResult(4);
            redPawn(0).setAction(new PendingAction(MoveKind.ENTRY, 0));

            assertRejected(Rejection.INELIGIBLE_ROLL,
                    () -> validationService.validateMove(game, "s0", MoveKind.ENTRY, 0));
        }

        @Test
        @DisplayName("should reject a lane move past home")
        void shouldRejectOvershoot() {
            redPawn(0).setSquareId(SquareId.lane(Color.RED, 3));
            redPawn(0).setAction(new PendingAction(MoveKind.HOME, 0));
            game.getDice().setResult(3);

            assertRejected(Rejection.OVERSHOOT,
                    () -> validationService.validateMove(game, "s0", MoveKind.HOME, 0));

            game.getDice().setResult(2);
            assertSame(redPawn(0), validationService.validateMove(game, "s0", MoveKind.HOME, 0));
        }

        @Test
        @DisplayName("should reject moves out of turn")
        void shouldRejectOutOfTurn() {
            assertRejected(Rejection.NOT_YOUR_TURN,
                    () -> validationService.validateMove(game, "s1", MoveKind.ROAD, 0));
        }
    }
}
