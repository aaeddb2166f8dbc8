package com.ludo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The authoritative state of one Ludo game. Every validated action mutates it in place.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Game {

    public static final int SEATS = 4;

    private String id;

    @Builder.Default
    private List<Player> players = new ArrayList<>();

    private Board board;

    /** Session id of the player whose turn it is. */
    private String current;

    @Builder.Default
    private Dice dice = Dice.fresh();

    @Builder.Default
    private Winners winners = new Winners();

    public Optional<Player> findPlayer(String sessionId) {
        return players.stream()
                .filter(p -> p.getSessionId().equals(sessionId))
                .findFirst();
    }

    public boolean hasPlayer(String sessionId) {
        return findPlayer(sessionId).isPresent();
    }

    @JsonIgnore
    public boolean isFull() {
        return players.size() >= SEATS;
    }

    /**
     * Four players, each with a distinct color.
     */
    @JsonIgnore
    public boolean isSeated() {
        return players.size() == SEATS
                && players.stream().map(Player::getColor).filter(c -> c != null).distinct().count() == SEATS;
    }

    public boolean isColorTaken(Color color) {
        return players.stream().anyMatch(p -> p.getColor() == color);
    }

    /**
     * Nothing in flight: no roll awaiting confirmation, no pending pawn action, no
     * unacknowledged move. The current player's next step is a roll.
     */
    @JsonIgnore
    public boolean isAwaitingRoll() {
        if (dice.isRollAnimation() || board.getMovePawn() != null) {
            return false;
        }
        return board.getPawns().values().stream()
                .flatMap(List::stream)
                .allMatch(p -> p.getAction() == null);
    }

    /**
     * Play has begun: a roll chain, a pawn outside its initial zone, or a finished color.
     */
    @JsonIgnore
    public boolean isStarted() {
        if (dice.getCount() > 0 || !isAwaitingRoll() || winners.getFirst() != null) {
            return true;
        }
        return board.getPawns().values().stream()
                .flatMap(List::stream)
                .anyMatch(p -> !p.getSquareId().isInitial());
    }

    @JsonIgnore
    public boolean isFinished() {
        return winners.isComplete();
    }
}
