package com.example.game2048.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a game: the board and the score reached on it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameState(Board board, int score) {

    public static GameState initial() {
        return new GameState(new Board(), 0);
    }

    /**
     * Directions in which shifting changes the board, in {@link Direction} order.
     */
    public List<Direction> possibleMoves() {
        List<Direction> moves = new ArrayList<>();
        for (Direction direction : Direction.values()) {
            if (!board.shift(direction).equals(board)) {
                moves.add(direction);
            }
        }
        return moves;
    }

    @JsonIgnore
    public boolean isOver() {
        return possibleMoves().isEmpty();
    }
}
