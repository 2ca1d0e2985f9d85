package com.example.game2048.logic;

import com.example.game2048.model.domain.Board;

import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Reconstructs the score of a shift from the boards before and after it,
 * without instrumenting the merge itself.
 */
public final class ScoreCalculator {

    private static final int MIN_MERGED_VALUE = 4;

    private ScoreCalculator() {
    }

    /**
     * Walks the tile values of both boards from the largest down. Every extra
     * tile of value v on the shifted board is one merge worth v, and it used up
     * two tiles of value v/2, which are subtracted before comparing the next
     * (lower) value.
     *
     * @return the points earned by the shift
     */
    public static int determineScore(Board before, Board shifted) {
        NavigableSet<Integer> values = new TreeSet<>(before.tileValues());
        values.addAll(shifted.tileValues());

        int score = 0;
        int consumedTiles = 0;
        for (int value : values.descendingSet()) {
            int beforeCount = before.tileCount(value) - consumedTiles;
            int afterCount = shifted.tileCount(value);

            if (value >= MIN_MERGED_VALUE && afterCount > beforeCount) {
                int merges = afterCount - beforeCount;
                score += merges * value;
                consumedTiles = merges * 2;
            } else {
                consumedTiles = 0;
            }
        }
        return score;
    }
}
