package com.example.game2048.support;

import com.example.game2048.model.domain.Board;

public final class Boards {

    private Boards() {
    }

    /**
     * One legal move left: shifting left merges the two 8s, after which the
     * spawned tile blocks every direction.
     */
    public static Board almostOver() {
        return new Board(new int[][]{
                {2, 4, 2, 4},
                {4, 2, 4, 2},
                {2, 4, 2, 4},
                {4, 2, 8, 8}
        });
    }

    public static Board full() {
        return new Board(new int[][]{
                {2, 4, 2, 4},
                {4, 2, 4, 2},
                {2, 4, 2, 4},
                {4, 2, 4, 2}
        });
    }
}
