package com.example.game2048.model.domain;

import com.example.game2048.support.Boards;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameStateTest {

    @Test
    void testInitialStateIsEmptyAndOver() {
        GameState state = GameState.initial();

        assertEquals(0, state.score());
        assertEquals(0, state.board().nonEmptyCount());
        assertTrue(state.isOver());
    }

    @Test
    void testPossibleMovesFollowDirectionOrder() {
        GameState state = new GameState(new Board(new int[][]{
                {0, 0, 0, 0},
                {0, 2, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0}
        }), 0);

        assertEquals(List.of(Direction.LEFT, Direction.RIGHT, Direction.UP, Direction.DOWN), state.possibleMoves());
        assertFalse(state.isOver());
    }

    @Test
    void testCornerTileOnlyMovesAway() {
        GameState state = new GameState(new Board(new int[][]{
                {2, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0}
        }), 0);

        assertEquals(List.of(Direction.RIGHT, Direction.DOWN), state.possibleMoves());
    }

    @Test
    void testOverWhenNoShiftChangesBoard() {
        GameState full = new GameState(Boards.full(), 100);
        assertTrue(full.isOver());
        assertTrue(full.possibleMoves().isEmpty());

        GameState almostOver = new GameState(Boards.almostOver(), 100);
        assertFalse(almostOver.isOver());
        assertEquals(List.of(Direction.LEFT, Direction.RIGHT), almostOver.possibleMoves());
    }
}
