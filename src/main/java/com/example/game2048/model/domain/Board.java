package com.example.game2048.model.domain;

import com.example.game2048.exception.InvalidGameBoardException;
import com.example.game2048.exception.SpawnTileException;
import com.example.game2048.logic.RandomSource;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable grid of tile values, 0 meaning an empty cell.
 *
 * Every shift is computed as a left merge: right reverses each row around the
 * merge, up transposes the grid around it and down does both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Board {

    public static final int SIZE = 4;

    static final List<Integer> SPAWN_TILE_VALUES = List.of(2, 4);
    static final List<Double> SPAWN_TILE_WEIGHTS = List.of(0.9, 0.1);

    private final int[][] grid;

    public Board() {
        this(new int[SIZE][SIZE]);
    }

    @JsonCreator
    public Board(@JsonProperty("grid") int[][] grid) {
        validate(grid);
        this.grid = copy(grid);
    }

    public int[][] getGrid() {
        return copy(grid);
    }

    public int getTile(int r, int c) {
        return grid[r][c];
    }

    public int rows() {
        return grid.length;
    }

    public int cols() {
        return grid.length == 0 ? 0 : grid[0].length;
    }

    public Board shift(Direction direction) {
        switch (direction) {
            case LEFT:
                return shiftLeft();
            case RIGHT:
                return shiftRight();
            case UP:
                return shiftUp();
            case DOWN:
                return shiftDown();
            default:
                throw new IllegalArgumentException("Unknown direction: " + direction);
        }
    }

    public Board shiftLeft() {
        int[][] shifted = new int[grid.length][];
        for (int r = 0; r < grid.length; r++) {
            shifted[r] = mergeTiles(grid[r]);
        }
        return new Board(shifted);
    }

    public Board shiftRight() {
        int[][] shifted = new int[grid.length][];
        for (int r = 0; r < grid.length; r++) {
            shifted[r] = reverse(mergeTiles(reverse(grid[r])));
        }
        return new Board(shifted);
    }

    public Board shiftUp() {
        int[][] columns = transpose(grid);
        for (int c = 0; c < columns.length; c++) {
            columns[c] = mergeTiles(columns[c]);
        }
        return new Board(transpose(columns));
    }

    public Board shiftDown() {
        int[][] columns = transpose(grid);
        for (int c = 0; c < columns.length; c++) {
            columns[c] = reverse(mergeTiles(reverse(columns[c])));
        }
        return new Board(transpose(columns));
    }

    /**
     * Returns a board with one new tile on a uniformly chosen empty cell: a 2
     * nine times out of ten, otherwise a 4.
     *
     * @throws SpawnTileException if the board is full
     */
    public Board spawnTile(RandomSource rng) {
        List<Position> positions = emptyPositions();
        if (positions.isEmpty()) {
            throw new SpawnTileException("Cannot spawn tile on a full board");
        }
        Position position = rng.choice(positions);
        int value = rng.weightedChoice(SPAWN_TILE_VALUES, SPAWN_TILE_WEIGHTS);

        int[][] spawned = copy(grid);
        spawned[position.row()][position.col()] = value;
        return new Board(spawned);
    }

    /**
     * Empty cells in row-major order.
     */
    public List<Position> emptyPositions() {
        List<Position> positions = new ArrayList<>();
        for (int r = 0; r < grid.length; r++) {
            for (int c = 0; c < grid[r].length; c++) {
                if (grid[r][c] == 0) {
                    positions.add(new Position(r, c));
                }
            }
        }
        return positions;
    }

    /**
     * Distinct non-zero tile values, ascending.
     */
    public SortedSet<Integer> tileValues() {
        SortedSet<Integer> values = new TreeSet<>();
        for (int[] row : grid) {
            for (int tile : row) {
                if (tile != 0) {
                    values.add(tile);
                }
            }
        }
        return values;
    }

    public int tileCount(int value) {
        int count = 0;
        for (int[] row : grid) {
            for (int tile : row) {
                if (tile == value) {
                    count++;
                }
            }
        }
        return count;
    }

    public int nonEmptyCount() {
        return rows() * cols() - emptyPositions().size();
    }

    public int maxTile() {
        int max = 0;
        for (int[] row : grid) {
            for (int tile : row) {
                max = Math.max(max, tile);
            }
        }
        return max;
    }

    /**
     * Merges one row to the left. A tile produced by a merge does not merge
     * again in the same pass, so [2,2,2,2] becomes [4,4,0,0].
     */
    static int[] mergeTiles(int[] tiles) {
        int[] merged = new int[tiles.length];
        int size = 0;
        int pending = 0;
        for (int tile : tiles) {
            if (tile == 0) {
                continue;
            }
            if (pending == 0) {
                pending = tile;
            } else if (pending == tile) {
                merged[size++] = tile * 2;
                pending = 0;
            } else {
                merged[size++] = pending;
                pending = tile;
            }
        }
        if (pending != 0) {
            merged[size] = pending;
        }
        return merged;
    }

    private static int[] reverse(int[] tiles) {
        int[] reversed = new int[tiles.length];
        for (int i = 0; i < tiles.length; i++) {
            reversed[i] = tiles[tiles.length - 1 - i];
        }
        return reversed;
    }

    private static int[][] transpose(int[][] source) {
        int rows = source.length;
        int cols = rows == 0 ? 0 : source[0].length;
        int[][] transposed = new int[cols][rows];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                transposed[c][r] = source[r][c];
            }
        }
        return transposed;
    }

    private static int[][] copy(int[][] source) {
        int[][] copy = new int[source.length][];
        for (int r = 0; r < source.length; r++) {
            copy[r] = source[r].clone();
        }
        return copy;
    }

    private static void validate(int[][] grid) {
        if (grid == null) {
            throw new InvalidGameBoardException("Game board grid must not be null.");
        }
        for (int[] row : grid) {
            if (row == null || row.length != grid[0].length) {
                throw new InvalidGameBoardException("All rows in the game board must have the same length.");
            }
            for (int value : row) {
                if (value < 0) {
                    throw new InvalidGameBoardException("Invalid tile value: " + value + ". Must be non-negative.");
                }
                if (value != 0 && (value & (value - 1)) != 0) {
                    throw new InvalidGameBoardException(
                            "Invalid tile value: " + value + ". Must be 0 or a power of two.");
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        return Arrays.deepEquals(grid, ((Board) o).grid);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(grid);
    }

    @Override
    public String toString() {
        return "Board" + Arrays.deepToString(grid);
    }
}
