package com.example.game2048.exception;

/**
 * Thrown when a tile is spawned on a board with no empty cell.
 */
public class SpawnTileException extends Game2048Exception {

    public SpawnTileException(String message) {
        super(message);
    }
}
