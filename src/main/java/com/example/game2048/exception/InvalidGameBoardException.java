package com.example.game2048.exception;

/**
 * Thrown when a board is constructed from a grid that is ragged or holds a
 * value that is neither 0 nor a power of two.
 */
public class InvalidGameBoardException extends Game2048Exception {

    public InvalidGameBoardException(String message) {
        super(message);
    }
}
