package com.example.game2048.exception;

/**
 * Thrown when a move is attempted on a game that is already over.
 */
public class InvalidMoveException extends Game2048Exception {

    public InvalidMoveException(String gameUuid, String operation) {
        super(String.format("Cannot perform '%s' on game %s: game is over", operation, gameUuid));
    }
}
