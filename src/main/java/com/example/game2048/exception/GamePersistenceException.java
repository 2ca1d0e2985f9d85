package com.example.game2048.exception;

/**
 * Thrown when a stored game cannot be written or read back.
 */
public class GamePersistenceException extends Game2048Exception {

    public GamePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
