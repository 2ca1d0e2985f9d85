package com.example.game2048.exception;

/**
 * Base exception for all game exceptions.
 */
public class Game2048Exception extends RuntimeException {

    public Game2048Exception(String message) {
        super(message);
    }

    public Game2048Exception(String message, Throwable cause) {
        super(message, cause);
    }
}
