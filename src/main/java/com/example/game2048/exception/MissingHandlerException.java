package com.example.game2048.exception;

/**
 * Thrown by the message bus when a command has no registered handler.
 */
public class MissingHandlerException extends Game2048Exception {

    public MissingHandlerException(String message) {
        super(message);
    }
}
