package com.example.game2048.exception;

public class EmptyMoveHistoryException extends Game2048Exception {

    public EmptyMoveHistoryException(String gameUuid) {
        super("No moves to undo in game " + gameUuid);
    }
}
