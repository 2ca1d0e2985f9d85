package com.example.game2048.exception;

/**
 * Thrown when no game is stored under the requested slot or uuid.
 */
public class GameNotFoundException extends Game2048Exception {

    public static GameNotFoundException forSlot(String slotId) {
        return new GameNotFoundException("No game in slot: " + slotId);
    }

    public static GameNotFoundException forUuid(String gameUuid) {
        return new GameNotFoundException("Game not found: " + gameUuid);
    }

    private GameNotFoundException(String message) {
        super(message);
    }
}
