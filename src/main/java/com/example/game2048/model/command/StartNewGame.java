package com.example.game2048.model.command;

/**
 * Starts a new game in the slot, replacing any game already stored there.
 */
public record StartNewGame(String slotId) implements Command {
}
