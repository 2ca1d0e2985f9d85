package com.example.game2048.model.command;

/**
 * Reverts the last move of a game.
 */
public record UndoMove(String gameUuid) implements Command {
}
