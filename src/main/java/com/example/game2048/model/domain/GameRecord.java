package com.example.game2048.model.domain;

/**
 * Summary of a finished game. Created once, when the game ends.
 */
public record GameRecord(String gameUuid, int finalScore, int maxTile, int numberOfMoves) {
}
