package com.example.game2048.model.event;

/**
 * Emitted once, by the move that leaves the game without a legal move.
 */
public record GameOver(String slotId, String gameUuid, int finalScore, int maxTile, int numberOfMoves)
        implements Event {
}
