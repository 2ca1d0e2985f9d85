package com.example.game2048.model.domain;

/**
 * One applied move. {@code afterState} holds the shifted board before the new
 * tile was spawned, together with the updated score.
 */
public record Move(Direction direction, GameState beforeState, GameState afterState) {
}
