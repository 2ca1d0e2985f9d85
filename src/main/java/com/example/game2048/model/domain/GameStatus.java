package com.example.game2048.model.domain;

public enum GameStatus {
    NEW,         // no move made yet
    IN_PROGRESS,
    OVER         // no legal move left
}
