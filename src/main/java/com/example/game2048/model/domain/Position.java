package com.example.game2048.model.domain;

public record Position(int row, int col) {
}
