package com.example.game2048.model.event;

public record NewGameStarted(String slotId, String gameUuid) implements Event {
}
