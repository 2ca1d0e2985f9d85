package com.example.game2048.model.event;

public record GameResumed(String slotId, String gameUuid) implements Event {
}
