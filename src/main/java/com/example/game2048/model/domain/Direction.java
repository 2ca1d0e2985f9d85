package com.example.game2048.model.domain;

import java.util.Locale;

public enum Direction {
    LEFT("left"),
    RIGHT("right"),
    UP("up"),
    DOWN("down");

    private final String value;

    Direction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses "left", "right", "up" or "down", ignoring case.
     *
     * @throws IllegalArgumentException if the value names no direction
     */
    public static Direction fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Direction direction : values()) {
                if (direction.value.equals(normalized)) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + value);
    }
}
