package com.example.game2048.service;

/**
 * Delivers short messages to the player.
 */
public interface Notifications {

    void send(String message);
}
