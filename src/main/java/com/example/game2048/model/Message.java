package com.example.game2048.model;

/**
 * Anything the message bus can dispatch: a {@link com.example.game2048.model.command.Command}
 * or an {@link com.example.game2048.model.event.Event}.
 */
public interface Message {
}
