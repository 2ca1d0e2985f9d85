package com.example.game2048.model.event;

import com.example.game2048.model.Message;

/**
 * Something that happened to a game. Events fan out to zero or more handlers.
 */
public interface Event extends Message {
}
