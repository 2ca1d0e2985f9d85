package com.example.game2048.model.command;

import com.example.game2048.model.Message;

/**
 * A requested action. Each command type has exactly one handler.
 */
public interface Command extends Message {
}
