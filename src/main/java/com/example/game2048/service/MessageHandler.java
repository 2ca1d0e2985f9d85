package com.example.game2048.service;

import com.example.game2048.model.Message;

@FunctionalInterface
public interface MessageHandler<M extends Message> {

    void handle(M message);
}
