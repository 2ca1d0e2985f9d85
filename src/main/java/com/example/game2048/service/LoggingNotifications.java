package com.example.game2048.service;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingNotifications implements Notifications {

    @Override
    public void send(String message) {
        log.info("Notification: {}", message);
    }
}
