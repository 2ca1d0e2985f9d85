package com.example.game2048.service;

import com.example.game2048.model.domain.Game;
import com.example.game2048.model.event.Event;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks whether the current scope was committed and implements event
 * collection over the games the repository has seen.
 */
public abstract class AbstractUnitOfWork implements UnitOfWork {

    private boolean committed;

    @Override
    public UnitOfWork start() {
        begin();
        games().clearSeen();
        committed = false;
        return this;
    }

    @Override
    public void commit() {
        doCommit();
        committed = true;
    }

    @Override
    public void close() {
        if (!committed) {
            rollback();
        }
    }

    @Override
    public List<Event> collectNewEvents() {
        List<Event> events = new ArrayList<>();
        for (Game game : games().seen()) {
            events.addAll(game.drainEvents());
        }
        return events;
    }

    protected abstract void begin();

    protected abstract void doCommit();
}
