package com.example.game2048.service;

import com.example.game2048.model.event.Event;
import com.example.game2048.repository.AbstractGameRepository;
import com.example.game2048.repository.RecordRepository;

import java.util.List;

/**
 * Transactional scope around one handler call:
 *
 * <pre>
 * try (UnitOfWork scope = uow.start()) {
 *     scope.games().add(game);
 *     scope.commit();
 * }
 * </pre>
 *
 * Closing a scope that was not committed rolls it back.
 */
public interface UnitOfWork extends AutoCloseable {

    /**
     * Opens a new scope and forgets the games seen by the previous one.
     */
    UnitOfWork start();

    AbstractGameRepository games();

    RecordRepository records();

    void commit();

    void rollback();

    /**
     * Drains the pending events of every game seen in this scope. A second
     * call returns only events raised after the first.
     */
    List<Event> collectNewEvents();

    @Override
    void close();
}
