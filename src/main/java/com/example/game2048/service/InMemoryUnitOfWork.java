package com.example.game2048.service;

import com.example.game2048.repository.InMemoryGameRepository;
import com.example.game2048.repository.InMemoryRecordRepository;
import lombok.Getter;

/**
 * Unit of work over in-memory repositories. Nothing is undone on rollback;
 * commits and rollbacks are only counted.
 */
public class InMemoryUnitOfWork extends AbstractUnitOfWork {

    private final InMemoryGameRepository games = new InMemoryGameRepository();
    private final InMemoryRecordRepository records = new InMemoryRecordRepository();

    @Getter
    private int commitCount;
    @Getter
    private int rollbackCount;

    @Override
    public InMemoryGameRepository games() {
        return games;
    }

    @Override
    public InMemoryRecordRepository records() {
        return records;
    }

    @Override
    protected void begin() {
    }

    @Override
    protected void doCommit() {
        commitCount++;
    }

    @Override
    public void rollback() {
        rollbackCount++;
    }
}
