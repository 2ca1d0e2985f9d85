package com.example.game2048.repository;

import com.example.game2048.model.domain.GameRecord;

import java.util.List;
import java.util.Optional;

/**
 * Summaries of finished games, keyed by game uuid.
 */
public interface RecordRepository {

    /**
     * Inserts the record unless one with the same game uuid exists.
     */
    void add(GameRecord record);

    Optional<GameRecord> get(String gameUuid);

    List<GameRecord> list();
}
