package com.example.game2048.repository;

import com.example.game2048.model.domain.GameRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryRecordRepository implements RecordRepository {

    private final Map<String, GameRecord> records = new LinkedHashMap<>();

    @Override
    public void add(GameRecord record) {
        records.putIfAbsent(record.gameUuid(), record);
    }

    @Override
    public Optional<GameRecord> get(String gameUuid) {
        return Optional.ofNullable(records.get(gameUuid));
    }

    @Override
    public List<GameRecord> list() {
        return new ArrayList<>(records.values());
    }
}
