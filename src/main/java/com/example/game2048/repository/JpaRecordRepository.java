package com.example.game2048.repository;

import com.example.game2048.model.domain.GameRecord;
import com.example.game2048.model.entity.GameRecordEntity;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class JpaRecordRepository implements RecordRepository {

    private final GameRecordEntityRepository recordEntityRepository;

    public JpaRecordRepository(GameRecordEntityRepository recordEntityRepository) {
        this.recordEntityRepository = recordEntityRepository;
    }

    @Override
    public void add(GameRecord record) {
        if (recordEntityRepository.existsById(record.gameUuid())) {
            return;
        }
        GameRecordEntity entity = new GameRecordEntity();
        entity.setGameUuid(record.gameUuid());
        entity.setFinalScore(record.finalScore());
        entity.setMaxTile(record.maxTile());
        entity.setNumberOfMoves(record.numberOfMoves());
        recordEntityRepository.save(entity);
    }

    @Override
    public Optional<GameRecord> get(String gameUuid) {
        return recordEntityRepository.findById(gameUuid).map(this::toRecord);
    }

    @Override
    public List<GameRecord> list() {
        return recordEntityRepository.findAllByOrderByRecordedAtAsc().stream()
                .map(this::toRecord)
                .collect(Collectors.toList());
    }

    private GameRecord toRecord(GameRecordEntity entity) {
        return new GameRecord(entity.getGameUuid(), entity.getFinalScore(), entity.getMaxTile(),
                entity.getNumberOfMoves());
    }
}
