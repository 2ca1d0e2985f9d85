package com.example.game2048.repository;

import com.example.game2048.exception.GamePersistenceException;
import com.example.game2048.model.domain.Game;
import com.example.game2048.model.entity.GameEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Game repository backed by the {@code games} table. Each game is stored as a
 * JSON document next to a few statistic columns.
 *
 * Games loaded or added during a transaction are kept in an identity map, so
 * repeated reads return the same instance, and are written back by
 * {@link #flush()}.
 */
@Slf4j
public class JpaGameRepository extends AbstractGameRepository {

    private final GameEntityRepository gameEntityRepository;
    private final ObjectMapper objectMapper;

    private final Map<String, Game> loadedGames = new LinkedHashMap<>();

    public JpaGameRepository(GameEntityRepository gameEntityRepository, ObjectMapper objectMapper) {
        this.gameEntityRepository = gameEntityRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doAdd(Game game) {
        loadedGames.put(game.getGameUuid(), game);
    }

    @Override
    protected Optional<Game> doGet(String slotId) {
        Optional<Game> loaded = loadedGames.values().stream()
                .filter(game -> game.getSlotId().equals(slotId))
                .findFirst();
        if (loaded.isPresent()) {
            return loaded;
        }
        return gameEntityRepository.findBySlotId(slotId).map(this::load);
    }

    @Override
    protected Optional<Game> doGetByUuid(String gameUuid) {
        Game loaded = loadedGames.get(gameUuid);
        if (loaded != null) {
            return Optional.of(loaded);
        }
        return gameEntityRepository.findById(gameUuid).map(this::load);
    }

    @Override
    protected void doDelete(String slotId) {
        loadedGames.values().removeIf(game -> game.getSlotId().equals(slotId));
        gameEntityRepository.findBySlotId(slotId).ifPresent(entity -> {
            gameEntityRepository.delete(entity);
            // the slot may be taken again in this transaction
            gameEntityRepository.flush();
        });
    }

    /**
     * Writes every game of the identity map to its row.
     */
    public void flush() {
        for (Game game : new ArrayList<>(loadedGames.values())) {
            save(game);
        }
    }

    /**
     * Forgets loaded and seen games. Called when a new transaction starts.
     */
    public void reset() {
        loadedGames.clear();
        clearSeen();
    }

    private void save(Game game) {
        GameEntity entity = gameEntityRepository.findById(game.getGameUuid()).orElseGet(GameEntity::new);

        if (entity.getGameUuid() == null) {
            entity.setGameUuid(game.getGameUuid());
        }

        entity.setSlotId(game.getSlotId());
        entity.setStatus(game.getStatus().name());
        entity.setScore(game.getState().score());
        entity.setMaxTile(game.getMaxTile());
        entity.setNumberOfMoves(game.getNumberOfMoves());

        try {
            entity.setGameStateJson(objectMapper.writeValueAsString(game));
        } catch (JsonProcessingException e) {
            throw new GamePersistenceException("Failed to serialize game " + game.getGameUuid(), e);
        }
        gameEntityRepository.save(entity);
    }

    private Game load(GameEntity entity) {
        return loadedGames.computeIfAbsent(entity.getGameUuid(), uuid -> {
            try {
                return objectMapper.readValue(entity.getGameStateJson(), Game.class);
            } catch (JsonProcessingException e) {
                log.error("Failed to parse game {}", uuid, e);
                throw new GamePersistenceException("Failed to parse game " + uuid, e);
            }
        });
    }
}
