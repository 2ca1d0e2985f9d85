package com.example.game2048.repository;

import com.example.game2048.model.domain.Game;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryGameRepository extends AbstractGameRepository {

    private final Map<String, Game> gamesBySlot = new LinkedHashMap<>();

    @Override
    protected void doAdd(Game game) {
        gamesBySlot.put(game.getSlotId(), game);
    }

    @Override
    protected Optional<Game> doGet(String slotId) {
        return Optional.ofNullable(gamesBySlot.get(slotId));
    }

    @Override
    protected Optional<Game> doGetByUuid(String gameUuid) {
        return gamesBySlot.values().stream()
                .filter(game -> game.getGameUuid().equals(gameUuid))
                .findFirst();
    }

    @Override
    protected void doDelete(String slotId) {
        gamesBySlot.remove(slotId);
    }

    public List<Game> list() {
        return new ArrayList<>(gamesBySlot.values());
    }
}
