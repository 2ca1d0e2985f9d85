package com.example.game2048.repository;

import com.example.game2048.exception.SlotOccupiedException;
import com.example.game2048.model.domain.Game;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Stores games by slot id (the user-facing save slot) and by game uuid.
 *
 * Every game read or written through this repository is remembered in
 * {@link #seen()} so that the unit of work can collect the events it raised.
 */
@Slf4j
public abstract class AbstractGameRepository {

    private final Set<Game> seen = new LinkedHashSet<>();

    /**
     * @throws SlotOccupiedException if the game's slot already holds a game
     */
    public void add(Game game) {
        if (get(game.getSlotId()).isPresent()) {
            throw new SlotOccupiedException(game.getSlotId());
        }
        doAdd(game);
        seen.add(game);
        log.info("Game {} added to slot {}", game.getGameUuid(), game.getSlotId());
    }

    public Optional<Game> get(String slotId) {
        Optional<Game> game = doGet(slotId);
        game.ifPresent(seen::add);
        return game;
    }

    public Optional<Game> getByUuid(String gameUuid) {
        Optional<Game> game = doGetByUuid(gameUuid);
        game.ifPresent(seen::add);
        return game;
    }

    public void delete(String slotId) {
        Optional<Game> game = doGet(slotId);
        if (game.isPresent()) {
            doDelete(slotId);
            seen.remove(game.get());
            log.info("Slot {} deleted", slotId);
        }
    }

    /**
     * Games touched since the last {@link #clearSeen()}, in the order they were
     * first touched.
     */
    public Set<Game> seen() {
        return Collections.unmodifiableSet(seen);
    }

    public void clearSeen() {
        seen.clear();
    }

    protected abstract void doAdd(Game game);

    protected abstract Optional<Game> doGet(String slotId);

    protected abstract Optional<Game> doGetByUuid(String gameUuid);

    protected abstract void doDelete(String slotId);
}
