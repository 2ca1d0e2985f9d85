package com.example.game2048.repository;

import com.example.game2048.exception.SlotOccupiedException;
import com.example.game2048.model.domain.Game;
import com.example.game2048.model.domain.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryGameRepositoryTest {

    private InMemoryGameRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGameRepository();
    }

    @Test
    void testAddAndGetBySlotAndUuid() {
        Game game = new Game("slot-1", "game-1", GameState.initial());
        repository.add(game);

        assertSame(game, repository.get("slot-1").orElseThrow());
        assertSame(game, repository.getByUuid("game-1").orElseThrow());
        assertTrue(repository.get("slot-2").isEmpty());
        assertTrue(repository.getByUuid("game-2").isEmpty());
    }

    @Test
    void testAddToOccupiedSlotFails() {
        repository.add(new Game("slot-1", "game-1", GameState.initial()));

        assertThrows(SlotOccupiedException.class,
                () -> repository.add(new Game("slot-1", "game-2", GameState.initial())));
        assertEquals("game-1", repository.get("slot-1").orElseThrow().getGameUuid());
    }

    @Test
    void testSeenTracksReadsAndWrites() {
        Game first = new Game("slot-1", "game-1", GameState.initial());
        Game second = new Game("slot-2", "game-2", GameState.initial());
        repository.add(first);
        repository.add(second);
        repository.clearSeen();

        repository.getByUuid("game-2");
        repository.get("slot-1");
        repository.get("missing");

        assertEquals(List.of(second, first), List.copyOf(repository.seen()));
    }

    @Test
    void testDeleteFreesSlot() {
        Game game = new Game("slot-1", "game-1", GameState.initial());
        repository.add(game);

        repository.delete("slot-1");
        repository.delete("slot-1");

        assertTrue(repository.get("slot-1").isEmpty());
        assertFalse(repository.seen().contains(game));
        assertTrue(repository.list().isEmpty());
    }
}
