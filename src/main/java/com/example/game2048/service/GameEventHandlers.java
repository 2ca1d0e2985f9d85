package com.example.game2048.service;

import com.example.game2048.model.domain.GameRecord;
import com.example.game2048.model.event.GameOver;
import com.example.game2048.model.event.GameResumed;
import com.example.game2048.model.event.NewGameStarted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class GameEventHandlers {

    private final UnitOfWork uow;
    private final Notifications notifications;

    public void logNewGame(NewGameStarted event) {
        log.info("New game started: {} in slot {}", event.gameUuid(), event.slotId());
    }

    public void logGameResumed(GameResumed event) {
        log.info("Game resumed: {} in slot {}", event.gameUuid(), event.slotId());
    }

    public void logGameOver(GameOver event) {
        log.info("Game over: {} in slot {} (score {}, max tile {}, {} moves)", event.gameUuid(), event.slotId(),
                event.finalScore(), event.maxTile(), event.numberOfMoves());
    }

    /**
     * Stores the summary of the finished game and frees its slot. The slot is
     * left alone if it already holds another game.
     */
    public void recordFinishedGame(GameOver event) {
        try (UnitOfWork scope = uow.start()) {
            scope.records().add(new GameRecord(event.gameUuid(), event.finalScore(), event.maxTile(),
                    event.numberOfMoves()));
            scope.games().get(event.slotId())
                    .filter(game -> game.getGameUuid().equals(event.gameUuid()))
                    .ifPresent(game -> scope.games().delete(event.slotId()));
            scope.commit();
        }
    }

    public void notifyGameOver(GameOver event) {
        notifications.send(String.format("Game over! Final score: %d", event.finalScore()));
    }
}
