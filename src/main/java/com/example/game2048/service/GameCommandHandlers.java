package com.example.game2048.service;

import com.example.game2048.exception.GameNotFoundException;
import com.example.game2048.logic.RandomSource;
import com.example.game2048.model.command.MakeMove;
import com.example.game2048.model.command.ResumeGame;
import com.example.game2048.model.command.StartNewGame;
import com.example.game2048.model.command.UndoMove;
import com.example.game2048.model.domain.Game;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Command handlers. Each one runs in its own unit-of-work scope and commits
 * only when the game accepted the change.
 */
@Slf4j
@RequiredArgsConstructor
public class GameCommandHandlers {

    private final UnitOfWork uow;
    private final RandomSource rng;

    public void startNewGame(StartNewGame command) {
        try (UnitOfWork scope = uow.start()) {
            if (scope.games().get(command.slotId()).isPresent()) {
                log.info("Replacing the game in slot {}", command.slotId());
                scope.games().delete(command.slotId());
            }
            Game game = Game.createNewGame(command.slotId(), rng);
            scope.games().add(game);
            scope.commit();
        }
    }

    public void makeMove(MakeMove command) {
        try (UnitOfWork scope = uow.start()) {
            Game game = scope.games().getByUuid(command.gameUuid())
                    .orElseThrow(() -> GameNotFoundException.forUuid(command.gameUuid()));
            game.move(command.direction(), rng);
            scope.commit();
        }
    }

    public void resumeGame(ResumeGame command) {
        try (UnitOfWork scope = uow.start()) {
            Game game = scope.games().get(command.slotId())
                    .orElseThrow(() -> GameNotFoundException.forSlot(command.slotId()));
            game.resume();
            scope.commit();
        }
    }

    public void undoMove(UndoMove command) {
        try (UnitOfWork scope = uow.start()) {
            Game game = scope.games().getByUuid(command.gameUuid())
                    .orElseThrow(() -> GameNotFoundException.forUuid(command.gameUuid()));
            game.undoLastMove();
            scope.commit();
        }
    }
}
