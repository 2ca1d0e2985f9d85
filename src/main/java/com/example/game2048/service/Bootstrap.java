package com.example.game2048.service;

import com.example.game2048.logic.RandomSource;
import com.example.game2048.model.command.MakeMove;
import com.example.game2048.model.command.ResumeGame;
import com.example.game2048.model.command.StartNewGame;
import com.example.game2048.model.command.UndoMove;
import com.example.game2048.model.event.GameOver;
import com.example.game2048.model.event.GameResumed;
import com.example.game2048.model.event.NewGameStarted;

/**
 * Wires the game's command and event handlers, with their dependencies, into
 * a message bus.
 */
public final class Bootstrap {

    private Bootstrap() {
    }

    public static MessageBus bootstrap(UnitOfWork uow, RandomSource rng, Notifications notifications) {
        return builder(uow, rng, notifications).build();
    }

    /**
     * Returns a builder preloaded with the default handlers, so callers can add
     * or override registrations before building.
     */
    public static MessageBus.Builder builder(UnitOfWork uow, RandomSource rng, Notifications notifications) {
        GameCommandHandlers commands = new GameCommandHandlers(uow, rng);
        GameEventHandlers events = new GameEventHandlers(uow, notifications);

        return MessageBus.builder(uow)
                .command(StartNewGame.class, commands::startNewGame)
                .command(MakeMove.class, commands::makeMove)
                .command(ResumeGame.class, commands::resumeGame)
                .command(UndoMove.class, commands::undoMove)
                .event(NewGameStarted.class, "logNewGame", events::logNewGame)
                .event(GameResumed.class, "logGameResumed", events::logGameResumed)
                .event(GameOver.class, "logGameOver", events::logGameOver)
                .event(GameOver.class, "recordFinishedGame", events::recordFinishedGame)
                .event(GameOver.class, "notifyGameOver", events::notifyGameOver);
    }
}
