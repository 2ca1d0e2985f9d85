package com.example.game2048.controller;

import com.example.game2048.exception.GameNotFoundException;
import com.example.game2048.model.command.MakeMove;
import com.example.game2048.model.command.ResumeGame;
import com.example.game2048.model.command.StartNewGame;
import com.example.game2048.model.command.UndoMove;
import com.example.game2048.model.domain.Direction;
import com.example.game2048.model.dto.GameScreenDTO;
import com.example.game2048.model.dto.MoveRequest;
import com.example.game2048.service.GameViewService;
import com.example.game2048.service.MessageBus;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/games")
public class GameController {

    private final MessageBus messageBus;
    private final GameViewService gameViewService;

    public GameController(MessageBus messageBus, GameViewService gameViewService) {
        this.messageBus = messageBus;
        this.gameViewService = gameViewService;
    }

    /**
     * Starts a new game in the slot, replacing whatever was there.
     */
    @PostMapping("/{slotId}")
    public GameScreenDTO startNewGame(@PathVariable String slotId) {
        messageBus.handle(new StartNewGame(slotId));
        return currentScreen(slotId);
    }

    @PostMapping("/{slotId}/resume")
    public GameScreenDTO resumeGame(@PathVariable String slotId) {
        messageBus.handle(new ResumeGame(slotId));
        return currentScreen(slotId);
    }

    @GetMapping("/{slotId}")
    public ResponseEntity<GameScreenDTO> getGame(@PathVariable String slotId) {
        return gameViewService.gameScreenBySlot(slotId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Moves the game in the slot. Answers 204 when the move ended the game,
     * since a finished game is recorded and its slot cleared.
     */
    @PostMapping("/{slotId}/moves")
    public ResponseEntity<GameScreenDTO> makeMove(@PathVariable String slotId,
            @Valid @RequestBody MoveRequest request) {
        Direction direction = Direction.fromValue(request.getDirection());
        GameScreenDTO before = currentScreen(slotId);

        messageBus.handle(new MakeMove(before.getGameUuid(), direction));

        return gameViewService.gameScreenBySlot(slotId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/{slotId}/undo")
    public GameScreenDTO undoMove(@PathVariable String slotId) {
        GameScreenDTO before = currentScreen(slotId);
        messageBus.handle(new UndoMove(before.getGameUuid()));
        return currentScreen(slotId);
    }

    private GameScreenDTO currentScreen(String slotId) {
        return gameViewService.gameScreenBySlot(slotId)
                .orElseThrow(() -> GameNotFoundException.forSlot(slotId));
    }
}
