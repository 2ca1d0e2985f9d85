package com.example.game2048.service;

import com.example.game2048.model.domain.Game;
import com.example.game2048.model.domain.GameRecord;
import com.example.game2048.model.dto.GameScreenDTO;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side: queries answered from the repositories, never through commands.
 */
@Service
public class GameViewService {

    private final MessageBus messageBus;

    public GameViewService(MessageBus messageBus) {
        this.messageBus = messageBus;
    }

    /**
     * @return the best final score of all recorded games, 0 if none
     */
    public int highScore() {
        return messageBus.query(uow -> uow.records().list().stream()
                .mapToInt(GameRecord::finalScore)
                .max()
                .orElse(0));
    }

    public Optional<Integer> finalScore(String gameUuid) {
        return messageBus.query(uow -> uow.records().get(gameUuid).map(GameRecord::finalScore));
    }

    public Optional<GameRecord> findRecord(String gameUuid) {
        return messageBus.query(uow -> uow.records().get(gameUuid));
    }

    public List<GameRecord> listRecords() {
        return messageBus.query(uow -> uow.records().list());
    }

    public Optional<GameScreenDTO> gameScreenBySlot(String slotId) {
        return messageBus.query(uow -> uow.games().get(slotId).map(this::mapToDTO));
    }

    private GameScreenDTO mapToDTO(Game game) {
        GameScreenDTO dto = new GameScreenDTO();
        dto.setSlotId(game.getSlotId());
        dto.setGameUuid(game.getGameUuid());
        dto.setGrid(game.getState().board().getGrid());
        dto.setScore(game.getState().score());
        dto.setStatus(game.getStatus());
        dto.setPossibleMoves(game.getState().possibleMoves());
        dto.setMaxTile(game.getMaxTile());
        dto.setNumberOfMoves(game.getNumberOfMoves());
        return dto;
    }
}
