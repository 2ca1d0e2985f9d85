package com.example.game2048.model.dto;

import com.example.game2048.model.domain.Direction;
import com.example.game2048.model.domain.GameStatus;
import lombok.Data;

import java.util.List;

/**
 * Values shown on the game screen for one slot.
 */
@Data
public class GameScreenDTO {
    private String slotId;
    private String gameUuid;
    private int[][] grid;
    private int score;
    private GameStatus status;
    private List<Direction> possibleMoves;
    private int maxTile;
    private int numberOfMoves;
}
