package com.example.game2048.model.domain;

import com.example.game2048.exception.EmptyMoveHistoryException;
import com.example.game2048.exception.InvalidMoveException;
import com.example.game2048.logic.RandomSource;
import com.example.game2048.logic.ScoreCalculator;
import com.example.game2048.model.event.Event;
import com.example.game2048.model.event.GameOver;
import com.example.game2048.model.event.GameResumed;
import com.example.game2048.model.event.NewGameStarted;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A single 2048 session: the current state, the moves that led to it and the
 * events raised since they were last drained. All changes go through
 * {@link #move}, {@link #undoLastMove} and {@link #resume}.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Game {

    // Schema version for future migrations
    private final int schemaVersion = 1;

    @ToString.Include
    private final String slotId;

    @ToString.Include
    @EqualsAndHashCode.Include
    private final String gameUuid;

    private GameState state;

    @Getter(AccessLevel.NONE)
    private final List<Move> moves;

    @Getter(AccessLevel.NONE)
    private final List<Event> pendingEvents = new ArrayList<>();

    @JsonCreator
    public Game(@JsonProperty("slotId") String slotId,
            @JsonProperty("gameUuid") String gameUuid,
            @JsonProperty("state") GameState state,
            @JsonProperty("moves") List<Move> moves) {
        this.slotId = slotId;
        this.gameUuid = gameUuid;
        this.state = state != null ? state : GameState.initial();
        this.moves = moves != null ? new ArrayList<>(moves) : new ArrayList<>();
    }

    public Game(String slotId, String gameUuid, GameState state) {
        this(slotId, gameUuid, state, null);
    }

    public static Game createNewGame(String slotId, RandomSource rng) {
        return createNewGame(slotId, UUID.randomUUID().toString(), rng);
    }

    /**
     * Creates a game on an empty board with two spawned tiles and raises
     * {@link NewGameStarted}.
     */
    public static Game createNewGame(String slotId, String gameUuid, RandomSource rng) {
        Board board = new Board().spawnTile(rng).spawnTile(rng);
        Game game = new Game(slotId, gameUuid, new GameState(board, 0));
        game.pendingEvents.add(new NewGameStarted(slotId, gameUuid));
        return game;
    }

    @JsonIgnore
    public boolean isOver() {
        return state.isOver();
    }

    public List<Move> getMoves() {
        return Collections.unmodifiableList(moves);
    }

    @JsonIgnore
    public int getNumberOfMoves() {
        return moves.size();
    }

    @JsonIgnore
    public GameStatus getStatus() {
        if (isOver()) {
            return GameStatus.OVER;
        }
        return moves.isEmpty() ? GameStatus.NEW : GameStatus.IN_PROGRESS;
    }

    /**
     * Largest tile that appeared on any board of this game.
     */
    @JsonIgnore
    public int getMaxTile() {
        int max = state.board().maxTile();
        for (Move move : moves) {
            max = Math.max(max, move.beforeState().board().maxTile());
            max = Math.max(max, move.afterState().board().maxTile());
        }
        return max;
    }

    /**
     * Shifts the board, scores the merges, records the move and spawns a tile.
     * A shift that changes nothing is ignored: no history entry, no spawn.
     *
     * @throws InvalidMoveException if the game is already over
     */
    public void move(Direction direction, RandomSource rng) {
        if (isOver()) {
            throw new InvalidMoveException(gameUuid, "move " + direction.getValue());
        }

        GameState current = state;
        Board shifted = current.board().shift(direction);
        if (shifted.equals(current.board())) {
            return;
        }

        int updatedScore = current.score() + ScoreCalculator.determineScore(current.board(), shifted);
        moves.add(new Move(direction, current, new GameState(shifted, updatedScore)));

        state = new GameState(shifted.spawnTile(rng), updatedScore);

        if (state.isOver()) {
            pendingEvents.add(new GameOver(slotId, gameUuid, state.score(), getMaxTile(), moves.size()));
        }
    }

    /**
     * Restores the state from before the last move. Events already raised are
     * kept.
     *
     * @throws EmptyMoveHistoryException if no move has been made
     */
    public void undoLastMove() {
        if (moves.isEmpty()) {
            throw new EmptyMoveHistoryException(gameUuid);
        }
        Move last = moves.remove(moves.size() - 1);
        state = last.beforeState();
    }

    public void resume() {
        if (isOver()) {
            throw new InvalidMoveException(gameUuid, "resume");
        }
        pendingEvents.add(new GameResumed(slotId, gameUuid));
    }

    /**
     * Returns the events raised since the last call and clears the buffer.
     */
    public List<Event> drainEvents() {
        List<Event> drained = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return drained;
    }
}
