package com.example.game2048.controller;

import com.example.game2048.exception.EmptyMoveHistoryException;
import com.example.game2048.exception.InvalidMoveException;
import com.example.game2048.model.command.MakeMove;
import com.example.game2048.model.command.StartNewGame;
import com.example.game2048.model.command.UndoMove;
import com.example.game2048.model.domain.Direction;
import com.example.game2048.model.domain.GameRecord;
import com.example.game2048.model.domain.GameStatus;
import com.example.game2048.model.dto.GameScreenDTO;
import com.example.game2048.service.GameViewService;
import com.example.game2048.service.MessageBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GameControllerTest {

    private MockMvc mockMvc;

    @Mock
    private MessageBus messageBus;
    @Mock
    private GameViewService gameViewService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new GameController(messageBus, gameViewService), new RecordController(gameViewService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testStartNewGame() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1")).thenReturn(Optional.of(screen("game-1", 0)));

        mockMvc.perform(post("/api/games/slot-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gameUuid").value("game-1"))
                .andExpect(jsonPath("$.status").value("NEW"));

        verify(messageBus).handle(new StartNewGame("slot-1"));
    }

    @Test
    void testGetMissingGameReturnsNotFound() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/games/slot-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testMakeMove() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1"))
                .thenReturn(Optional.of(screen("game-1", 0)))
                .thenReturn(Optional.of(screen("game-1", 4)));

        mockMvc.perform(post("/api/games/slot-1/moves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"direction\":\"Left\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(4));

        verify(messageBus).handle(new MakeMove("game-1", Direction.LEFT));
    }

    @Test
    void testFinishingMoveReturnsNoContent() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1"))
                .thenReturn(Optional.of(screen("game-1", 0)))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/games/slot-1/moves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"direction\":\"up\"}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void testUnknownDirectionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/games/slot-1/moves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"direction\":\"sideways\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown direction: sideways"));

        verify(messageBus, never()).handle(any());
    }

    @Test
    void testBlankDirectionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/games/slot-1/moves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"direction\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.direction").exists());
    }

    @Test
    void testMoveOnMissingGameIsNotFound() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/games/slot-1/moves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"direction\":\"left\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No game in slot: slot-1"));
    }

    @Test
    void testMoveOnFinishedGameIsBadRequest() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1")).thenReturn(Optional.of(screen("game-1", 0)));
        doThrow(new InvalidMoveException("game-1", "move left")).when(messageBus).handle(any());

        mockMvc.perform(post("/api/games/slot-1/moves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"direction\":\"left\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUndoWithoutMovesIsBadRequest() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1")).thenReturn(Optional.of(screen("game-1", 0)));
        doThrow(new EmptyMoveHistoryException("game-1")).when(messageBus).handle(new UndoMove("game-1"));

        mockMvc.perform(post("/api/games/slot-1/undo"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No moves to undo in game game-1"));
    }

    @Test
    void testUnexpectedErrorIsServerError() throws Exception {
        when(gameViewService.gameScreenBySlot("slot-1")).thenReturn(Optional.of(screen("game-1", 0)));
        doThrow(new IllegalStateException("disk full")).when(messageBus).handle(any());

        mockMvc.perform(post("/api/games/slot-1/resume"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("500"));
    }

    @Test
    void testRecordEndpoints() throws Exception {
        when(gameViewService.highScore()).thenReturn(2048);
        when(gameViewService.findRecord("game-1")).thenReturn(Optional.of(new GameRecord("game-1", 2048, 512, 300)));
        when(gameViewService.findRecord("game-2")).thenReturn(Optional.empty());
        when(gameViewService.listRecords()).thenReturn(List.of(new GameRecord("game-1", 2048, 512, 300)));

        mockMvc.perform(get("/api/records/high-score"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.highScore").value(2048));
        mockMvc.perform(get("/api/records/game-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxTile").value(512));
        mockMvc.perform(get("/api/records/game-2"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/records"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].gameUuid").value("game-1"));
    }

    private static GameScreenDTO screen(String gameUuid, int score) {
        GameScreenDTO dto = new GameScreenDTO();
        dto.setSlotId("slot-1");
        dto.setGameUuid(gameUuid);
        dto.setGrid(new int[4][4]);
        dto.setScore(score);
        dto.setStatus(score == 0 ? GameStatus.NEW : GameStatus.IN_PROGRESS);
        dto.setPossibleMoves(List.of(Direction.LEFT));
        return dto;
    }
}
