package com.example.game2048.controller;

import com.example.game2048.exception.GameNotFoundException;
import com.example.game2048.model.domain.GameRecord;
import com.example.game2048.service.GameViewService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/records")
public class RecordController {

    private final GameViewService gameViewService;

    public RecordController(GameViewService gameViewService) {
        this.gameViewService = gameViewService;
    }

    @GetMapping
    public List<GameRecord> listRecords() {
        return gameViewService.listRecords();
    }

    @GetMapping("/high-score")
    public Map<String, Integer> highScore() {
        return Map.of("highScore", gameViewService.highScore());
    }

    @GetMapping("/{gameUuid}")
    public GameRecord getRecord(@PathVariable String gameUuid) {
        return gameViewService.findRecord(gameUuid)
                .orElseThrow(() -> GameNotFoundException.forUuid(gameUuid));
    }
}
