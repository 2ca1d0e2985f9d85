package com.example.game2048.model.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "game_records")
@Data
public class GameRecordEntity {

    @Id
    private String gameUuid;

    private int finalScore;
    private int maxTile;
    private int numberOfMoves;

    @CreationTimestamp
    private LocalDateTime recordedAt;
}
