package com.example.game2048.model.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "games", indexes = @Index(name = "idx_games_slot_id", columnList = "slotId"))
@Data
public class GameEntity {

    @Id
    private String gameUuid;

    @Column(nullable = false)
    private String slotId;

    private String status; // NEW, IN_PROGRESS, OVER

    @Lob
    private String gameStateJson;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    // Statistical Columns
    private int score;
    private int maxTile;
    private int numberOfMoves;
}
