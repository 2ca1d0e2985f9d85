package com.example.game2048.repository;

import com.example.game2048.model.entity.GameEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GameEntityRepository extends JpaRepository<GameEntity, String> {

    Optional<GameEntity> findBySlotId(String slotId);
}
