package com.example.game2048.repository;

import com.example.game2048.model.entity.GameRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GameRecordEntityRepository extends JpaRepository<GameRecordEntity, String> {

    List<GameRecordEntity> findAllByOrderByRecordedAtAsc();
}
