package com.example.game2048.config;

import com.example.game2048.logic.RandomSource;
import com.example.game2048.logic.SeededRandomSource;
import com.example.game2048.repository.GameEntityRepository;
import com.example.game2048.repository.GameRecordEntityRepository;
import com.example.game2048.service.Bootstrap;
import com.example.game2048.service.JpaUnitOfWork;
import com.example.game2048.service.LoggingNotifications;
import com.example.game2048.service.MessageBus;
import com.example.game2048.service.Notifications;
import com.example.game2048.service.UnitOfWork;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

@Slf4j
@Configuration
public class GameConfig {

    // Unset means a fresh seed on every start
    @Value("${game2048.random-seed:#{null}}")
    private Long randomSeed;

    @Bean
    public RandomSource randomSource() {
        if (randomSeed == null) {
            return new SeededRandomSource();
        }
        log.info("Spawning tiles with fixed seed {}", randomSeed);
        return new SeededRandomSource(randomSeed);
    }

    @Bean
    public UnitOfWork unitOfWork(PlatformTransactionManager transactionManager,
            GameEntityRepository gameEntityRepository,
            GameRecordEntityRepository recordEntityRepository,
            ObjectMapper objectMapper) {
        return new JpaUnitOfWork(transactionManager, gameEntityRepository, recordEntityRepository, objectMapper);
    }

    @Bean
    public Notifications notifications() {
        return new LoggingNotifications();
    }

    @Bean
    public MessageBus messageBus(UnitOfWork unitOfWork, RandomSource randomSource, Notifications notifications) {
        return Bootstrap.bootstrap(unitOfWork, randomSource, notifications);
    }
}
