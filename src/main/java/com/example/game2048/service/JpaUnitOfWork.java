package com.example.game2048.service;

import com.example.game2048.repository.GameEntityRepository;
import com.example.game2048.repository.GameRecordEntityRepository;
import com.example.game2048.repository.JpaGameRepository;
import com.example.game2048.repository.JpaRecordRepository;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Unit of work backed by a Spring-managed JPA transaction. Each scope runs in
 * its own transaction; games loaded in the scope are written back on commit.
 */
@Slf4j
public class JpaUnitOfWork extends AbstractUnitOfWork {

    private final PlatformTransactionManager transactionManager;
    private final JpaGameRepository games;
    private final JpaRecordRepository records;

    private TransactionStatus transaction;

    public JpaUnitOfWork(PlatformTransactionManager transactionManager,
            GameEntityRepository gameEntityRepository,
            GameRecordEntityRepository recordEntityRepository,
            ObjectMapper objectMapper) {
        this.transactionManager = transactionManager;
        // Stored games written by an older version may carry fields we dropped
        ObjectMapper lenientMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.games = new JpaGameRepository(gameEntityRepository, lenientMapper);
        this.records = new JpaRecordRepository(recordEntityRepository);
    }

    @Override
    public JpaGameRepository games() {
        return games;
    }

    @Override
    public JpaRecordRepository records() {
        return records;
    }

    @Override
    protected void begin() {
        if (transaction != null && !transaction.isCompleted()) {
            throw new IllegalStateException("A unit of work is already in progress");
        }
        games.reset();
        transaction = transactionManager.getTransaction(new DefaultTransactionDefinition());
    }

    @Override
    protected void doCommit() {
        games.flush();
        transactionManager.commit(transaction);
        log.debug("Unit of work committed");
    }

    @Override
    public void rollback() {
        if (transaction != null && !transaction.isCompleted()) {
            transactionManager.rollback(transaction);
            log.debug("Unit of work rolled back");
        }
    }
}
