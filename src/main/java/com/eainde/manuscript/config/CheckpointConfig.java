package com.eainde.manuscript.config;

import com.eainde.manuscript.checkpoint.CheckpointCodec;
import com.eainde.manuscript.checkpoint.CheckpointStore;
import com.eainde.manuscript.checkpoint.InMemoryCheckpointStore;
import com.eainde.manuscript.checkpoint.JdbcCheckpointStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the checkpoint store with {@code manuscript.checkpoint.store}: {@code memory} (default) or
 * {@code jdbc}, the latter backed by the {@code pipeline_checkpoint} tables from {@code schema.sql}.
 */
@Configuration
public class CheckpointConfig {

    @Bean
    @ConditionalOnProperty(name = "manuscript.checkpoint.store", havingValue = "memory", matchIfMissing = true)
    public CheckpointStore inMemoryCheckpointStore(CheckpointCodec codec) {
        return new InMemoryCheckpointStore(codec);
    }

    @Bean
    @ConditionalOnProperty(name = "manuscript.checkpoint.store", havingValue = "jdbc")
    public CheckpointStore jdbcCheckpointStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                               CheckpointCodec codec) {
        return new JdbcCheckpointStore(jdbcTemplate, transactionTemplate, codec);
    }
}
