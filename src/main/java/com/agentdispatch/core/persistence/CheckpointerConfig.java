package com.agentdispatch.core.persistence;

import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Provides the LangGraph4j {@link BaseCheckpointSaver} behind the dispatch checkpoint store.
 * <p>
 * With a configured {@link DataSource} (the {@code postgres} profile) checkpoints go to a
 * {@link JdbcCheckpointSaver} and survive restarts; otherwise an in-memory
 * {@link MemorySaver} is used and {@code resume} only works within the same process.
 * <p>
 * The JDBC saver keys off {@code spring.datasource.url} rather than the DataSource bean, since
 * user configuration is evaluated before the DataSource auto-configuration runs.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "spring.datasource", name = "url")
    public BaseCheckpointSaver jdbcCheckpointSaver(DataSource dataSource) {
        log.info("Configuring JDBC checkpoint saver (PostgreSQL)");
        var saver = new JdbcCheckpointSaver(dataSource);
        saver.createSchema();
        return saver;
    }

    @Bean
    @ConditionalOnMissingBean(BaseCheckpointSaver.class)
    public BaseCheckpointSaver memoryCheckpointSaver() {
        log.info("No DataSource available; using in-memory checkpoint saver (checkpoints will not survive a restart)");
        return new MemorySaver();
    }
}
