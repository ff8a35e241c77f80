package com.awesomeposter.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Chooses the checkpoint saver behind the resume store.
 * <p>
 * With {@code awesomeposter.resume-store.type=jdbc} and a {@link DataSource} present,
 * snapshots go to PostgreSQL through {@link JdbcCheckpointSaver}. Otherwise an in-memory
 * {@link MemorySaver} is used, which loses every thread on restart.
 */
@Configuration
public class ResumeStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ResumeStoreConfig.class);

    @Bean
    public BaseCheckpointSaver checkpointSaver(@Value("${awesomeposter.resume-store.type:memory}") String type,
                                               ObjectProvider<DataSource> dataSource,
                                               ObjectMapper objectMapper) {
        if ("jdbc".equalsIgnoreCase(type)) {
            DataSource ds = dataSource.getIfAvailable();
            if (ds != null) {
                log.info("Configuring JDBC resume store (PostgreSQL)");
                var saver = new JdbcCheckpointSaver(new JdbcTemplate(ds), objectMapper);
                saver.createTables();
                return saver;
            }
            log.warn("Resume store type is jdbc but no DataSource is configured; falling back to memory");
        }
        log.info("Using in-memory resume store (threads will not survive a restart)");
        return new MemorySaver();
    }
}
