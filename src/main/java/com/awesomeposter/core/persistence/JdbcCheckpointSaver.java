package com.awesomeposter.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link BaseCheckpointSaver} storing run snapshots in PostgreSQL.
 * <p>
 * Rows are keyed by {@code (thread_id, checkpoint_id)} with the state as JSON text. A
 * sequence column orders checkpoints so "latest for a thread" is unambiguous even when
 * two writes share a timestamp.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    static final String TABLE_NAME = "orchestrator_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGSERIAL,
                thread_id     VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255) NOT NULL,
                next_node_id  VARCHAR(255) NOT NULL,
                state         TEXT NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (thread_id, checkpoint_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (thread_id, checkpoint_id)
            DO UPDATE SET node_id = EXCLUDED.node_id,
                          next_node_id = EXCLUDED.next_node_id,
                          state = EXCLUDED.state
            """.formatted(TABLE_NAME);

    private static final String SELECT_COLUMNS = "SELECT checkpoint_id, node_id, next_node_id, state FROM " + TABLE_NAME;

    private static final String SELECT_BY_THREAD_SQL = SELECT_COLUMNS + " WHERE thread_id = ? ORDER BY seq DESC";

    private static final String SELECT_BY_ID_SQL = SELECT_COLUMNS + " WHERE thread_id = ? AND checkpoint_id = ?";

    private static final String SELECT_LATEST_SQL = SELECT_BY_THREAD_SQL + " LIMIT 1";

    private static final String DELETE_BY_THREAD_SQL = "DELETE FROM " + TABLE_NAME + " WHERE thread_id = ?";

    private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Checkpoint> rowMapper = (rs, rowNum) -> Checkpoint.builder()
            .id(rs.getString("checkpoint_id"))
            .nodeId(rs.getString("node_id"))
            .nextNodeId(rs.getString("next_node_id"))
            .state(deserializeState(rs.getString("state")))
            .build();

    public JdbcCheckpointSaver(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = Objects.requireNonNull(jdbc, "JdbcTemplate must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the checkpoint table if it does not exist. Called once at startup.
     */
    public void createTables() {
        jdbc.execute(CREATE_TABLE_SQL);
        log.info("Checkpoint table '{}' ensured", TABLE_NAME);
    }

    /** Newest first. */
    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        return jdbc.query(SELECT_BY_THREAD_SQL, rowMapper, threadId(config));
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = threadId(config);
        List<Checkpoint> rows = config.checkPointId()
                .map(id -> jdbc.query(SELECT_BY_ID_SQL, rowMapper, threadId, id))
                .orElseGet(() -> jdbc.query(SELECT_LATEST_SQL, rowMapper, threadId));
        return rows.stream().findFirst();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = threadId(config);
        jdbc.update(UPSERT_SQL, threadId, checkpoint.getId(), checkpoint.getNodeId(),
                checkpoint.getNextNodeId(), serializeState(checkpoint.getState()));
        log.debug("Saved checkpoint '{}' for thread '{}'", checkpoint.getId(), threadId);
        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = threadId(config);
        Collection<Checkpoint> released = list(config);
        int deleted = jdbc.update(DELETE_BY_THREAD_SQL, threadId);
        log.debug("Released {} checkpoints for thread '{}'", deleted, threadId);
        return new Tag(threadId, released);
    }

    private static String threadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, STATE_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint state", e);
        }
    }
}
