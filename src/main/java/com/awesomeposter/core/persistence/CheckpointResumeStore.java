package com.awesomeposter.core.persistence;

import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ResumeStore} on top of a LangGraph4j {@link BaseCheckpointSaver}.
 * <p>
 * Each snapshot becomes one checkpoint on the thread, with the snapshot converted to a
 * plain map under {@link #SNAPSHOT_KEY} and timestamps written as ISO-8601 strings. The
 * checkpoint's node ids record the last step touched and the next pending step, so the
 * saver's own listings stay readable.
 */
@Component
public class CheckpointResumeStore implements ResumeStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointResumeStore.class);

    static final String SNAPSHOT_KEY = "snapshot";
    static final String START_NODE = "__start__";
    static final String END_NODE = "__end__";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final BaseCheckpointSaver saver;
    private final ObjectMapper objectMapper;

    public CheckpointResumeStore(BaseCheckpointSaver saver, ObjectMapper objectMapper) {
        this.saver = saver;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void put(String threadId, RunSnapshot snapshot) {
        String nodeId = snapshot.plan().steps().stream()
                .filter(s -> s.status() != StepStatus.PENDING)
                .reduce((first, second) -> second)
                .map(PlanStep::id)
                .orElse(START_NODE);
        String nextNodeId = snapshot.plan().pendingSteps().stream()
                .findFirst()
                .map(PlanStep::id)
                .orElse(END_NODE);

        Checkpoint checkpoint = Checkpoint.builder()
                .id(UUID.randomUUID().toString())
                .state(Map.of(SNAPSHOT_KEY, objectMapper.convertValue(snapshot, MAP_TYPE)))
                .nodeId(nodeId)
                .nextNodeId(nextNodeId)
                .build();
        try {
            saver.put(config(threadId), checkpoint);
        } catch (Exception e) {
            throw new ResumeStoreException("Failed to store snapshot for thread " + threadId, e);
        }
        log.debug("Stored snapshot for thread {} at plan v{} (checkpoint {})",
                threadId, snapshot.plan().version(), checkpoint.getId());
    }

    @Override
    public Optional<RunSnapshot> get(String threadId) {
        Optional<Checkpoint> latest;
        try {
            latest = saver.get(config(threadId));
        } catch (Exception e) {
            throw new ResumeStoreException("Failed to load snapshot for thread " + threadId, e);
        }
        return latest
                .map(checkpoint -> checkpoint.getState().get(SNAPSHOT_KEY))
                .map(raw -> objectMapper.convertValue(raw, RunSnapshot.class));
    }

    private static RunnableConfig config(String threadId) {
        return RunnableConfig.builder().threadId(threadId).build();
    }
}
