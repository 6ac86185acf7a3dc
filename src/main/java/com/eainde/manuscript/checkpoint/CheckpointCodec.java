package com.eainde.manuscript.checkpoint;

import com.eainde.manuscript.state.PipelineRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of a {@link PipelineRun}. Also used for the engine's per-stage working copies, so a stage
 * can never reach into the checkpointed snapshot.
 */
public class CheckpointCodec {

    private final ObjectMapper objectMapper;

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public String encode(PipelineRun run) {
        try {
            return objectMapper.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pipeline run " + run.getThreadId(), e);
        }
    }

    public PipelineRun decode(String json) {
        try {
            return objectMapper.readValue(json, PipelineRun.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize pipeline run", e);
        }
    }

    public PipelineRun copy(PipelineRun run) {
        return decode(encode(run));
    }
}
