package com.tripsync.state.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed read view of one entry of {@code state.tasks}. The state tree itself is the
 * source of truth, so fields this record does not know about are ignored here but
 * survive in the tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("agent_origin") String agentOrigin,
        @JsonProperty("intent") String intent,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public static final String FIELD_TASK_ID = "task_id";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_METADATA = "metadata";

    public Task {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Object metadataValue(String key) {
        return metadata.get(key);
    }
}
