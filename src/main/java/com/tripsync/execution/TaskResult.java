package com.tripsync.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskPatch;
import com.tripsync.state.model.TaskStatus;

/**
 * Outcome of running one task. Status is {@link TaskStatus#DONE} or {@link TaskStatus#FAILED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error,
        @JsonProperty("elapsed_ms") long elapsedMs,
        @JsonProperty("attempts") int attempts
) {

    public static final String METADATA_RESULT = "result";
    public static final String METADATA_ERROR = "error";
    public static final String METADATA_ELAPSED = "elapsed_ms";
    public static final String METADATA_ATTEMPTS = "attempts";

    public static TaskResult success(String taskId, JsonNode result, long elapsedMs, int attempts) {
        return new TaskResult(taskId, TaskStatus.DONE, result, null, elapsedMs, attempts);
    }

    public static TaskResult failure(String taskId, String error, long elapsedMs, int attempts) {
        return new TaskResult(taskId, TaskStatus.FAILED, null, error, elapsedMs, attempts);
    }

    public boolean succeeded() {
        return status == TaskStatus.DONE;
    }

    /**
     * Patch recording this outcome on the task: final status plus result or error in metadata.
     */
    public TaskPatch toPatch() {
        ObjectNode fields = JsonNodeFactory.instance.objectNode();
        fields.put(Task.FIELD_STATUS, status.wireName());
        ObjectNode metadata = fields.putObject(Task.FIELD_METADATA);
        if (result != null) {
            metadata.set(METADATA_RESULT, result.deepCopy());
        }
        if (error != null) {
            metadata.put(METADATA_ERROR, error);
        }
        metadata.put(METADATA_ELAPSED, elapsedMs);
        metadata.put(METADATA_ATTEMPTS, attempts);
        return new TaskPatch(taskId, fields);
    }
}
