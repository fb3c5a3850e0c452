package com.tripsync.state.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.state.DiffValidationException;

/**
 * Partial {@link Task} identified by {@code task_id}. Only the fields present are applied.
 */
public record TaskPatch(String taskId, ObjectNode fields) {

    public TaskPatch {
        if (taskId == null || taskId.isBlank()) {
            throw new DiffValidationException("Task entry in diff is missing task_id");
        }
        ObjectNode copy = fields == null ? JsonNodeFactory.instance.objectNode() : fields.deepCopy();
        copy.put(Task.FIELD_TASK_ID, taskId);
        JsonNode status = copy.get(Task.FIELD_STATUS);
        if (status != null && !status.isNull()) {
            copy.put(Task.FIELD_STATUS, parseStatus(taskId, status).wireName());
        }
        fields = copy;
    }

    /**
     * Builds a patch from a raw JSON entry of a task list.
     */
    public static TaskPatch fromJson(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            throw new DiffValidationException("Task entry in diff must be an object, got: " + entry);
        }
        JsonNode id = entry.get(Task.FIELD_TASK_ID);
        if (id == null || !id.isValueNode() || id.asText().isBlank()) {
            throw new DiffValidationException("Task entry in diff is missing task_id: " + entry);
        }
        return new TaskPatch(id.asText(), (ObjectNode) entry);
    }

    public static TaskPatch status(String taskId, TaskStatus status) {
        ObjectNode fields = JsonNodeFactory.instance.objectNode();
        fields.put(Task.FIELD_STATUS, status.wireName());
        return new TaskPatch(taskId, fields);
    }

    /**
     * Status carried by this patch, or {@code null} when the patch leaves it untouched.
     */
    public TaskStatus statusOrNull() {
        JsonNode status = fields.get(Task.FIELD_STATUS);
        return status == null || status.isNull() ? null : parseStatus(taskId, status);
    }

    private static TaskStatus parseStatus(String taskId, JsonNode status) {
        try {
            return TaskStatus.fromWire(status.asText());
        } catch (IllegalArgumentException ex) {
            throw new DiffValidationException("Task " + taskId + " has unknown status '" + status.asText() + "'", ex);
        }
    }
}
