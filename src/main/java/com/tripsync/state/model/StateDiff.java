package com.tripsync.state.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.state.DiffValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partial description of a state change. Pure data: building or holding a diff never
 * touches canonical state.
 * <p>
 * Each field is tagged with the merge rule that applies to it (see {@link DiffNode.Kind}),
 * so a diff states explicitly whether a mapping is replaced or merged and whether a list is
 * replaced or key-merged by {@code task_id}.
 */
public final class StateDiff {

    public static final String TASKS_FIELD = "tasks";
    public static final String USER_PROFILE_FIELD = "user_profile";
    public static final String TRAVEL_INFO_FIELD = "travel_info";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final StateDiff EMPTY = new StateDiff(Map.of());

    private final Map<String, DiffNode> fields;

    private StateDiff(Map<String, DiffNode> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static StateDiff empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tags a free-form JSON object: nested objects merge recursively, arrays under a
     * {@code tasks} key are key-merged task lists, everything else replaces.
     *
     * @throws DiffValidationException when the JSON is not an object or a task entry is malformed
     */
    public static StateDiff fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return EMPTY;
        }
        if (!json.isObject()) {
            throw new DiffValidationException("Diff must be a JSON object, got " + json.getNodeType());
        }
        Builder builder = builder();
        Iterator<Map.Entry<String, JsonNode>> it = json.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (TASKS_FIELD.equals(key)) {
                if (!value.isArray()) {
                    throw new DiffValidationException("Field 'tasks' must be an array, got " + value.getNodeType());
                }
                List<TaskPatch> patches = new ArrayList<>(value.size());
                for (JsonNode taskEntry : value) {
                    patches.add(TaskPatch.fromJson(taskEntry));
                }
                builder.tasks(key, patches);
            } else if (value.isObject()) {
                builder.nested(key, fromJson(value));
            } else {
                builder.value(key, value);
            }
        }
        return builder.build();
    }

    public Map<String, DiffNode> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public DiffNode get(String field) {
        return fields.get(field);
    }

    /**
     * Patches of the top-level task list, in diff order.
     */
    public List<TaskPatch> taskPatches() {
        DiffNode node = fields.get(TASKS_FIELD);
        if (node instanceof DiffNode.Tasks tasks) {
            return tasks.patches();
        }
        return List.of();
    }

    public ObjectNode toJson() {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        fields.forEach((key, node) -> {
            switch (node.kind()) {
                case VALUE -> out.set(key, ((DiffNode.Value) node).json().deepCopy());
                case NESTED -> out.set(key, ((DiffNode.Nested) node).diff().toJson());
                case TASKS -> {
                    ArrayNode array = out.putArray(key);
                    ((DiffNode.Tasks) node).patches().forEach(patch -> array.add(patch.fields().deepCopy()));
                }
            }
        });
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateDiff other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    public static final class Builder {

        private final Map<String, DiffNode> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder value(String field, JsonNode value) {
            fields.put(field, DiffNode.value(value));
            return this;
        }

        public Builder value(String field, Object value) {
            return value(field, (JsonNode) MAPPER.valueToTree(value));
        }

        public Builder nested(String field, StateDiff diff) {
            fields.put(field, DiffNode.nested(diff));
            return this;
        }

        public Builder tasks(String field, List<TaskPatch> patches) {
            DiffNode existing = fields.get(field);
            if (existing instanceof DiffNode.Tasks tasks) {
                List<TaskPatch> merged = new ArrayList<>(tasks.patches());
                merged.addAll(patches);
                fields.put(field, DiffNode.tasks(merged));
            } else {
                fields.put(field, DiffNode.tasks(patches));
            }
            return this;
        }

        public Builder task(TaskPatch patch) {
            return tasks(TASKS_FIELD, List.of(patch));
        }

        public Builder taskStatus(String taskId, TaskStatus status) {
            return task(TaskPatch.status(taskId, status));
        }

        public StateDiff build() {
            return fields.isEmpty() ? EMPTY : new StateDiff(fields);
        }
    }
}
