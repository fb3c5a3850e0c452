package com.tripsync.state.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State tree of one session: {@code user_profile}, {@code tasks} and {@code travel_info}.
 * <p>
 * Instances are immutable. The tree is copied on the way in and on the way out, so a
 * snapshot handed to an agent can never alias canonical state.
 */
public final class SessionState {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode root;

    private SessionState(ObjectNode root) {
        this.root = root;
    }

    public static SessionState of(ObjectNode tree) {
        ObjectNode root = tree == null ? MAPPER.createObjectNode() : tree.deepCopy();
        if (!root.path(StateDiff.USER_PROFILE_FIELD).isObject()) {
            root.putObject(StateDiff.USER_PROFILE_FIELD);
        }
        if (!root.path(StateDiff.TASKS_FIELD).isArray()) {
            root.putArray(StateDiff.TASKS_FIELD);
        }
        if (!root.path(StateDiff.TRAVEL_INFO_FIELD).isObject()) {
            root.putObject(StateDiff.TRAVEL_INFO_FIELD);
        }
        return new SessionState(root);
    }

    public static SessionState empty() {
        return of(null);
    }

    /**
     * Deep copy of the whole tree.
     */
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    public List<Task> tasks() {
        JsonNode array = root.get(StateDiff.TASKS_FIELD);
        List<Task> tasks = new ArrayList<>(array.size());
        for (JsonNode entry : array) {
            tasks.add(MAPPER.convertValue(entry, Task.class));
        }
        return tasks;
    }

    public Optional<Task> task(String taskId) {
        for (JsonNode entry : root.get(StateDiff.TASKS_FIELD)) {
            if (taskId.equals(entry.path(Task.FIELD_TASK_ID).asText(null))) {
                return Optional.of(MAPPER.convertValue(entry, Task.class));
            }
        }
        return Optional.empty();
    }

    public int taskCount() {
        return root.get(StateDiff.TASKS_FIELD).size();
    }

    public JsonNode userProfile() {
        return root.get(StateDiff.USER_PROFILE_FIELD).deepCopy();
    }

    public JsonNode travelInfo() {
        return root.get(StateDiff.TRAVEL_INFO_FIELD).deepCopy();
    }

    /**
     * Value at a JSON pointer such as {@code /travel_info/outbound/seat_number}; missing node when absent.
     */
    public JsonNode at(String pointer) {
        return root.at(pointer).deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionState other)) return false;
        return root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
