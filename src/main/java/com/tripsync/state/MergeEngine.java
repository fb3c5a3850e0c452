package com.tripsync.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.state.model.DiffNode;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskPatch;
import com.tripsync.state.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines a state and a diff into a new state. Pure: the input state is never modified
 * and the same inputs always give the same output.
 * <p>
 * The walk is iterative over a FIFO work queue. Frames for the same target are processed
 * in the order they were queued, so later entries of a diff win over earlier ones.
 */
@Component
public class MergeEngine {

    public SessionState merge(SessionState current, StateDiff diff) {
        Objects.requireNonNull(current, "current state");
        if (diff == null || diff.isEmpty()) {
            return current;
        }
        ObjectNode root = current.toJson();
        Deque<Frame> work = new ArrayDeque<>();
        work.addLast(new Frame(root, diff, ""));
        while (!work.isEmpty()) {
            Frame frame = work.pollFirst();
            for (Map.Entry<String, DiffNode> field : frame.diff().fields().entrySet()) {
                apply(frame, field.getKey(), field.getValue(), work);
            }
        }
        return SessionState.of(root);
    }

    /**
     * Shape checks that do not depend on the current state.
     *
     * @throws DiffValidationException when a task list is targeted by anything but a task-list diff
     */
    public void validate(StateDiff diff) {
        if (diff == null) {
            return;
        }
        Deque<Map.Entry<String, StateDiff>> work = new ArrayDeque<>();
        work.addLast(Map.entry("", diff));
        while (!work.isEmpty()) {
            Map.Entry<String, StateDiff> next = work.pollFirst();
            for (Map.Entry<String, DiffNode> field : next.getValue().fields().entrySet()) {
                String path = next.getKey() + "/" + field.getKey();
                DiffNode node = field.getValue();
                requireTaskListDiff(field.getKey(), node, path);
                if (node.kind() == DiffNode.Kind.NESTED) {
                    work.addLast(Map.entry(path, ((DiffNode.Nested) node).diff()));
                }
            }
        }
    }

    private void apply(Frame frame, String key, DiffNode node, Deque<Frame> work) {
        String path = frame.path() + "/" + key;
        requireTaskListDiff(key, node, path);
        switch (node.kind()) {
            case VALUE -> {
                frame.target().set(key, ((DiffNode.Value) node).json().deepCopy());
            }
            case NESTED -> {
                JsonNode existing = frame.target().get(key);
                ObjectNode child = existing instanceof ObjectNode object ? object : frame.target().putObject(key);
                work.addLast(new Frame(child, ((DiffNode.Nested) node).diff(), path));
            }
            case TASKS -> {
                JsonNode existing = frame.target().get(key);
                ArrayNode list = existing instanceof ArrayNode array ? array : frame.target().putArray(key);
                mergeTasks(list, ((DiffNode.Tasks) node).patches(), path, work);
            }
        }
    }

    private static void requireTaskListDiff(String key, DiffNode node, String path) {
        if (StateDiff.TASKS_FIELD.equals(key) && node.kind() != DiffNode.Kind.TASKS) {
            throw new DiffValidationException("Field " + path + " is a task list and can only be key-merged, got "
                    + node.kind());
        }
    }

    private void mergeTasks(ArrayNode list, List<TaskPatch> patches, String path, Deque<Frame> work) {
        Map<String, ObjectNode> index = new HashMap<>();
        for (JsonNode entry : list) {
            String id = entry.path(Task.FIELD_TASK_ID).asText(null);
            if (id != null && entry instanceof ObjectNode object) {
                index.putIfAbsent(id, object);
            }
        }
        for (TaskPatch patch : patches) {
            String taskId = patch.taskId();
            TaskStatus requested = patch.statusOrNull();
            ObjectNode target = index.get(taskId);
            if (target == null) {
                target = list.addObject();
                target.put(Task.FIELD_TASK_ID, taskId);
                target.put(Task.FIELD_STATUS, (requested != null ? requested : TaskStatus.PENDING).wireName());
                index.put(taskId, target);
            } else if (requested != null) {
                TaskStatus currentStatus = currentStatus(target, taskId, path);
                if (currentStatus != null && !currentStatus.canAdvanceTo(requested)) {
                    throw new DiffValidationException("Task " + taskId + " at " + path + " cannot move from "
                            + currentStatus.wireName() + " to " + requested.wireName());
                }
                target.put(Task.FIELD_STATUS, requested.wireName());
            }
            ObjectNode rest = patch.fields().deepCopy();
            rest.remove(Task.FIELD_TASK_ID);
            rest.remove(Task.FIELD_STATUS);
            if (!rest.isEmpty()) {
                work.addLast(new Frame(target, StateDiff.fromJson(rest), path + "[" + taskId + "]"));
            }
        }
    }

    private TaskStatus currentStatus(ObjectNode task, String taskId, String path) {
        JsonNode status = task.get(Task.FIELD_STATUS);
        if (status == null || status.isNull()) {
            return null;
        }
        try {
            return TaskStatus.fromWire(status.asText());
        } catch (IllegalArgumentException ex) {
            throw new DiffValidationException("Task " + taskId + " at " + path + " has unknown stored status '"
                    + status.asText() + "'", ex);
        }
    }

    private record Frame(ObjectNode target, StateDiff diff, String path) {
    }
}
