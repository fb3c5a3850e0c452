package com.tripsync.state.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;

/**
 * One field of a {@link StateDiff}. The kind decides the merge rule applied to the field.
 */
public interface DiffNode {

    enum Kind {
        /** Replace the current value (scalars, sequences, whole objects). */
        VALUE,
        /** Merge recursively into the current mapping. */
        NESTED,
        /** Key-merge into a task list by {@code task_id}. */
        TASKS
    }

    Kind kind();

    static DiffNode value(JsonNode value) {
        return new Value(value);
    }

    static DiffNode nested(StateDiff diff) {
        return new Nested(diff);
    }

    static DiffNode tasks(List<TaskPatch> patches) {
        return new Tasks(patches);
    }

    record Value(JsonNode json) implements DiffNode {

        public Value {
            json = json == null ? NullNode.getInstance() : json.deepCopy();
        }

        @Override
        public Kind kind() {
            return Kind.VALUE;
        }
    }

    record Nested(StateDiff diff) implements DiffNode {

        public Nested {
            diff = diff == null ? StateDiff.empty() : diff;
        }

        @Override
        public Kind kind() {
            return Kind.NESTED;
        }
    }

    record Tasks(List<TaskPatch> patches) implements DiffNode {

        public Tasks {
            patches = patches == null ? List.of() : List.copyOf(patches);
        }

        @Override
        public Kind kind() {
            return Kind.TASKS;
        }
    }
}
