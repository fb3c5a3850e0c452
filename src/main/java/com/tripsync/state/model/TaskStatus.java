package com.tripsync.state.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a {@link Task}. Ordered pending &lt; in_progress &lt; {done, failed};
 * the two terminal states are not comparable with each other.
 */
public enum TaskStatus {

    PENDING(0),
    IN_PROGRESS(1),
    DONE(2),
    FAILED(2);

    private final int rank;

    TaskStatus(int rank) {
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Restating the current status is allowed; otherwise the rank must strictly increase.
     */
    public boolean canAdvanceTo(TaskStatus next) {
        return next == this || next.rank > rank;
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("COMPLETED".equals(normalized)) {
            return DONE;
        }
        return TaskStatus.valueOf(normalized);
    }
}
