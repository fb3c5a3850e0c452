package com.tripsync.execution;

import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;

import java.util.List;

/**
 * One batch of tasks submitted together and what came back, in submission order.
 */
public record TaskIteration(int iteration, String timestamp, List<Task> tasks, List<TaskResult> results, long elapsedMs) {

    public TaskIteration {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public long succeeded() {
        return results.stream().filter(TaskResult::succeeded).count();
    }

    public long failed() {
        return total() - succeeded();
    }

    /**
     * Diff recording every result on its task.
     */
    public StateDiff toDiff() {
        StateDiff.Builder builder = StateDiff.builder();
        results.forEach(result -> builder.task(result.toPatch()));
        return builder.build();
    }

    public String summary() {
        return "iteration " + iteration + ": " + total() + " tasks, " + succeeded() + " succeeded, "
                + failed() + " failed in " + elapsedMs + "ms";
    }
}
