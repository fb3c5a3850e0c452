package com.tripsync.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tripsync.execution.TaskIteration;
import com.tripsync.state.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What one finished request did: the query, what intake extracted, and a summary of every
 * execution iteration with totals.
 */
public record PlanRecord(
        @JsonProperty("query") String query,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("extracted_info") Map<String, Object> extractedInfo,
        @JsonProperty("iterations") List<IterationSummary> iterations,
        @JsonProperty("total_iterations") int totalIterations,
        @JsonProperty("total_tool_calls") int totalToolCalls,
        @JsonProperty("total_elapsed_ms") long totalElapsedMs
) {

    public PlanRecord {
        extractedInfo = extractedInfo == null ? Map.of() : extractedInfo;
        iterations = iterations == null ? List.of() : List.copyOf(iterations);
    }

    public static PlanRecord of(String query, Map<String, Object> extractedInfo, List<TaskIteration> iterations) {
        List<IterationSummary> summaries = iterations.stream().map(IterationSummary::of).toList();
        return new PlanRecord(query, Instant.now().toString(), extractedInfo, summaries,
                summaries.size(),
                summaries.stream().mapToInt(IterationSummary::total).sum(),
                summaries.stream().mapToLong(IterationSummary::elapsedMs).sum());
    }

    public record IterationSummary(
            @JsonProperty("iteration") int iteration,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("task_ids") List<String> taskIds,
            @JsonProperty("total") int total,
            @JsonProperty("succeeded") long succeeded,
            @JsonProperty("failed") long failed,
            @JsonProperty("elapsed_ms") long elapsedMs
    ) {

        public IterationSummary {
            taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
        }

        static IterationSummary of(TaskIteration iteration) {
            return new IterationSummary(iteration.iteration(), iteration.timestamp(),
                    iteration.tasks().stream().map(Task::taskId).toList(),
                    iteration.total(), iteration.succeeded(), iteration.failed(), iteration.elapsedMs());
        }
    }
}
