package com.tripsync.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Follower verdict on an executed batch: insights plus any follow-up tool calls.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Reflection(
        @JsonProperty("needs_additional_tasks") boolean needsAdditionalTasks,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("insights") List<String> insights,
        @JsonProperty("new_tasks") TaskPlan newTasks,
        @JsonProperty("proposed_state_updates") JsonNode proposedStateUpdates
) {

    public Reflection {
        insights = insights == null ? List.of() : List.copyOf(insights);
        newTasks = newTasks == null ? TaskPlan.empty() : newTasks;
    }

    public static Reflection nothingToDo(String reasoning) {
        return new Reflection(false, reasoning, List.of(), TaskPlan.empty(), null);
    }
}
