package com.tripsync.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One tool call proposed by the planner or the follower.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlannedTask(
        @JsonProperty("task_name") String taskName,
        @JsonProperty("function") String function,
        @JsonProperty("request") JsonNode request,
        @JsonProperty("agent_call_required") boolean agentCallRequired,
        @JsonProperty("priority") int priority
) {
}
