package com.tripsync.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripsync.execution.TaskIteration;
import com.tripsync.orchestration.model.OrchestrationResult;
import com.tripsync.orchestration.model.OrchestrationStage;

import java.time.Instant;
import java.util.List;

public record MessageResponse(
        String sessionId,
        Instant createdAt,
        String reply,
        OrchestrationStage stage,
        boolean clarificationNeeded,
        List<TaskIteration> iterations,
        JsonNode state
) {

    public static MessageResponse from(OrchestrationResult result) {
        return new MessageResponse(result.sessionId(), Instant.now(), result.reply(), result.stage(),
                result.clarificationNeeded(), result.iterations(), result.state().toJson());
    }
}
