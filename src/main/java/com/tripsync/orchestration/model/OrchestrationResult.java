package com.tripsync.orchestration.model;

import com.tripsync.execution.TaskIteration;
import com.tripsync.state.model.SessionState;

import java.util.List;

public record OrchestrationResult(
        String sessionId,
        String reply,
        OrchestrationStage stage,
        boolean clarificationNeeded,
        List<TaskIteration> iterations,
        SessionState state
) {
}
