package com.tripsync.orchestration;

import com.tripsync.orchestration.model.OrchestrationStage;

/**
 * A request was aborted at {@code stage}. Commits made in earlier stages stay; nothing of the
 * failing stage was applied.
 */
public class OrchestrationException extends RuntimeException {

    private final OrchestrationStage stage;
    private final String sessionId;

    public OrchestrationException(String sessionId, OrchestrationStage stage, Throwable cause) {
        super("Orchestration of session " + sessionId + " failed at " + stage + ": " + cause.getMessage(), cause);
        this.sessionId = sessionId;
        this.stage = stage;
    }

    public OrchestrationStage getStage() {
        return stage;
    }

    public String getSessionId() {
        return sessionId;
    }
}
