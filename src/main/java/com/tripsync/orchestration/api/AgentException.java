package com.tripsync.orchestration.api;

/**
 * An agent could not produce a usable answer, e.g. the model returned no parseable JSON.
 */
public class AgentException extends RuntimeException {

    private final String purpose;

    public AgentException(String purpose, String message) {
        super(message);
        this.purpose = purpose;
    }

    public AgentException(String purpose, String message, Throwable cause) {
        super(message, cause);
        this.purpose = purpose;
    }

    public String getPurpose() {
        return purpose;
    }
}
