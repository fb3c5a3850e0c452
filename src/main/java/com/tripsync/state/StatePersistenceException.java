package com.tripsync.state;

/**
 * The session store failed to durably save a commit. The commit is not applied.
 */
public class StatePersistenceException extends StateException {

    private final String sessionId;

    public StatePersistenceException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
