package com.tripsync.state;

import java.time.Duration;

/**
 * The per-session commit lock could not be acquired in time.
 */
public class CommitContentionException extends StateException {

    private final String sessionId;

    public CommitContentionException(String sessionId, Duration waited) {
        super("Could not acquire commit lock for session " + sessionId + " within " + waited.toMillis() + "ms");
        this.sessionId = sessionId;
    }

    public CommitContentionException(String sessionId, InterruptedException cause) {
        super("Interrupted while waiting for commit lock of session " + sessionId, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
