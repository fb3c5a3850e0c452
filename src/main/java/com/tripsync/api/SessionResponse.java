package com.tripsync.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripsync.state.model.SessionState;

public record SessionResponse(
        String sessionId,
        JsonNode state
) {

    public static SessionResponse from(String sessionId, SessionState state) {
        return new SessionResponse(sessionId, state.toJson());
    }
}
