package com.tripsync.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;

/**
 * Read-only capability handed to agents: a snapshot of session state plus a way to shape
 * proposals. Nothing reachable from a view can change canonical state.
 */
public interface StateView {

    String sessionId();

    /**
     * Snapshot of the current state. Later commits are not reflected in a snapshot already taken.
     */
    SessionState getState();

    /**
     * Turns free-form candidate updates into a validated diff without applying it.
     *
     * @throws DiffValidationException when the candidate does not describe a valid diff
     */
    StateDiff proposeDiff(JsonNode candidateUpdates);
}
