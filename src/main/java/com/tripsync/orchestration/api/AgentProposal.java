package com.tripsync.orchestration.api;

import com.tripsync.state.model.StateDiff;

/**
 * What an agent hands back to the orchestrator: its own output plus the state change it
 * proposes. The agent never applies the diff itself.
 */
public record AgentProposal<T>(T output, StateDiff diff) {

    public AgentProposal {
        diff = diff == null ? StateDiff.empty() : diff;
    }

    public static <T> AgentProposal<T> of(T output, StateDiff diff) {
        return new AgentProposal<>(output, diff);
    }
}
