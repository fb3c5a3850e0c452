package com.tripsync.orchestration.api;

import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.state.StateView;
import com.tripsync.store.ChatMessage;

import java.util.List;

public interface IntakeAgent {

    /**
     * Analyzes an inbound message and proposes a task recording its intent.
     */
    AgentProposal<IntakeDecision> intake(StateView view, String message, List<ChatMessage> recentHistory);
}
