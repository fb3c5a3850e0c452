package com.tripsync.orchestration.api;

import com.tripsync.execution.TaskIteration;
import com.tripsync.orchestration.model.Reflection;
import com.tripsync.state.StateView;

public interface FollowerAgent {

    /**
     * Reviews an executed batch and proposes annotations and follow-up tasks.
     */
    AgentProposal<Reflection> reflect(StateView view, String message, TaskIteration iteration);
}
