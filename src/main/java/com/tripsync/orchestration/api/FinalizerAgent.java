package com.tripsync.orchestration.api;

import com.tripsync.execution.TaskIteration;
import com.tripsync.orchestration.model.FinalSummary;
import com.tripsync.state.StateView;

import java.util.List;

public interface FinalizerAgent {

    /**
     * Writes the reply to the user and proposes closing the tasks the reply answers.
     */
    AgentProposal<FinalSummary> summarize(StateView view, String message, List<TaskIteration> iterations);
}
