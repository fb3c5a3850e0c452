package com.tripsync.orchestration.api;

import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.orchestration.model.TaskPlan;
import com.tripsync.state.StateView;

public interface PlannerAgent {

    /**
     * Breaks the request into tool calls and proposes them as pending tasks.
     */
    AgentProposal<TaskPlan> plan(StateView view, String message, IntakeDecision intake);
}
