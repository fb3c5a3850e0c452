package com.tripsync.orchestration.service;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.execution.ToolGateway;
import com.tripsync.orchestration.api.AgentProposal;
import com.tripsync.orchestration.api.PlannerAgent;
import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.orchestration.model.TaskPlan;
import com.tripsync.state.StateView;
import com.tripsync.state.model.StateDiff;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatPlannerAgent implements PlannerAgent {

    private final AgentChatService agentChatService;
    private final JsonProcessingService jsonProcessingService;
    private final ProposalFactory proposalFactory;
    private final ToolGateway toolGateway;

    @Override
    public AgentProposal<TaskPlan> plan(StateView view, String message, IntakeDecision intake) {
        TaskPlan plan = agentChatService.requestJson(PURPOSE_PLAN,
                PLANNER_SYSTEM_PROMPT.formatted(LocalDate.now(), toolGateway.toolCatalog()),
                PLANNER_USER_TEMPLATE,
                Map.of("input", message,
                        "extracted", jsonProcessingService.toJson(intake.extractedInfo()),
                        "state", jsonProcessingService.toJson(view.getState().toJson())),
                TaskPlan.class);
        log.info("Planner proposed {} tasks for session {}", plan.size(), view.sessionId());

        ObjectNode candidate = proposalFactory.stateUpdates(plan.proposedStateUpdates());
        ArrayNode entries = proposalFactory.taskEntries(plan, ORIGIN_PLANNER, TASK_PREFIX_PLANNER);
        if (!entries.isEmpty()) {
            candidate.set(StateDiff.TASKS_FIELD, entries);
        }
        return AgentProposal.of(plan, view.proposeDiff(candidate));
    }
}
