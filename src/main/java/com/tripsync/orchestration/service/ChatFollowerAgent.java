package com.tripsync.orchestration.service;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.execution.TaskIteration;
import com.tripsync.execution.TaskResult;
import com.tripsync.execution.ToolGateway;
import com.tripsync.orchestration.api.AgentProposal;
import com.tripsync.orchestration.api.FollowerAgent;
import com.tripsync.orchestration.model.Reflection;
import com.tripsync.state.StateView;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reviews the results of tasks flagged {@code agent_call_required} and proposes follow-ups.
 * When no succeeded task asks for review, no model call is made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatFollowerAgent implements FollowerAgent {

    private final AgentChatService agentChatService;
    private final JsonProcessingService jsonProcessingService;
    private final ProposalFactory proposalFactory;
    private final ToolGateway toolGateway;
    private final ObjectMapper objectMapper;

    @Override
    public AgentProposal<Reflection> reflect(StateView view, String message, TaskIteration iteration) {
        List<Map<String, Object>> reviewed = callbackRequired(iteration);
        if (reviewed.isEmpty()) {
            return AgentProposal.of(Reflection.nothingToDo("No tasks require agent callback"), StateDiff.empty());
        }

        Reflection reflection = agentChatService.requestJson(PURPOSE_REFLECT,
                FOLLOWER_SYSTEM_PROMPT.formatted(LocalDate.now(), toolGateway.toolCatalog()),
                FOLLOWER_USER_TEMPLATE,
                Map.of("input", message,
                        "results", jsonProcessingService.toJson(reviewed),
                        "state", jsonProcessingService.toJson(view.getState().toJson())),
                Reflection.class);
        log.info("Follower reviewed {} tasks for session {}: additional tasks needed={}",
                reviewed.size(), view.sessionId(), reflection.needsAdditionalTasks());

        ObjectNode candidate = proposalFactory.stateUpdates(reflection.proposedStateUpdates());
        ArrayNode tasks = objectMapper.createArrayNode();
        for (Map<String, Object> entry : reviewed) {
            tasks.add(annotation((String) entry.get(Task.FIELD_TASK_ID), reflection));
        }
        if (reflection.needsAdditionalTasks()) {
            tasks.addAll(proposalFactory.taskEntries(reflection.newTasks(), ORIGIN_FOLLOWER, TASK_PREFIX_FOLLOWER));
        }
        candidate.set(StateDiff.TASKS_FIELD, tasks);
        return AgentProposal.of(reflection, view.proposeDiff(candidate));
    }

    private List<Map<String, Object>> callbackRequired(TaskIteration iteration) {
        Map<String, Task> tasksById = new LinkedHashMap<>();
        iteration.tasks().forEach(task -> tasksById.put(task.taskId(), task));
        List<Map<String, Object>> reviewed = new ArrayList<>();
        for (TaskResult result : iteration.results()) {
            Task task = tasksById.get(result.taskId());
            if (task == null || !result.succeeded() || !Boolean.TRUE.equals(task.metadataValue(META_AGENT_CALL_REQUIRED))) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(Task.FIELD_TASK_ID, task.taskId());
            entry.put("intent", task.intent());
            entry.put(META_CATEGORY, task.metadataValue(META_CATEGORY));
            entry.put("function", task.metadataValue("tool"));
            entry.put("request", task.metadataValue("arguments"));
            entry.put("response", result.result());
            reviewed.add(entry);
        }
        return reviewed;
    }

    private ObjectNode annotation(String taskId, Reflection reflection) {
        ObjectNode patch = objectMapper.createObjectNode();
        patch.put(Task.FIELD_TASK_ID, taskId);
        ObjectNode metadata = patch.putObject(Task.FIELD_METADATA);
        metadata.set(META_INSIGHTS, objectMapper.valueToTree(reflection.insights()));
        if (reflection.reasoning() != null) {
            metadata.put(META_REASONING, reflection.reasoning());
        }
        return patch;
    }
}
