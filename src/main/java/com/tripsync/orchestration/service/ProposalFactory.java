package com.tripsync.orchestration.service;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.execution.ToolInvocation;
import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.orchestration.model.PlannedTask;
import com.tripsync.orchestration.model.TaskPlan;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shapes agent output into candidate state updates. Candidates are plain JSON; they become
 * diffs through {@link com.tripsync.state.StateView#proposeDiff}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProposalFactory {

    private static final List<String> UPDATABLE_SECTIONS =
            List.of(StateDiff.USER_PROFILE_FIELD, StateDiff.TRAVEL_INFO_FIELD);

    private static final Map<String, String> EXTRACTED_TO_TRAVEL_INFO = Map.of(
            "origin", "origin",
            "destination", "destination",
            "departure_date", "start_date",
            "return_date", "end_date");

    private final ObjectMapper objectMapper;

    public String newTaskId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public ObjectNode newCandidate() {
        return objectMapper.createObjectNode();
    }

    /**
     * Task recording the intent of an inbound message.
     */
    public ObjectNode rootTask(String message, IntakeDecision decision) {
        ObjectNode task = baseTask(newTaskId(TASK_PREFIX_ROOT), ORIGIN_ROOT,
                StringUtils.hasText(decision.intent()) ? decision.intent() : "information_query");
        ObjectNode metadata = task.putObject(Task.FIELD_METADATA);
        metadata.put(META_USER_QUERY, message);
        metadata.set(META_EXTRACTED_INFO, objectMapper.valueToTree(decision.extractedInfo()));
        if (StringUtils.hasText(decision.reasoning())) {
            metadata.put(META_REASONING, decision.reasoning());
        }
        return task;
    }

    /**
     * Travel info fields that the intake agent extracted with a concrete value.
     */
    public ObjectNode travelInfo(IntakeDecision decision) {
        ObjectNode travelInfo = objectMapper.createObjectNode();
        EXTRACTED_TO_TRAVEL_INFO.forEach((source, target) -> {
            Object value = decision.extractedInfo().get(source);
            if (value instanceof String text && StringUtils.hasText(text) && !"null".equalsIgnoreCase(text)) {
                travelInfo.put(target, text);
            }
        });
        return travelInfo;
    }

    /**
     * Pending task entries for every planned tool call, in category order.
     */
    public ArrayNode taskEntries(TaskPlan plan, String origin, String idPrefix) {
        ArrayNode entries = objectMapper.createArrayNode();
        plan.byCategory().forEach((category, planned) -> {
            for (PlannedTask candidate : planned) {
                if (!StringUtils.hasText(candidate.function())) {
                    log.warn("Dropping planned {} task without a function: {}", category, candidate.taskName());
                    continue;
                }
                entries.add(taskEntry(candidate, category, origin, idPrefix));
            }
        });
        return entries;
    }

    /**
     * Proposed updates restricted to the user profile and travel info sections.
     */
    public ObjectNode stateUpdates(JsonNode proposed) {
        ObjectNode updates = objectMapper.createObjectNode();
        if (proposed == null || !proposed.isObject()) {
            return updates;
        }
        for (String section : UPDATABLE_SECTIONS) {
            JsonNode value = proposed.get(section);
            if (value != null && value.isObject() && !value.isEmpty()) {
                updates.set(section, value.deepCopy());
            }
        }
        return updates;
    }

    private ObjectNode taskEntry(PlannedTask planned, String category, String origin, String idPrefix) {
        String intent = StringUtils.hasText(planned.taskName()) ? planned.taskName() : planned.function();
        ObjectNode task = baseTask(newTaskId(idPrefix), origin, intent);
        ObjectNode metadata = task.putObject(Task.FIELD_METADATA);
        metadata.put(ToolInvocation.METADATA_TOOL, planned.function().trim());
        if (planned.request() != null && !planned.request().isNull()) {
            metadata.set(ToolInvocation.METADATA_ARGUMENTS, planned.request().deepCopy());
        } else {
            metadata.putObject(ToolInvocation.METADATA_ARGUMENTS);
        }
        metadata.put(META_CATEGORY, category);
        metadata.put(META_PRIORITY, planned.priority());
        metadata.put(META_AGENT_CALL_REQUIRED, planned.agentCallRequired());
        return task;
    }

    private ObjectNode baseTask(String taskId, String origin, String intent) {
        ObjectNode task = objectMapper.createObjectNode();
        task.put(Task.FIELD_TASK_ID, taskId);
        task.put("timestamp", Instant.now().toString());
        task.put("agent_origin", origin);
        task.put("intent", intent);
        task.put(Task.FIELD_STATUS, TaskStatus.PENDING.wireName());
        return task;
    }
}
