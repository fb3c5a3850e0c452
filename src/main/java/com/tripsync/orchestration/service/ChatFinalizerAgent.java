package com.tripsync.orchestration.service;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.tripsync.execution.TaskIteration;
import com.tripsync.execution.ToolInvocation;
import com.tripsync.orchestration.api.AgentException;
import com.tripsync.orchestration.api.AgentProposal;
import com.tripsync.orchestration.api.FinalizerAgent;
import com.tripsync.orchestration.model.FinalSummary;
import com.tripsync.state.StateView;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Writes the reply and closes the bookkeeping tasks (those without a tool call) that the reply
 * answers. Tool tasks keep the status their execution gave them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatFinalizerAgent implements FinalizerAgent {

    private final AgentChatService agentChatService;
    private final JsonProcessingService jsonProcessingService;

    @Override
    public AgentProposal<FinalSummary> summarize(StateView view, String message, List<TaskIteration> iterations) {
        SessionState state = view.getState();
        String reply;
        try {
            reply = agentChatService.requestText(PURPOSE_FINALIZE,
                    FINALIZER_SYSTEM_PROMPT.formatted(LocalDate.now()),
                    FINALIZER_USER_TEMPLATE,
                    Map.of("input", message,
                            "iterations", jsonProcessingService.toJson(iterations),
                            "state", jsonProcessingService.toJson(state.toJson())));
        } catch (AgentException ex) {
            log.warn("Final summary for session {} failed, using execution summary: {}", view.sessionId(), ex.getMessage());
            reply = null;
        }
        if (!StringUtils.hasText(reply)) {
            reply = fallbackReply(iterations);
        }

        StateDiff.Builder diff = StateDiff.builder();
        for (Task task : state.tasks()) {
            boolean open = task.status() == null || !task.status().isTerminal();
            if (open && ToolInvocation.fromTask(task).isEmpty()) {
                diff.taskStatus(task.taskId(), TaskStatus.DONE);
            }
        }
        return AgentProposal.of(new FinalSummary(reply.trim()), diff.build());
    }

    private static String fallbackReply(List<TaskIteration> iterations) {
        if (iterations.isEmpty()) {
            return NO_TASKS_REPLY;
        }
        StringBuilder out = new StringBuilder("Here is what I could gather so far:");
        iterations.forEach(iteration -> out.append("\n- ").append(iteration.summary()));
        return out.toString();
    }
}
