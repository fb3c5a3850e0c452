package com.tripsync.orchestration;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.tripsync.config.TripSyncProperties;
import com.tripsync.execution.TaskExecutor;
import com.tripsync.execution.TaskIteration;
import com.tripsync.execution.ToolInvocation;
import com.tripsync.logging.MdcContext;
import com.tripsync.orchestration.api.AgentProposal;
import com.tripsync.orchestration.api.FinalizerAgent;
import com.tripsync.orchestration.api.FollowerAgent;
import com.tripsync.orchestration.api.IntakeAgent;
import com.tripsync.orchestration.api.PlannerAgent;
import com.tripsync.orchestration.model.FinalSummary;
import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.orchestration.model.OrchestrationResult;
import com.tripsync.orchestration.model.OrchestrationStage;
import com.tripsync.orchestration.model.Reflection;
import com.tripsync.orchestration.model.TaskPlan;
import com.tripsync.state.CommitContentionException;
import com.tripsync.state.SessionContext;
import com.tripsync.state.SessionStateManager;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskPatch;
import com.tripsync.state.model.TaskStatus;
import com.tripsync.store.ChatMessage;
import com.tripsync.store.ConversationHistory;
import com.tripsync.store.PlanRecord;
import com.tripsync.store.PlanRecords;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Drives one inbound message through intake, planning, execution, reflection and the final
 * reply. Agents only see a {@link com.tripsync.state.StateView}; every change they propose is
 * committed here, in stage order, through the request's {@link SessionContext}.
 */
@Service
@Slf4j
public class TravelOrchestrator {

    private final SessionStateManager stateManager;
    private final ConversationHistory conversationHistory;
    private final PlanRecords planRecords;
    private final TaskExecutor taskExecutor;
    private final IntakeAgent intakeAgent;
    private final PlannerAgent plannerAgent;
    private final FollowerAgent followerAgent;
    private final FinalizerAgent finalizerAgent;
    private final int maxIterations;
    private final int historyWindow;
    private final int commitRetries;

    public TravelOrchestrator(SessionStateManager stateManager,
                              ConversationHistory conversationHistory,
                              PlanRecords planRecords,
                              TaskExecutor taskExecutor,
                              IntakeAgent intakeAgent,
                              PlannerAgent plannerAgent,
                              FollowerAgent followerAgent,
                              FinalizerAgent finalizerAgent,
                              TripSyncProperties properties) {
        this.stateManager = stateManager;
        this.conversationHistory = conversationHistory;
        this.planRecords = planRecords;
        this.taskExecutor = taskExecutor;
        this.intakeAgent = intakeAgent;
        this.plannerAgent = plannerAgent;
        this.followerAgent = followerAgent;
        this.finalizerAgent = finalizerAgent;
        this.maxIterations = properties.getOrchestrator().getMaxIterations();
        this.historyWindow = properties.getOrchestrator().getHistoryWindow();
        this.commitRetries = properties.getState().getCommitRetries();
    }

    /**
     * Handles one user message for a session and returns the reply.
     *
     * @throws OrchestrationException when a stage fails; commits of earlier stages are kept
     */
    public OrchestrationResult handle(String sessionId, String message) {
        MdcContext.setSession(sessionId);
        try (SessionContext context = stateManager.open(sessionId)) {
            return run(context, message);
        } finally {
            MdcContext.clear();
        }
    }

    private OrchestrationResult run(SessionContext context, String message) {
        String sessionId = context.sessionId();

        enter(sessionId, OrchestrationStage.INTAKE);
        List<ChatMessage> history = inStage(sessionId, OrchestrationStage.INTAKE,
                () -> conversationHistory.recent(sessionId, historyWindow));
        AgentProposal<IntakeDecision> intake = inStage(sessionId, OrchestrationStage.INTAKE,
                () -> intakeAgent.intake(context.view(), message, history));
        SessionState state = commit(context, OrchestrationStage.INTAKE, intake.diff());
        if (!intake.output().sufficientInfo()) {
            log.info("Session {} needs clarification before planning", sessionId);
            String reply = intake.output().clarificationReply();
            remember(sessionId, OrchestrationStage.INTAKE, message, reply);
            enter(sessionId, OrchestrationStage.DONE);
            return new OrchestrationResult(sessionId, reply, OrchestrationStage.DONE, true, List.of(), state);
        }

        enter(sessionId, OrchestrationStage.PLAN);
        AgentProposal<TaskPlan> plan = inStage(sessionId, OrchestrationStage.PLAN,
                () -> plannerAgent.plan(context.view(), message, intake.output()));
        state = commit(context, OrchestrationStage.PLAN, plan.diff());
        List<Task> batch = runnable(state, plan.diff());

        List<TaskIteration> iterations = new ArrayList<>();
        while (!batch.isEmpty()) {
            if (iterations.size() >= maxIterations) {
                log.info("Iteration limit {} reached for session {}, {} tasks left pending",
                        maxIterations, sessionId, batch.size());
                break;
            }
            int number = iterations.size() + 1;
            enter(sessionId, OrchestrationStage.EXECUTE);
            commit(context, OrchestrationStage.EXECUTE, markInProgress(batch));
            List<Task> submitted = batch;
            TaskIteration iteration = inStage(sessionId, OrchestrationStage.EXECUTE,
                    () -> taskExecutor.runIteration(number, submitted));
            iterations.add(iteration);
            commit(context, OrchestrationStage.EXECUTE, iteration.toDiff());

            enter(sessionId, OrchestrationStage.REFLECT);
            AgentProposal<Reflection> reflection = inStage(sessionId, OrchestrationStage.REFLECT,
                    () -> followerAgent.reflect(context.view(), message, iteration));
            state = commit(context, OrchestrationStage.REFLECT, reflection.diff());

            if (iteration.succeeded() == 0) {
                log.info("No task succeeded in iteration {} of session {}, stopping", number, sessionId);
                break;
            }
            batch = reflection.output().needsAdditionalTasks() ? runnable(state, reflection.diff()) : List.of();
        }

        enter(sessionId, OrchestrationStage.FINALIZE);
        AgentProposal<FinalSummary> summary = inStage(sessionId, OrchestrationStage.FINALIZE,
                () -> finalizerAgent.summarize(context.view(), message, iterations));
        state = commit(context, OrchestrationStage.FINALIZE, summary.diff());
        remember(sessionId, OrchestrationStage.FINALIZE, message, summary.output().reply());
        planRecords.record(sessionId, PlanRecord.of(message, intake.output().extractedInfo(), iterations));

        enter(sessionId, OrchestrationStage.DONE);
        log.info("Session {} finished after {} iteration(s)", sessionId, iterations.size());
        return new OrchestrationResult(sessionId, summary.output().reply(), OrchestrationStage.DONE, false,
                iterations, state);
    }

    /**
     * Tasks named by {@code diff} that are pending and carry a tool call, highest priority first.
     */
    List<Task> runnable(SessionState state, StateDiff diff) {
        Set<String> proposed = diff.taskPatches().stream().map(TaskPatch::taskId).collect(Collectors.toSet());
        return state.tasks().stream()
                .filter(task -> proposed.contains(task.taskId()))
                .filter(task -> task.status() == TaskStatus.PENDING)
                .filter(task -> ToolInvocation.fromTask(task).isPresent())
                .sorted(Comparator.comparingInt(TravelOrchestrator::priority).reversed())
                .toList();
    }

    private static int priority(Task task) {
        return task.metadataValue(META_PRIORITY) instanceof Number number ? number.intValue() : 0;
    }

    private static StateDiff markInProgress(List<Task> batch) {
        StateDiff.Builder diff = StateDiff.builder();
        batch.forEach(task -> diff.taskStatus(task.taskId(), TaskStatus.IN_PROGRESS));
        return diff.build();
    }

    private SessionState commit(SessionContext context, OrchestrationStage stage, StateDiff diff) {
        for (int attempt = 0; ; attempt++) {
            try {
                return context.commit(diff);
            } catch (CommitContentionException ex) {
                if (attempt >= commitRetries) {
                    log.warn("Giving up on commit for session {} at {} after {} attempts",
                            context.sessionId(), stage, attempt + 1);
                    throw new OrchestrationException(context.sessionId(), stage, ex);
                }
                log.info("Commit for session {} at {} contended, retrying ({}/{})",
                        context.sessionId(), stage, attempt + 1, commitRetries);
            } catch (RuntimeException ex) {
                log.warn("Commit for session {} at {} rejected: {}", context.sessionId(), stage, ex.getMessage());
                throw new OrchestrationException(context.sessionId(), stage, ex);
            }
        }
    }

    private void remember(String sessionId, OrchestrationStage stage, String message, String reply) {
        inStage(sessionId, stage, () -> {
            conversationHistory.append(sessionId, ChatMessage.human(message), ChatMessage.ai(reply));
            return null;
        });
    }

    private static <T> T inStage(String sessionId, OrchestrationStage stage, Supplier<T> step) {
        try {
            return step.get();
        } catch (OrchestrationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Stage {} of session {} failed: {}", stage, sessionId, ex.getMessage());
            throw new OrchestrationException(sessionId, stage, ex);
        }
    }

    private static void enter(String sessionId, OrchestrationStage stage) {
        MdcContext.setStage(sessionId, stage.name());
        log.info("Session {} entering {}", sessionId, stage);
    }
}
