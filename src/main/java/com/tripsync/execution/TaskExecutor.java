package com.tripsync.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.tripsync.config.TripSyncProperties;
import com.tripsync.logging.MdcContext;
import com.tripsync.state.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tool calls of a batch of tasks on the shared worker pool.
 * <p>
 * Each task gets its own timeout, started when a worker picks it up, and the batch as a
 * whole has an independent timeout. Whatever happens to a task (exception, tool error,
 * timeout, missing tool) is reported as a failed {@link TaskResult}; siblings are unaffected
 * and {@link #run} never throws because of a tool.
 */
@Service
@Slf4j
public class TaskExecutor {

    private final ToolGateway toolGateway;
    private final ExecutorService toolExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final ObjectMapper objectMapper;
    private final Duration taskTimeout;
    private final Duration batchTimeout;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public TaskExecutor(ToolGateway toolGateway,
                        @Qualifier("toolExecutor") ExecutorService toolExecutor,
                        @Qualifier("toolTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                        ObjectMapper objectMapper,
                        TripSyncProperties properties) {
        this.toolGateway = toolGateway;
        this.toolExecutor = toolExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.objectMapper = objectMapper;
        TripSyncProperties.ExecutorConfig config = properties.getExecutor();
        this.taskTimeout = config.getTaskTimeout();
        this.batchTimeout = config.getBatchTimeout();
        this.maxAttempts = Math.max(1, config.getMaxAttempts());
        this.retryBackoff = config.getRetryBackoff();
    }

    public TaskIteration runIteration(int iteration, List<Task> tasks) {
        Instant started = Instant.now();
        List<TaskResult> results = run(tasks);
        long elapsed = Duration.between(started, Instant.now()).toMillis();
        TaskIteration taskIteration = new TaskIteration(iteration, started.toString(), tasks, results, elapsed);
        log.info("Executed {}", taskIteration.summary());
        return taskIteration;
    }

    /**
     * Runs every task and returns one result per task, in the order given.
     */
    public List<TaskResult> run(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }
        List<TaskRun> runs = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            TaskRun run = new TaskRun(task);
            runs.add(run);
            run.worker = toolExecutor.submit(MdcContext.wrap(() -> execute(run)));
        }

        CompletableFuture<?>[] outcomes = runs.stream().map(run -> run.outcome).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(outcomes).get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            int abandoned = abandonPending(runs, "Batch timed out after " + batchTimeout.toMillis() + "ms");
            log.warn("Batch of {} tasks timed out after {}ms, {} tasks marked failed",
                    runs.size(), batchTimeout.toMillis(), abandoned);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandonPending(runs, "Interrupted while waiting for batch");
        } catch (ExecutionException ex) {
            // outcomes are only ever completed normally
            throw new IllegalStateException("Unexpected task failure", ex.getCause());
        }

        List<TaskResult> results = new ArrayList<>(runs.size());
        for (TaskRun run : runs) {
            results.add(run.outcome.join());
        }
        return results;
    }

    private void execute(TaskRun run) {
        if (run.outcome.isDone()) {
            return;
        }
        String taskId = run.task.taskId();
        MdcContext.setTask(taskId);
        run.startedNanos = System.nanoTime();
        ScheduledFuture<?> timer = timeoutScheduler.schedule(() -> timeOut(run),
                taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            run.outcome.complete(invoke(run));
        } catch (RuntimeException ex) {
            run.outcome.complete(TaskResult.failure(taskId, describe(ex), run.elapsedMillis(), run.attempts.get()));
        } catch (Error err) {
            // errors are not retried; the task fails with the error named
            log.warn("Task {} failed with {}", taskId, err.toString());
            run.outcome.complete(TaskResult.failure(taskId, err.getClass().getSimpleName() + ": " + describe(err),
                    run.elapsedMillis(), run.attempts.get()));
            if (err instanceof VirtualMachineError) {
                throw err;
            }
        } finally {
            timer.cancel(false);
            MdcContext.clearTask();
        }
    }

    private TaskResult invoke(TaskRun run) {
        String taskId = run.task.taskId();
        Optional<ToolInvocation> invocation = ToolInvocation.fromTask(run.task);
        if (invocation.isEmpty()) {
            log.warn("Task {} has no tool to run", taskId);
            return TaskResult.failure(taskId, "Task has no tool name in metadata", run.elapsedMillis(), 0);
        }
        String toolName = invocation.get().toolName();
        String arguments = invocation.get().argumentsJson();
        for (int attempt = 1; ; attempt++) {
            run.attempts.set(attempt);
            try {
                log.debug("Calling tool {} for task {} (attempt {}) with {}", toolName, taskId, attempt, arguments);
                String raw = toolGateway.executeToolByName(toolName, arguments);
                log.debug("Tool {} for task {} returned after {}ms", toolName, taskId, run.elapsedMillis());
                return TaskResult.success(taskId, parse(raw), run.elapsedMillis(), attempt);
            } catch (RuntimeException ex) {
                boolean retryable = !(ex instanceof ToolExecutionException toolEx) || toolEx.isRetryable();
                if (!retryable || attempt >= maxAttempts) {
                    log.warn("Tool {} failed for task {} after {} attempt(s): {}", toolName, taskId, attempt, describe(ex));
                    return TaskResult.failure(taskId, describe(ex), run.elapsedMillis(), attempt);
                }
                log.debug("Tool {} failed for task {} on attempt {}, retrying: {}", toolName, taskId, attempt, describe(ex));
            }
            try {
                Thread.sleep(retryBackoff.toMillis() * attempt);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return TaskResult.failure(taskId, "Interrupted before retry", run.elapsedMillis(), attempt);
            }
        }
    }

    private void timeOut(TaskRun run) {
        String error = "Task timed out after " + taskTimeout.toMillis() + "ms";
        if (run.outcome.complete(TaskResult.failure(run.task.taskId(), error, run.elapsedMillis(), run.attempts.get()))) {
            log.warn("Task {} timed out after {}ms", run.task.taskId(), taskTimeout.toMillis());
            Future<?> worker = run.worker;
            if (worker != null) {
                worker.cancel(true);
            }
        }
    }

    private int abandonPending(List<TaskRun> runs, String reason) {
        int abandoned = 0;
        for (TaskRun run : runs) {
            if (run.outcome.complete(TaskResult.failure(run.task.taskId(), reason, run.elapsedMillis(), run.attempts.get()))) {
                abandoned++;
                Future<?> worker = run.worker;
                if (worker != null) {
                    worker.cancel(true);
                }
            }
        }
        return abandoned;
    }

    private JsonNode parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return JsonNodeFactory.instance.nullNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            return JsonNodeFactory.instance.textNode(raw);
        }
    }

    private static String describe(Throwable ex) {
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }

    private static final class TaskRun {
        private final Task task;
        private final CompletableFuture<TaskResult> outcome = new CompletableFuture<>();
        private final AtomicInteger attempts = new AtomicInteger();
        private volatile Future<?> worker;
        private volatile long startedNanos;

        private TaskRun(Task task) {
            this.task = task;
        }

        private long elapsedMillis() {
            long started = startedNanos;
            return started == 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        }
    }
}
