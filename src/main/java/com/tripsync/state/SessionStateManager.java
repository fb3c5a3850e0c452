package com.tripsync.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.config.TripSyncProperties;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskPatch;
import com.tripsync.state.model.TaskStatus;
import com.tripsync.store.ConversationHistory;
import com.tripsync.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owner of canonical per-session state and its only writer.
 * <p>
 * Every mutation of a session runs under that session's lock: merge on a copy, persist,
 * then publish. The published state is only replaced after the store accepted the new
 * value, so a failed write leaves the session exactly as it was. Sessions never share a lock.
 * <p>
 * A session stays resident while it is pinned by an open {@link SessionContext} or an
 * operation in flight, and is dropped from memory when the last pin goes away.
 */
@Service
@Slf4j
public class SessionStateManager implements StateCommitter {

    private final SessionStore store;
    private final ConversationHistory history;
    private final MergeEngine mergeEngine;
    private final StateTemplate template;
    private final ObjectMapper objectMapper;
    private final Duration lockTimeout;
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong taskSequence = new AtomicLong();

    public SessionStateManager(SessionStore store,
                               ConversationHistory history,
                               MergeEngine mergeEngine,
                               StateTemplate template,
                               ObjectMapper objectMapper,
                               TripSyncProperties properties) {
        this.store = store;
        this.history = history;
        this.mergeEngine = mergeEngine;
        this.template = template;
        this.objectMapper = objectMapper;
        this.lockTimeout = properties.getState().getLockTimeout();
    }

    /**
     * Opens a handle on a session for the duration of one request. Close it when done.
     */
    public SessionContext open(String sessionId) {
        requireSessionId(sessionId);
        pin(sessionId);
        try {
            return new SessionContext(this, sessionId);
        } catch (RuntimeException ex) {
            release(sessionId);
            throw ex;
        }
    }

    /**
     * Read-only view of a session for agents.
     */
    public StateView viewOf(String sessionId) {
        requireSessionId(sessionId);
        return new SessionView(sessionId);
    }

    public SessionState load(String sessionId) {
        return getState(sessionId);
    }

    /**
     * Current state of a session. The returned value is immutable and never changes afterwards.
     */
    public SessionState getState(String sessionId) {
        requireSessionId(sessionId);
        Slot slot = pin(sessionId);
        try {
            return loaded(sessionId, slot);
        } finally {
            release(sessionId);
        }
    }

    /**
     * True when the store holds a committed state for this session.
     */
    public boolean exists(String sessionId) {
        requireSessionId(sessionId);
        try {
            return store.get(SessionStore.stateKey(sessionId)).isPresent();
        } catch (RuntimeException ex) {
            throw new StatePersistenceException(sessionId, "Failed to look up session " + sessionId, ex);
        }
    }

    @Override
    public SessionState commit(String sessionId, StateDiff diff) {
        requireSessionId(sessionId);
        StateDiff effective = diff == null ? StateDiff.empty() : diff;
        mergeEngine.validate(effective);
        return commitAgainst(sessionId, current -> effective);
    }

    /**
     * Adds a task, filling in {@code task_id}, {@code timestamp} and {@code status} when absent.
     * The duplicate check and the commit happen under the session lock.
     *
     * @return false when a task with the same id already exists; nothing is committed then
     */
    public boolean addTask(String sessionId, Task task) {
        requireSessionId(sessionId);
        ObjectNode fields = objectMapper.valueToTree(task);
        if (!StringUtils.hasText(fields.path(Task.FIELD_TASK_ID).asText(null))) {
            fields.put(Task.FIELD_TASK_ID, "task_" + System.currentTimeMillis() + "_" + taskSequence.incrementAndGet());
        }
        if (!fields.hasNonNull("timestamp")) {
            fields.put("timestamp", Instant.now().toString());
        }
        if (!fields.hasNonNull(Task.FIELD_STATUS)) {
            fields.put(Task.FIELD_STATUS, TaskStatus.PENDING.wireName());
        }
        String taskId = fields.get(Task.FIELD_TASK_ID).asText();
        StateDiff diff = StateDiff.builder().task(new TaskPatch(taskId, fields)).build();
        mergeEngine.validate(diff);
        SessionState committed = commitAgainst(sessionId,
                current -> current.task(taskId).isPresent() ? null : diff);
        if (committed == null) {
            log.debug("Task {} already exists in session {}", taskId, sessionId);
            return false;
        }
        return true;
    }

    public SessionState updateTravelInfo(String sessionId, JsonNode updates) {
        return commit(sessionId, StateDiff.builder()
                .nested(StateDiff.TRAVEL_INFO_FIELD, StateDiff.fromJson(updates))
                .build());
    }

    public SessionState updateUserProfile(String sessionId, JsonNode updates) {
        return commit(sessionId, StateDiff.builder()
                .nested(StateDiff.USER_PROFILE_FIELD, StateDiff.fromJson(updates))
                .build());
    }

    /**
     * Removes the persisted state, conversation history and plan records of a session. The next access
     * starts again from the template.
     */
    public void clear(String sessionId) {
        requireSessionId(sessionId);
        Slot slot = pin(sessionId);
        try {
            lock(sessionId, slot);
            try {
                store.delete(SessionStore.stateKey(sessionId));
                history.clear(sessionId);
                store.delete(SessionStore.planKey(sessionId));
                slot.state = null;
                log.info("Cleared session {}", sessionId);
            } catch (RuntimeException ex) {
                throw new StatePersistenceException(sessionId, "Failed to clear session " + sessionId, ex);
            } finally {
                slot.lock.unlock();
            }
        } finally {
            release(sessionId);
        }
    }

    int residentSessions() {
        return slots.size();
    }

    void release(String sessionId) {
        slots.computeIfPresent(sessionId, (id, slot) -> {
            slot.refs--;
            if (slot.refs > 0) {
                return slot;
            }
            log.debug("Evicting session {} from memory", id);
            return null;
        });
    }

    private Slot pin(String sessionId) {
        return slots.compute(sessionId, (id, slot) -> {
            Slot pinned = slot != null ? slot : new Slot();
            pinned.refs++;
            return pinned;
        });
    }

    private SessionState loaded(String sessionId, Slot slot) {
        SessionState state = slot.state;
        if (state != null) {
            return state;
        }
        lock(sessionId, slot);
        try {
            if (slot.state == null) {
                slot.state = read(sessionId);
            }
            return slot.state;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Merges the diff chosen for the current state, persists and publishes it, all under the
     * session lock.
     *
     * @return the new state, or {@code null} when {@code diffFor} returned {@code null}
     */
    private SessionState commitAgainst(String sessionId, Function<SessionState, StateDiff> diffFor) {
        Slot slot = pin(sessionId);
        try {
            lock(sessionId, slot);
            try {
                SessionState current = slot.state != null ? slot.state : read(sessionId);
                StateDiff diff = diffFor.apply(current);
                if (diff == null) {
                    slot.state = current;
                    return null;
                }
                SessionState next = mergeEngine.merge(current, diff);
                persist(sessionId, next);
                slot.state = next;
                log.info("Committed diff to session {} ({} fields, {} tasks)",
                        sessionId, diff.fields().size(), next.taskCount());
                log.debug("Committed diff for session {}: {}", sessionId, diff);
                return next;
            } finally {
                slot.lock.unlock();
            }
        } finally {
            release(sessionId);
        }
    }

    private SessionState read(String sessionId) {
        Optional<String> stored;
        try {
            stored = store.get(SessionStore.stateKey(sessionId));
        } catch (RuntimeException ex) {
            throw new StatePersistenceException(sessionId, "Failed to load state of session " + sessionId, ex);
        }
        if (stored.isEmpty()) {
            log.debug("No stored state for session {}, starting from template v{}", sessionId, template.version());
            return template.initialState();
        }
        try {
            JsonNode tree = objectMapper.readTree(stored.get());
            if (!tree.isObject()) {
                throw new StatePersistenceException(sessionId,
                        "Stored state of session " + sessionId + " is not a JSON object", null);
            }
            return SessionState.of((ObjectNode) tree);
        } catch (JsonProcessingException ex) {
            throw new StatePersistenceException(sessionId, "Stored state of session " + sessionId + " is not valid JSON", ex);
        }
    }

    private void persist(String sessionId, SessionState state) {
        try {
            store.set(SessionStore.stateKey(sessionId), objectMapper.writeValueAsString(state.toJson()));
        } catch (JsonProcessingException ex) {
            throw new StatePersistenceException(sessionId, "Failed to serialize state of session " + sessionId, ex);
        } catch (RuntimeException ex) {
            log.error("Failed to persist state of session {}, commit discarded", sessionId, ex);
            throw new StatePersistenceException(sessionId, "Failed to persist state of session " + sessionId, ex);
        }
    }

    private void lock(String sessionId, Slot slot) {
        try {
            if (!slot.lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {}ms waiting for lock of session {}", lockTimeout.toMillis(), sessionId);
                throw new CommitContentionException(sessionId, lockTimeout);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CommitContentionException(sessionId, ex);
        }
    }

    private static void requireSessionId(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("Session id is required");
        }
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile SessionState state;
        // guarded by the slots map's compute functions
        private int refs;
    }

    private final class SessionView implements StateView {

        private final String sessionId;

        private SessionView(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public SessionState getState() {
            return SessionStateManager.this.getState(sessionId);
        }

        @Override
        public StateDiff proposeDiff(JsonNode candidateUpdates) {
            StateDiff diff = StateDiff.fromJson(candidateUpdates);
            mergeEngine.validate(diff);
            // dry run against the current snapshot so status regressions surface before commit
            mergeEngine.merge(getState(), diff);
            return diff;
        }
    }
}
