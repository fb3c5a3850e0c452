package com.tripsync.state;

import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one session for the lifetime of a request. While any context of a session is
 * open its state stays resident; closing the last one releases it.
 * <p>
 * Only the owner of the context may commit. Agents get {@link #view()}, which cannot.
 */
public final class SessionContext implements AutoCloseable {

    private final SessionStateManager manager;
    private final String sessionId;
    private final StateView view;
    private final AtomicBoolean closed = new AtomicBoolean();

    SessionContext(SessionStateManager manager, String sessionId) {
        this.manager = manager;
        this.sessionId = sessionId;
        this.view = manager.viewOf(sessionId);
    }

    public String sessionId() {
        return sessionId;
    }

    public StateView view() {
        return view;
    }

    public SessionState state() {
        ensureOpen();
        return manager.getState(sessionId);
    }

    public SessionState commit(StateDiff diff) {
        ensureOpen();
        return manager.commit(sessionId, diff);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            manager.release(sessionId);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Session context " + sessionId + " is closed");
        }
    }
}
