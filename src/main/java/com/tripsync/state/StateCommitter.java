package com.tripsync.state;

import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;

/**
 * The only path that mutates canonical session state.
 */
public interface StateCommitter {

    /**
     * Merges {@code diff} into the session's state, persists the result and publishes it.
     * Commits on the same session are totally ordered; each sees every earlier one.
     *
     * @return the state after the commit
     * @throws DiffValidationException    when the diff is rejected, nothing is applied
     * @throws CommitContentionException  when the session lock is not obtained in time
     * @throws StatePersistenceException  when the new state cannot be stored, nothing is applied
     */
    SessionState commit(String sessionId, StateDiff diff);
}
