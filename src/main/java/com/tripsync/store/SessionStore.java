package com.tripsync.store;

import java.util.Optional;

/**
 * Keyed persistence for per-session documents. Keys look like {@code state_{sessionId}},
 * {@code history_{sessionId}} or {@code plan_{sessionId}}; values are serialized JSON.
 * <p>
 * Implementations signal failures with {@link SessionStoreException}.
 */
public interface SessionStore {

    String STATE_PREFIX = "state_";
    String HISTORY_PREFIX = "history_";
    String PLAN_PREFIX = "plan_";

    Optional<String> get(String key);

    void set(String key, String value);

    void delete(String key);

    static String stateKey(String sessionId) {
        return STATE_PREFIX + sessionId;
    }

    static String historyKey(String sessionId) {
        return HISTORY_PREFIX + sessionId;
    }

    static String planKey(String sessionId) {
        return PLAN_PREFIX + sessionId;
    }
}
