package com.tripsync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-session log of {@link PlanRecord}s under {@code plan_{sessionId}}, oldest first.
 * <p>
 * Recording is best effort: a request that already produced its reply is not failed
 * because its record could not be stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanRecords {

    private static final TypeReference<List<PlanRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final SessionStore store;
    private final ObjectMapper objectMapper;

    public List<PlanRecord> records(String sessionId) {
        String raw = store.get(SessionStore.planKey(sessionId)).orElse(null);
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(raw, RECORD_LIST));
        } catch (JsonProcessingException ex) {
            throw new SessionStoreException("Stored plan records of session " + sessionId + " are not valid JSON", ex);
        }
    }

    public synchronized void record(String sessionId, PlanRecord record) {
        try {
            List<PlanRecord> all = records(sessionId);
            all.add(record);
            store.set(SessionStore.planKey(sessionId), objectMapper.writeValueAsString(all));
            log.debug("Recorded plan {} of session {} ({} iterations, {} tool calls)",
                    all.size(), sessionId, record.totalIterations(), record.totalToolCalls());
        } catch (JsonProcessingException | RuntimeException ex) {
            log.warn("Failed to record plan of session {}: {}", sessionId, ex.getMessage());
        }
    }
}
