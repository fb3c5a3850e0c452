package com.tripsync.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.config.TripSyncProperties;
import com.tripsync.state.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Initial state of a new session, read once from a versioned document of the form
 * {@code {"version": 1, "state": {...}}}.
 */
@Component
@Slf4j
public class StateTemplate {

    public static final int SUPPORTED_VERSION = 1;

    private final int version;
    private final SessionState initialState;

    public StateTemplate(ResourceLoader resourceLoader, ObjectMapper objectMapper, TripSyncProperties properties) {
        String location = properties.getState().getTemplate();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            JsonNode document = objectMapper.readTree(in);
            this.version = document.path("version").asInt(-1);
            if (version != SUPPORTED_VERSION) {
                throw new IllegalStateException("State template " + location + " has unsupported version " + version);
            }
            JsonNode state = document.get("state");
            if (state == null || !state.isObject()) {
                throw new IllegalStateException("State template " + location + " has no 'state' object");
            }
            this.initialState = SessionState.of((ObjectNode) state);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read state template " + location, ex);
        }
        log.info("Loaded state template {} (version {})", location, version);
    }

    public int version() {
        return version;
    }

    /**
     * State of a session that has never been committed. Immutable, so it can be shared.
     */
    public SessionState initialState() {
        return initialState;
    }
}
