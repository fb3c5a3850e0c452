package com.tripsync.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Reads JSON out of model answers and renders prompt context as JSON.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final int SNIPPET_LENGTH = 240;

    private final ObjectMapper objectMapper;

    /**
     * Binds the first complete JSON object found in {@code raw}. Prose or code fences around
     * the object are ignored.
     *
     * @return {@code null} when there is no object or it does not bind to {@code type}
     */
    public <T> @Nullable T parseJsonResponse(String purpose, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Model returned an empty {} answer", purpose);
            return null;
        }
        String candidate = firstObject(raw);
        if (candidate == null) {
            log.warn("No JSON object in {} answer: {}", purpose, snippet(raw));
            return null;
        }
        try {
            return objectMapper.readValue(candidate, type);
        } catch (JsonProcessingException ex) {
            log.warn("Could not bind {} answer to {}: {} | {}", purpose, type.getSimpleName(),
                    ex.getOriginalMessage(), snippet(raw));
            return null;
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Could not render {} as JSON for a prompt: {}", value.getClass().getSimpleName(), ex.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    /**
     * Text of the first balanced {@code {...}} block, skipping braces inside string literals.
     */
    private static @Nullable String firstObject(String raw) {
        int start = raw.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return raw.substring(start, i + 1);
            }
        }
        // unbalanced; let the parser report it
        return raw.substring(start);
    }

    private static String snippet(String raw) {
        String flat = raw.replace('\r', ' ').replace('\n', ' ').trim();
        return flat.length() <= SNIPPET_LENGTH ? flat : flat.substring(0, SNIPPET_LENGTH) + "...";
    }
}
