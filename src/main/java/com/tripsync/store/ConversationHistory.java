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
 * Chat history of a session, kept in the {@link SessionStore} under {@code history_{sessionId}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationHistory {

    private static final TypeReference<List<ChatMessage>> MESSAGE_LIST = new TypeReference<>() {
    };

    private final SessionStore store;
    private final ObjectMapper objectMapper;

    public List<ChatMessage> messages(String sessionId) {
        String raw = store.get(SessionStore.historyKey(sessionId)).orElse(null);
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<ChatMessage> stored = objectMapper.readValue(raw, MESSAGE_LIST);
            List<ChatMessage> known = new ArrayList<>(stored.size());
            for (ChatMessage message : stored) {
                if (ChatMessage.HUMAN.equals(message.type()) || ChatMessage.AI.equals(message.type())) {
                    known.add(message);
                }
            }
            return known;
        } catch (JsonProcessingException ex) {
            throw new SessionStoreException("Stored history of session " + sessionId + " is not valid JSON", ex);
        }
    }

    /**
     * Last {@code limit} messages, oldest first.
     */
    public List<ChatMessage> recent(String sessionId, int limit) {
        List<ChatMessage> all = messages(sessionId);
        if (limit <= 0) {
            return List.of();
        }
        return all.size() <= limit ? all : new ArrayList<>(all.subList(all.size() - limit, all.size()));
    }

    public synchronized void append(String sessionId, ChatMessage... messages) {
        List<ChatMessage> all = messages(sessionId);
        all.addAll(List.of(messages));
        try {
            store.set(SessionStore.historyKey(sessionId), objectMapper.writeValueAsString(all));
        } catch (JsonProcessingException ex) {
            throw new SessionStoreException("Failed to serialize history of session " + sessionId, ex);
        }
        log.debug("History of session {} now has {} messages", sessionId, all.size());
    }

    public void addUserMessage(String sessionId, String content) {
        append(sessionId, ChatMessage.human(content));
    }

    public void addAiMessage(String sessionId, String content) {
        append(sessionId, ChatMessage.ai(content));
    }

    public void clear(String sessionId) {
        store.delete(SessionStore.historyKey(sessionId));
    }
}
