package com.tripsync.store;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One turn of a session conversation, stored as {@code {"type": "human"|"ai", "content": ...}}.
 */
public record ChatMessage(String type, String content) {

    public static final String HUMAN = "human";
    public static final String AI = "ai";

    public static ChatMessage human(String content) {
        return new ChatMessage(HUMAN, content);
    }

    public static ChatMessage ai(String content) {
        return new ChatMessage(AI, content);
    }

    @JsonIgnore
    public boolean isHuman() {
        return HUMAN.equals(type);
    }
}
