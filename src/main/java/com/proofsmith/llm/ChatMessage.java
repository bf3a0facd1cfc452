package com.proofsmith.llm;

import java.util.Map;

/**
 * One role-tagged message of a chat request ("system", "user" or "assistant").
 */
public final class ChatMessage {

    public static final String SYSTEM = "system";
    public static final String USER   = "user";

    private final String role;
    private final String content;

    private ChatMessage(String role, String content) {
        this.role    = role;
        this.content = content != null ? content : "";
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public String getRole() { return role; }

    public String getContent() { return content; }

    /** Wire form shared by the OpenAI and Ollama chat endpoints. */
    public Map<String, Object> toWire() {
        return Map.of("role", role, "content", content);
    }
}
