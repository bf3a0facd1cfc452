package com.proofsmith.llm;

import com.proofsmith.core.agent.AgentType;

import java.util.List;

/**
 * LLMRequest - everything a provider needs for one chat completion.
 *
 * The role is carried for logging and for the offline mock client; real providers
 * only look at model, messages, temperature and maxTokens.
 */
public final class LLMRequest {

    private final AgentType         role;
    private final String            model;
    private final List<ChatMessage> messages;
    private final double            temperature;
    private final int               maxTokens;

    public LLMRequest(AgentType role, String model, List<ChatMessage> messages,
                      double temperature, int maxTokens) {
        this.role        = role;
        this.model       = model;
        this.messages    = messages != null ? List.copyOf(messages) : List.of();
        this.temperature = temperature;
        this.maxTokens   = maxTokens;
    }

    public AgentType getRole() { return role; }

    public String getModel() { return model; }

    public List<ChatMessage> getMessages() { return messages; }

    public double getTemperature() { return temperature; }

    public int getMaxTokens() { return maxTokens; }

    public int promptLength() {
        return messages.stream().mapToInt(m -> m.getContent().length()).sum();
    }
}
