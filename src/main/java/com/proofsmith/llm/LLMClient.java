package com.proofsmith.llm;

import com.proofsmith.core.agent.AgentType;

/**
 * LLMClient - single interface for all chat-completion calls in ProofSmith.
 *
 * Implementations own their transport (HTTP client, retry budget) and return the raw
 * response text. Parsing into stage schemas is the agents' job, not the client's.
 *
 * Failures surface as {@link LLMTransportException} once the retry budget is spent.
 */
public interface LLMClient {

    /**
     * @param request model, role-tagged messages, temperature and output cap
     * @return Raw response text. Never null; empty string on empty model output.
     */
    String complete(LLMRequest request);

    /**
     * Canonical per-stage sampling temperatures.
     *
     * PLANNER   0.3 - structured plan, some latitude in strategy
     * GENERATOR 0.1 - code and tactics; near-deterministic
     * VERIFIER  0.2 - error analysis
     */
    default double getTemperatureForRole(AgentType role) {
        return switch (role) {
            case PLANNER   -> 0.3;
            case GENERATOR -> 0.1;
            case VERIFIER  -> 0.2;
        };
    }
}
