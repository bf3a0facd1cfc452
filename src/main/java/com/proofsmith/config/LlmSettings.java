package com.proofsmith.config;

import com.proofsmith.core.agent.AgentType;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Per-stage model selection and the output-length cap shared by every chat call.
 *
 * Planner and generator default to the stronger model; the verifier only explains
 * compiler errors and defaults to the cheaper one.
 */
@Component
public class LlmSettings {

    private final String plannerModel;
    private final String generatorModel;
    private final String verifierModel;
    private final int    maxTokens;

    public LlmSettings(
            @Value("${proofsmith.llm.planner-model:gpt-4o}") String plannerModel,
            @Value("${proofsmith.llm.generator-model:gpt-4o}") String generatorModel,
            @Value("${proofsmith.llm.verifier-model:gpt-3.5-turbo}") String verifierModel,
            @Value("${proofsmith.llm.max-tokens:2000}") int maxTokens
    ) {
        this.plannerModel   = plannerModel;
        this.generatorModel = generatorModel;
        this.verifierModel  = verifierModel;
        this.maxTokens      = maxTokens;
    }

    public String modelFor(AgentType role) {
        return switch (role) {
            case PLANNER   -> plannerModel;
            case GENERATOR -> generatorModel;
            case VERIFIER  -> verifierModel;
        };
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}
