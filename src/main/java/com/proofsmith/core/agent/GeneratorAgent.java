package com.proofsmith.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.config.LlmSettings;
import com.proofsmith.core.generator.GeneratedSolution;
import com.proofsmith.core.generator.GenerationRequest;
import com.proofsmith.core.state.AttemptRecord;
import com.proofsmith.llm.ChatMessage;
import com.proofsmith.llm.LLMClient;
import com.proofsmith.llm.LLMRequest;

import java.util.List;

@Component
public class GeneratorAgent implements StageAgent<GenerationRequest, GeneratedSolution> {

    private static final Logger log = LoggerFactory.getLogger(GeneratorAgent.class);

    private static final String SYSTEM_PROMPT = """
    You are an expert Lean 4 programmer. Your job is to generate working Lean 4 code and formal proofs.

    CRITICAL REQUIREMENTS:
    1. Generate ONLY the implementation that replaces {{code}} - NO comments, NO placeholders
    2. Generate ONLY the proof tactics that replace {{proof}} - NO 'sorry', NO placeholders
    3. For simple definitional equalities use 'rfl' or 'simp'
    4. For arithmetic and conditionals use 'omega', or 'simp [function_name]; split <;> omega'

    Return JSON with:
    - code: the implementation
    - proof: the proof tactics
    - explanation: brief explanation

    DO NOT USE: sorry, placeholder text, comments like "Implementation needed"
    Output ONLY valid JSON.
    """;

    private final LLMClient   llmClient;
    private final LlmSettings settings;

    public GeneratorAgent(LLMClient llmClient, LlmSettings settings) {
        this.llmClient = llmClient;
        this.settings  = settings;
    }

    @Override
    public String getAgentId() {
        return "generator-agent-1";
    }

    @Override
    public AgentType getAgentType() {
        return AgentType.GENERATOR;
    }

    @Override
    public StageResult<GeneratedSolution> process(GenerationRequest input) {

        log.info("[Generator] Generating candidate for attempt {}", input.getAttemptNumber());

        LLMRequest request = new LLMRequest(
                AgentType.GENERATOR,
                settings.modelFor(AgentType.GENERATOR),
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(buildUserPrompt(input))),
                llmClient.getTemperatureForRole(AgentType.GENERATOR),
                settings.getMaxTokens()
        );
        log.info("[LLM] Generator prompt length: {}", request.promptLength());

        String response;
        try {
            response = llmClient.complete(request);
        } catch (RuntimeException e) {
            log.error("[Generator] Generation call failed: {}", e.getMessage());
            return StageResult.failed("Generation failed: " + e.getMessage());
        }

        StageResult<GeneratedSolution> result = GeneratedSolution.parse(response, input.getDescription());
        if (result.getKind() == StageResult.Kind.FALLBACK) {
            log.warn("[Generator] Using canned solution: {}", result.getDetail());
        }
        return result;
    }

    private String buildUserPrompt(GenerationRequest input) {

        StringBuilder prompt = new StringBuilder();
        prompt.append("Task: ").append(input.getDescription()).append("\n\n");
        prompt.append("Template:\n").append(input.getTemplate()).append("\n\n");
        prompt.append("Plan:\n").append(input.getPlanText()).append("\n");

        if (!input.getRetrievalContext().isBlank()) {
            prompt.append("\nRelevant Lean 4 documentation and examples:\n")
                  .append(input.getRetrievalContext()).append("\n");
        }

        if (!input.getPreviousAttempts().isEmpty()) {
            prompt.append("\nPrevious attempts (avoid these errors):\n");
            for (AttemptRecord attempt : input.getPreviousAttempts()) {
                prompt.append(attempt.toPromptSection());
            }
        }

        prompt.append("\nReturn JSON with code, proof and explanation.");
        return prompt.toString();
    }
}
