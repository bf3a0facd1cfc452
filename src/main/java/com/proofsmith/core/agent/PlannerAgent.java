package com.proofsmith.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.config.LlmSettings;
import com.proofsmith.core.planner.PlanRequest;
import com.proofsmith.core.planner.ProofPlan;
import com.proofsmith.core.state.AttemptRecord;
import com.proofsmith.llm.ChatMessage;
import com.proofsmith.llm.LLMClient;
import com.proofsmith.llm.LLMRequest;

import java.util.List;

@Component
public class PlannerAgent implements StageAgent<PlanRequest, ProofPlan> {

    private static final Logger log = LoggerFactory.getLogger(PlannerAgent.class);

    private static final String SYSTEM_PROMPT = """
    You are a Lean 4 theorem proving expert and planning agent.
    Your job is to analyze programming tasks and create detailed implementation plans.

    You should:
    1. Break down the problem into logical steps
    2. Identify key Lean 4 concepts and tactics needed
    3. Suggest an implementation approach
    4. Anticipate potential proof challenges
    5. Recommend relevant Lean 4 libraries or theorems

    Return your response as JSON with these fields:
    - strategy: High-level approach
    - implementation_steps: List of specific coding steps
    - proof_approach: Strategy for proving correctness
    - lean_concepts: Relevant Lean 4 concepts to use
    - potential_challenges: Anticipated difficulties

    Output ONLY valid JSON.
    """;

    private final LLMClient   llmClient;
    private final LlmSettings settings;

    public PlannerAgent(LLMClient llmClient, LlmSettings settings) {
        this.llmClient = llmClient;
        this.settings  = settings;
    }

    @Override
    public String getAgentId() {
        return "planner-agent-1";
    }

    @Override
    public AgentType getAgentType() {
        return AgentType.PLANNER;
    }

    @Override
    public StageResult<ProofPlan> process(PlanRequest input) {

        log.info("[Planner] Planning (history={} attempt(s), {} error signature(s))",
                input.getPreviousAttempts().size(), input.getErrorSignatures().size());

        LLMRequest request = new LLMRequest(
                AgentType.PLANNER,
                settings.modelFor(AgentType.PLANNER),
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(buildUserPrompt(input))),
                llmClient.getTemperatureForRole(AgentType.PLANNER),
                settings.getMaxTokens()
        );
        log.info("[LLM] Planner prompt length: {}", request.promptLength());

        String response;
        try {
            response = llmClient.complete(request);
        } catch (RuntimeException e) {
            log.error("[Planner] Planning call failed: {}", e.getMessage());
            return StageResult.failed("Planning failed: " + e.getMessage());
        }

        return ProofPlan.parse(response);
    }

    private String buildUserPrompt(PlanRequest input) {

        StringBuilder prompt = new StringBuilder();
        prompt.append("Task Description: ").append(input.getDescription()).append("\n\n");
        prompt.append("Task Template:\n").append(input.getTemplate()).append("\n");

        if (!input.getPreviousAttempts().isEmpty()) {
            prompt.append("\nPrevious failed attempts:\n");
            for (AttemptRecord attempt : input.getPreviousAttempts()) {
                prompt.append(attempt.toPromptSection());
            }
        }

        if (!input.getErrorSignatures().isEmpty()) {
            prompt.append("\nRecurring error patterns (plan around these):\n");
            for (String signature : input.getErrorSignatures()) {
                prompt.append("- ").append(signature).append("\n");
            }
        }

        if (!input.getRetrievalContext().isBlank()) {
            prompt.append("\nRelevant Lean 4 documentation:\n")
                  .append(input.getRetrievalContext()).append("\n");
        }

        prompt.append("\nPlease create a detailed implementation plan for this Lean 4 theorem proving task.");
        return prompt.toString();
    }
}
