package com.proofsmith.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.config.LlmSettings;
import com.proofsmith.core.verifier.RepairAdvice;
import com.proofsmith.core.verifier.VerificationRequest;
import com.proofsmith.llm.ChatMessage;
import com.proofsmith.llm.LLMClient;
import com.proofsmith.llm.LLMRequest;

import java.util.List;

/**
 * Explains a compiler error and, when it can, proposes a corrected implementation
 * and/or proof. Empty error text short-circuits to PASSED without a model call.
 */
@Component
public class VerifierAgent implements StageAgent<VerificationRequest, RepairAdvice> {

    private static final Logger log = LoggerFactory.getLogger(VerifierAgent.class);

    private static final String SYSTEM_PROMPT = """
    You are a Lean 4 debugging expert. Analyze compilation errors and suggest fixes.

    Your tasks:
    1. Identify the root cause of errors
    2. Suggest specific corrections
    3. Provide corrected code/proof if possible
    4. Explain the fix

    Return JSON with:
    - error_analysis: Description of the problem
    - suggested_fixes: List of specific corrections
    - corrected_code: Fixed implementation (if applicable)
    - corrected_proof: Fixed proof tactics (if applicable)
    - confidence: Your confidence in the fix (0-1)

    Output ONLY valid JSON.
    """;

    private final LLMClient   llmClient;
    private final LlmSettings settings;

    public VerifierAgent(LLMClient llmClient, LlmSettings settings) {
        this.llmClient = llmClient;
        this.settings  = settings;
    }

    @Override
    public String getAgentId() {
        return "verifier-agent-1";
    }

    @Override
    public AgentType getAgentType() {
        return AgentType.VERIFIER;
    }

    @Override
    public StageResult<RepairAdvice> process(VerificationRequest input) {

        if (!input.hasError()) {
            log.info("[Verifier] No error output; nothing to repair");
            return StageResult.parsed(RepairAdvice.passed(), "");
        }

        log.info("[Verifier] Analyzing {} failure", input.getFailureKind().wireName());

        LLMRequest request = new LLMRequest(
                AgentType.VERIFIER,
                settings.modelFor(AgentType.VERIFIER),
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(buildUserPrompt(input))),
                llmClient.getTemperatureForRole(AgentType.VERIFIER),
                settings.getMaxTokens()
        );

        String response;
        try {
            response = llmClient.complete(request);
        } catch (RuntimeException e) {
            log.error("[Verifier] Verification call failed: {}", e.getMessage());
            return StageResult.failed("Verification failed: " + e.getMessage());
        }

        return RepairAdvice.parse(response);
    }

    private String buildUserPrompt(VerificationRequest input) {
        String context = input.getRetrievalContext().isBlank()
                ? ""
                : "\nRelevant documentation:\n" + input.getRetrievalContext() + "\n";

        return """
        Failing check: %s

        Code:
        %s

        Proof:
        %s

        Error Output:
        %s
        %s
        Please analyze these errors and suggest fixes.
        """.formatted(
                input.getFailureKind().wireName(),
                input.getCode(),
                input.getProof(),
                input.getErrorOutput(),
                context
        );
    }
}
