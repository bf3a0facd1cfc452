package com.proofsmith.core.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.proofsmith.core.agent.LlmJson;
import com.proofsmith.core.agent.StageResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * ProofPlan - immutable value object produced by PlannerAgent.
 *
 * JSON SCHEMA (what the model must return):
 * {
 *   "strategy":             "High-level approach",
 *   "implementation_steps": [ "..." ],
 *   "proof_approach":       "Strategy for proving correctness",
 *   "lean_concepts":        [ "..." ],
 *   "potential_challenges": [ "..." ]
 * }
 *
 * Only {@code strategy} is required. A response that is not a JSON object becomes a
 * FALLBACK plan whose strategy is the raw text.
 */
public final class ProofPlan {

    private static final Logger log = LoggerFactory.getLogger(ProofPlan.class);

    private final String       strategy;
    private final List<String> implementationSteps;
    private final String       proofApproach;
    private final List<String> leanConcepts;
    private final List<String> potentialChallenges;
    private final String       planText;

    private ProofPlan(String strategy, List<String> implementationSteps, String proofApproach,
                      List<String> leanConcepts, List<String> potentialChallenges, String planText) {
        this.strategy            = strategy != null ? strategy : "";
        this.implementationSteps = implementationSteps != null ? List.copyOf(implementationSteps) : List.of();
        this.proofApproach       = proofApproach != null ? proofApproach : "";
        this.leanConcepts        = leanConcepts != null ? List.copyOf(leanConcepts) : List.of();
        this.potentialChallenges = potentialChallenges != null ? List.copyOf(potentialChallenges) : List.of();
        this.planText            = planText != null ? planText : "";
    }

    /**
     * Parse from raw model text. Never throws.
     */
    public static StageResult<ProofPlan> parse(String response) {
        String raw = response != null ? response : "";
        try {
            JsonNode root = LlmJson.readObject(raw);

            String strategy = LlmJson.text(root, "strategy");
            if (strategy == null) {
                log.warn("[ProofPlan] JSON parsed but no strategy field - wrapping raw text");
                return StageResult.fallback(rawText(raw), "missing strategy", raw);
            }

            ProofPlan plan = new ProofPlan(
                    strategy,
                    LlmJson.textList(root, "implementation_steps"),
                    LlmJson.text(root, "proof_approach"),
                    LlmJson.textList(root, "lean_concepts"),
                    LlmJson.textList(root, "potential_challenges"),
                    raw
            );
            log.info("[ProofPlan] Parsed plan with {} implementation step(s)", plan.implementationSteps.size());
            return StageResult.parsed(plan, raw);

        } catch (Exception e) {
            log.warn("[ProofPlan] JSON parse failed: {} - wrapping raw text", e.getMessage());
            return StageResult.fallback(rawText(raw), "unparseable plan: " + e.getMessage(), raw);
        }
    }

    /** Plan whose whole content is the unstructured model text. */
    public static ProofPlan rawText(String text) {
        return new ProofPlan(text, List.of(), "", List.of(), List.of(), text);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getStrategy() { return strategy; }

    public List<String> getImplementationSteps() { return implementationSteps; }

    public String getProofApproach() { return proofApproach; }

    public List<String> getLeanConcepts() { return leanConcepts; }

    public List<String> getPotentialChallenges() { return potentialChallenges; }

    /** Raw model response; injected verbatim into the generation prompt. */
    public String getPlanText() { return planText; }
}
