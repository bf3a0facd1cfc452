package com.proofsmith.core.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.proofsmith.core.agent.LlmJson;
import com.proofsmith.core.agent.StageResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GeneratedSolution - implementation and proof for the two template slots.
 *
 * JSON SCHEMA:
 * {
 *   "code":        "a + b",
 *   "proof":       "rfl",
 *   "explanation": "optional"
 * }
 *
 * {@code code} and {@code proof} are required. When either is missing, or the text is
 * not JSON, {@link CannedSolutions} supplies the pair and the result is a FALLBACK.
 */
public final class GeneratedSolution {

    private static final Logger log = LoggerFactory.getLogger(GeneratedSolution.class);

    private final String code;
    private final String proof;
    private final String explanation;

    private GeneratedSolution(String code, String proof, String explanation) {
        this.code        = code != null ? code : "";
        this.proof       = proof != null ? proof : "";
        this.explanation = explanation != null ? explanation : "";
    }

    public static GeneratedSolution of(String code, String proof, String explanation) {
        return new GeneratedSolution(code, proof, explanation);
    }

    /**
     * Parse from raw model text; the description selects the canned pair on failure.
     * Never throws.
     */
    public static StageResult<GeneratedSolution> parse(String response, String description) {
        String raw = response != null ? response : "";
        try {
            JsonNode root = LlmJson.readObject(raw);

            String code  = LlmJson.text(root, "code");
            String proof = LlmJson.text(root, "proof");

            if (code == null || proof == null) {
                log.warn("[GeneratedSolution] Missing {} - using canned solution",
                        code == null ? "code" : "proof");
                return StageResult.fallback(CannedSolutions.forDescription(description),
                        "missing required fields", raw);
            }

            return StageResult.parsed(
                    new GeneratedSolution(code.strip(), proof.strip(), LlmJson.text(root, "explanation")),
                    raw);

        } catch (Exception e) {
            log.warn("[GeneratedSolution] JSON parse failed: {} - using canned solution", e.getMessage());
            return StageResult.fallback(CannedSolutions.forDescription(description),
                    "unparseable solution: " + e.getMessage(), raw);
        }
    }

    public String getCode() { return code; }

    public String getProof() { return proof; }

    public String getExplanation() { return explanation; }

    @Override
    public String toString() {
        return "GeneratedSolution{code='" + code + "', proof='" + proof + "'}";
    }
}
