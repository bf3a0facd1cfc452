package com.proofsmith.core.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.proofsmith.core.agent.LlmJson;
import com.proofsmith.core.agent.StageResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RepairAdvice - the verifier's diagnosis of a compiler error.
 *
 * JSON SCHEMA:
 * {
 *   "error_analysis":  "Description of the problem",
 *   "suggested_fixes": [ "..." ],
 *   "corrected_code":  "optional",
 *   "corrected_proof": "optional",
 *   "confidence":      0.0 - 1.0
 * }
 *
 * Corrections are optional: advice without either one means the error could not be
 * repaired and the verification loop terminates.
 */
public final class RepairAdvice {

    private static final Logger log = LoggerFactory.getLogger(RepairAdvice.class);

    static final double FALLBACK_CONFIDENCE = 0.5;

    public enum Status {
        /** No error text was supplied; nothing to repair. */
        PASSED,
        ANALYZED
    }

    private final Status       status;
    private final String       errorAnalysis;
    private final List<String> suggestedFixes;
    private final String       correctedCode;
    private final String       correctedProof;
    private final double       confidence;

    private RepairAdvice(Status status, String errorAnalysis, List<String> suggestedFixes,
                         String correctedCode, String correctedProof, double confidence) {
        this.status         = status;
        this.errorAnalysis  = errorAnalysis != null ? errorAnalysis : "";
        this.suggestedFixes = suggestedFixes != null ? List.copyOf(suggestedFixes) : List.of();
        this.correctedCode  = correctedCode;
        this.correctedProof = correctedProof;
        this.confidence     = confidence;
    }

    public static RepairAdvice passed() {
        return new RepairAdvice(Status.PASSED, "No errors detected", List.of(), null, null, 1.0);
    }

    public static RepairAdvice correction(String correctedCode, String correctedProof, String analysis) {
        return new RepairAdvice(Status.ANALYZED, analysis, List.of(), correctedCode, correctedProof,
                FALLBACK_CONFIDENCE);
    }

    public static RepairAdvice analysisOnly(String analysis) {
        return new RepairAdvice(Status.ANALYZED, analysis, List.of("See error analysis"), null, null,
                FALLBACK_CONFIDENCE);
    }

    /**
     * Parse from raw model text. Never throws.
     */
    public static StageResult<RepairAdvice> parse(String response) {
        String raw = response != null ? response : "";
        try {
            JsonNode root = LlmJson.readObject(raw);

            RepairAdvice advice = new RepairAdvice(
                    Status.ANALYZED,
                    LlmJson.text(root, "error_analysis"),
                    LlmJson.textList(root, "suggested_fixes"),
                    LlmJson.text(root, "corrected_code"),
                    LlmJson.text(root, "corrected_proof"),
                    clamp(LlmJson.number(root, "confidence", FALLBACK_CONFIDENCE))
            );

            log.info("[RepairAdvice] correctedCode={}, correctedProof={}, confidence={}",
                    advice.hasCorrectedCode(), advice.hasCorrectedProof(), advice.confidence);
            return StageResult.parsed(advice, raw);

        } catch (Exception e) {
            log.warn("[RepairAdvice] JSON parse failed: {} - keeping raw analysis", e.getMessage());
            return StageResult.fallback(analysisOnly(raw), "unparseable advice: " + e.getMessage(), raw);
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public Status getStatus() { return status; }

    public String getErrorAnalysis() { return errorAnalysis; }

    public List<String> getSuggestedFixes() { return suggestedFixes; }

    public boolean hasCorrectedCode() {
        return correctedCode != null && !correctedCode.isBlank();
    }

    public boolean hasCorrectedProof() {
        return correctedProof != null && !correctedProof.isBlank();
    }

    public boolean hasCorrection() {
        return hasCorrectedCode() || hasCorrectedProof();
    }

    /** Null when the verifier offered no replacement implementation. */
    public String getCorrectedCode() { return correctedCode; }

    /** Null when the verifier offered no replacement proof. */
    public String getCorrectedProof() { return correctedProof; }

    public double getConfidence() { return confidence; }
}
