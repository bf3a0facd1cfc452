package com.proofsmith.core.verification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.config.WorkflowLimits;
import com.proofsmith.core.agent.StageResult;
import com.proofsmith.core.agent.VerifierAgent;
import com.proofsmith.core.compiler.CompilationResult;
import com.proofsmith.core.compiler.ProofChecker;
import com.proofsmith.core.retrieval.RetrievalContextProvider;
import com.proofsmith.core.state.AttemptStage;
import com.proofsmith.core.task.ProofTask;
import com.proofsmith.core.verifier.FailureKind;
import com.proofsmith.core.verifier.RepairAdvice;
import com.proofsmith.core.verifier.VerificationRequest;

/**
 * VerificationLoop - bounded check / repair cycle for one candidate.
 *
 *   CHECK_IMPL --pass--> CHECK_FULL --pass--> SUCCESS
 *   CHECK_IMPL --fail--> REPAIR_IMPL  --> CHECK_IMPL   (next round)
 *   CHECK_FULL --fail--> REPAIR_PROOF --> CHECK_IMPL   (next round)
 *
 * A round is one pass from CHECK_IMPL to either SUCCESS or a repair, and every round
 * ends in a repair request when a check fails, the last one included. A repair that
 * offers no correction ends the loop at the stage that failed. A correction applied in
 * the last round has no round left to be checked in, so the loop ends in
 * VERIFICATION_TIMEOUT.
 */
@Component
public class VerificationLoop {

    private static final Logger log = LoggerFactory.getLogger(VerificationLoop.class);

    static final String ROUNDS_EXHAUSTED = "Exceeded maximum verification rounds";

    private static final int REPAIR_CONTEXT_CHUNKS = 3;
    private static final int ERROR_QUERY_CHARS     = 200;

    private final ProofChecker             checker;
    private final VerifierAgent            verifier;
    private final RetrievalContextProvider retrieval;
    private final int                      maxRounds;

    public VerificationLoop(ProofChecker checker, VerifierAgent verifier,
                            RetrievalContextProvider retrieval, WorkflowLimits limits) {
        this.checker   = checker;
        this.verifier  = verifier;
        this.retrieval = retrieval;
        this.maxRounds = limits.getMaxVerificationRounds();
    }

    public VerificationOutcome verify(ProofTask task, String initialCode, String initialProof) {

        String code  = initialCode;
        String proof = initialProof;
        String lastError = "";
        int round = 0;

        while (round < maxRounds) {
            round++;
            log.info("[Verification] Round {}/{}", round, maxRounds);

            // CHECK_IMPL
            CompilationResult impl = checker.testImplementationOnly(task, code);
            FailureKind failed;
            CompilationResult failing = impl;

            if (!impl.isSuccess()) {
                log.info("[Verification] Implementation failed: {}", preview(impl.getDiagnostics()));
                failed = FailureKind.IMPLEMENTATION;
            } else {
                log.info("[Verification] Implementation verified");

                // CHECK_FULL
                CompilationResult full = checker.testFullSolution(task, code, proof);
                if (full.isSuccess()) {
                    log.info("[Verification] Full solution verified in round {}", round);
                    return VerificationOutcome.success(code, proof, round);
                }
                log.info("[Verification] Proof failed: {}", preview(full.getDiagnostics()));
                failed = FailureKind.PROOF;
                failing = full;
            }

            String error = failing.getDiagnostics();
            lastError = error;

            // REPAIR_IMPL / REPAIR_PROOF
            RepairAdvice advice = requestRepair(code, proof, error, failed);
            if (advice == null || !advice.hasCorrection()) {
                AttemptStage stage = failed == FailureKind.IMPLEMENTATION
                        ? AttemptStage.IMPLEMENTATION_VERIFICATION
                        : AttemptStage.PROOF_VERIFICATION;
                log.info("[Verification] No correction offered; stopping at {}", stage.wireName());
                return VerificationOutcome.failure(stage, code, proof, error, round);
            }

            if (advice.hasCorrectedCode()) {
                code = advice.getCorrectedCode();
            }
            if (advice.hasCorrectedProof()) {
                proof = advice.getCorrectedProof();
            }
            log.info("[Verification] Applied {} fix (code={}, proof={})",
                    failed.wireName(), advice.hasCorrectedCode(), advice.hasCorrectedProof());
        }

        log.warn("[Verification] Round budget of {} exhausted", maxRounds);
        String error = lastError.isEmpty() ? ROUNDS_EXHAUSTED : ROUNDS_EXHAUSTED + "\n" + lastError;
        return VerificationOutcome.failure(AttemptStage.VERIFICATION_TIMEOUT, code, proof, error, round);
    }

    private RepairAdvice requestRepair(String code, String proof, String error, FailureKind kind) {
        String query = "Lean 4 error debugging " + kind.wireName() + " "
                + (error.length() > ERROR_QUERY_CHARS ? error.substring(0, ERROR_QUERY_CHARS) : error);
        String context = retrieval.contextFor(query, REPAIR_CONTEXT_CHUNKS);

        StageResult<RepairAdvice> result = verifier.process(
                new VerificationRequest(code, proof, error, kind, context));

        if (!result.hasValue()) {
            log.warn("[Verification] Verifier unavailable: {}", result.getDetail());
            return null;
        }
        return result.getValue();
    }

    private static String preview(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() > 100 ? flat.substring(0, 100) + "..." : flat;
    }

    public int getMaxRounds() {
        return maxRounds;
    }
}
