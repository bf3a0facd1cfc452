package com.proofsmith.orchestrator;

import com.proofsmith.core.state.AttemptRecord;
import com.proofsmith.core.task.ProofTask;

import java.util.List;

/**
 * Picks the attempt that got furthest when none succeeded.
 *
 * Score per attempt:
 *   +2  code present and not a "-- No implementation" placeholder
 *   +1  proof present and not {@code sorry}
 *   +1  stopped at proof verification or ran out of rounds
 *
 * Scan is chronological and only a strictly higher score replaces the current best,
 * so the first attempt reaching the maximum wins.
 */
public final class BestEffortSelector {

    static final String PLACEHOLDER_CODE_MARKER = "-- No implementation";

    private BestEffortSelector() {}

    public static ProofSolution select(List<AttemptRecord> attempts) {
        if (attempts == null || attempts.isEmpty()) {
            return ProofSolution.placeholder();
        }

        AttemptRecord best = null;
        int bestScore = -1;
        for (AttemptRecord attempt : attempts) {
            int score = score(attempt);
            if (score > bestScore) {
                bestScore = score;
                best = attempt;
            }
        }

        String code  = best.getCode().isBlank() ? ProofSolution.NO_IMPLEMENTATION : best.getCode();
        String proof = best.getProof().isBlank() ? ProofTask.PLACEHOLDER_PROOF : best.getProof();
        return new ProofSolution(code, proof);
    }

    static int score(AttemptRecord attempt) {
        int score = 0;
        if (!attempt.getCode().isBlank() && !attempt.getCode().contains(PLACEHOLDER_CODE_MARKER)) {
            score += 2;
        }
        if (!attempt.getProof().isBlank() && !ProofTask.PLACEHOLDER_PROOF.equals(attempt.getProof().strip())) {
            score += 1;
        }
        if (attempt.getStage().reachedProofLevel()) {
            score += 1;
        }
        return score;
    }
}
