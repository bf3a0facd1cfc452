package com.proofsmith.orchestrator;

import com.proofsmith.core.state.AttemptRecord;
import com.proofsmith.core.state.AttemptStage;

import java.util.List;
import java.util.Set;

/**
 * Solution plus the verdict and history of the run that produced it. Reporting only;
 * callers of {@link ProofOrchestrator#solve} see just the solution.
 */
public final class WorkflowResult {

    private final ProofSolution       solution;
    private final boolean             success;
    private final int                 attemptsUsed;
    private final AttemptStage        finalStage;
    private final List<AttemptRecord> failedAttempts;
    private final Set<String>         errorSignatures;
    private final long                wallTimeMs;

    public WorkflowResult(ProofSolution solution, boolean success, int attemptsUsed, AttemptStage finalStage,
                          List<AttemptRecord> failedAttempts, Set<String> errorSignatures, long wallTimeMs) {
        this.solution        = solution;
        this.success         = success;
        this.attemptsUsed    = attemptsUsed;
        this.finalStage      = finalStage;
        this.failedAttempts  = List.copyOf(failedAttempts);
        this.errorSignatures = Set.copyOf(errorSignatures);
        this.wallTimeMs      = wallTimeMs;
    }

    public ProofSolution getSolution() { return solution; }

    public boolean isSuccess() { return success; }

    public int getAttemptsUsed() { return attemptsUsed; }

    /** SUCCESS, or the stage at which the last attempt stopped. */
    public AttemptStage getFinalStage() { return finalStage; }

    public List<AttemptRecord> getFailedAttempts() { return failedAttempts; }

    public Set<String> getErrorSignatures() { return errorSignatures; }

    public long getWallTimeMs() { return wallTimeMs; }
}
