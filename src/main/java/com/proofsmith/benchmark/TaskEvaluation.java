package com.proofsmith.benchmark;

import com.proofsmith.orchestrator.ProofSolution;

/**
 * Verdict for one benchmark task. {@code score} is 1.0 for a fully accepted solution,
 * 0.0 otherwise.
 */
public class TaskEvaluation {

    private final String        taskId;
    private final boolean       success;
    private final String        error;
    private final boolean       codeCompiles;
    private final boolean       proofValid;
    private final double        score;
    private final String        executionOutput;
    private final ProofSolution solution;

    private TaskEvaluation(String taskId, boolean success, String error, boolean codeCompiles,
                           boolean proofValid, String executionOutput, ProofSolution solution) {
        this.taskId          = taskId;
        this.success         = success;
        this.error           = error != null ? error : "";
        this.codeCompiles    = codeCompiles;
        this.proofValid      = proofValid;
        this.score           = success ? 1.0 : 0.0;
        this.executionOutput = executionOutput != null ? executionOutput : "";
        this.solution        = solution;
    }

    public static TaskEvaluation rejected(String taskId, String error, ProofSolution solution) {
        return new TaskEvaluation(taskId, false, error, false, false, "", solution);
    }

    public static TaskEvaluation compiled(String taskId, boolean proofValid, String error,
                                          String executionOutput, ProofSolution solution) {
        return new TaskEvaluation(taskId, proofValid, error, true, proofValid, executionOutput, solution);
    }

    public String getTaskId() { return taskId; }

    public boolean isSuccess() { return success; }

    public String getError() { return error; }

    public boolean isCodeCompiles() { return codeCompiles; }

    public boolean isProofValid() { return proofValid; }

    public double getScore() { return score; }

    public String getExecutionOutput() { return executionOutput; }

    /** Null when the workflow never produced one. */
    public ProofSolution getSolution() { return solution; }
}
