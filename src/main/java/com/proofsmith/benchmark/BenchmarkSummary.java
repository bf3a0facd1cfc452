package com.proofsmith.benchmark;

import java.util.ArrayList;
import java.util.List;

public class BenchmarkSummary {

    private final int          totalTasks;
    private final int          successfulTasks;
    private final double       totalScore;
    private final List<String> failedTaskIds;

    private BenchmarkSummary(int totalTasks, int successfulTasks, double totalScore, List<String> failedTaskIds) {
        this.totalTasks      = totalTasks;
        this.successfulTasks = successfulTasks;
        this.totalScore      = totalScore;
        this.failedTaskIds   = List.copyOf(failedTaskIds);
    }

    public static BenchmarkSummary of(List<TaskEvaluation> evaluations) {
        int successful = 0;
        double score = 0.0;
        List<String> failed = new ArrayList<>();

        for (TaskEvaluation evaluation : evaluations) {
            score += evaluation.getScore();
            if (evaluation.isSuccess()) {
                successful++;
            } else {
                failed.add(evaluation.getTaskId());
            }
        }
        return new BenchmarkSummary(evaluations.size(), successful, score, failed);
    }

    public int getTotalTasks() { return totalTasks; }

    public int getSuccessfulTasks() { return successfulTasks; }

    public int getFailedTasks() { return totalTasks - successfulTasks; }

    /** Percentage in [0, 100]; 0 for an empty run. */
    public double getSuccessRate() {
        return totalTasks == 0 ? 0.0 : successfulTasks * 100.0 / totalTasks;
    }

    public double getTotalScore() { return totalScore; }

    public double getAverageScore() {
        return totalTasks == 0 ? 0.0 : totalScore / totalTasks;
    }

    public List<String> getFailedTaskIds() { return failedTaskIds; }
}
