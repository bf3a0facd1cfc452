package com.proofsmith.benchmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.orchestrator.ProofOrchestrator;
import com.proofsmith.orchestrator.ProofSolution;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the workflow over the task suite and scores each solution with
 * {@link SolutionEvaluator}.
 */
@Component
public class BenchmarkRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final ProofOrchestrator orchestrator;
    private final TaskSuiteLoader   loader;
    private final SolutionEvaluator evaluator;

    public BenchmarkRunner(ProofOrchestrator orchestrator, TaskSuiteLoader loader, SolutionEvaluator evaluator) {
        this.orchestrator = orchestrator;
        this.loader       = loader;
        this.evaluator    = evaluator;
    }

    /**
     * @return the evaluation, or null when the task cannot be loaded
     */
    public TaskEvaluation runTask(String taskId) {
        BenchmarkTask task = loader.load(taskId);
        if (task == null) {
            return null;
        }
        return run(task);
    }

    public List<TaskEvaluation> runAll() {
        List<BenchmarkTask> tasks = loader.loadAll();
        if (tasks.isEmpty()) {
            log.warn("[Benchmark] No tasks found");
            return List.of();
        }

        log.info("[Benchmark] Found {} tasks", tasks.size());
        List<TaskEvaluation> evaluations = new ArrayList<>();
        for (BenchmarkTask task : tasks) {
            evaluations.add(run(task));
        }

        logSummary(BenchmarkSummary.of(evaluations), evaluations);
        return evaluations;
    }

    private TaskEvaluation run(BenchmarkTask task) {
        log.info("[Benchmark] Processing task: {}", task.getTaskId());

        ProofSolution solution;
        try {
            solution = orchestrator.solve(task.getDescription(), task.getTemplate());
        } catch (RuntimeException e) {
            log.error("[Benchmark] Task {} failed: {}", task.getTaskId(), e.getMessage());
            return TaskEvaluation.rejected(task.getTaskId(), "Workflow failed: " + e.getMessage(), null);
        }

        TaskEvaluation evaluation = evaluator.evaluate(task, solution);
        log.info("[Benchmark] {} -> {}", task.getTaskId(), evaluation.isSuccess() ? "SUCCESS" : "FAILED");
        return evaluation;
    }

    private void logSummary(BenchmarkSummary summary, List<TaskEvaluation> evaluations) {
        log.info("==================================================");
        log.info("BENCHMARK SUMMARY");
        log.info("==================================================");
        log.info("Total tasks:   {}", summary.getTotalTasks());
        log.info("Successful:    {}", summary.getSuccessfulTasks());
        log.info("Failed:        {}", summary.getFailedTasks());
        log.info("Success rate:  {}%", String.format("%.1f", summary.getSuccessRate()));
        log.info("Total score:   {}/{}", String.format("%.1f", summary.getTotalScore()), summary.getTotalTasks());
        log.info("Average score: {}", String.format("%.3f", summary.getAverageScore()));

        for (TaskEvaluation evaluation : evaluations) {
            if (!evaluation.isSuccess()) {
                String error = evaluation.getError();
                log.info("  {}: {}", evaluation.getTaskId(), error.length() > 80 ? error.substring(0, 80) + "..." : error);
            }
        }
    }
}
