package com.proofsmith.benchmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.core.compiler.CompilationResult;
import com.proofsmith.core.compiler.ProofChecker;
import com.proofsmith.core.task.ProofTask;
import com.proofsmith.orchestrator.ProofSolution;

import java.util.List;
import java.util.Locale;

/**
 * Scores a solution independently of the workflow that produced it.
 *
 * Rejected before compiling: missing code or proof, any {@code sorry} in the proof,
 * and proofs shorter than 10 characters that mention none of the known closing tactics.
 */
@Component
public class SolutionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SolutionEvaluator.class);

    static final int          MIN_PROOF_LENGTH   = 10;
    static final List<String> VALID_SHORT_PROOFS = List.of("rfl", "simp", "omega", "norm_num", "ring");

    private final ProofChecker checker;

    public SolutionEvaluator(ProofChecker checker) {
        this.checker = checker;
    }

    public TaskEvaluation evaluate(BenchmarkTask task, ProofSolution solution) {

        String taskId = task.getTaskId();
        log.info("[Benchmark] Evaluating solution for {}", taskId);

        String code  = solution.getCode();
        String proof = solution.getProof();

        if (code.isBlank() || proof.isBlank()) {
            return TaskEvaluation.rejected(taskId, "Missing code or proof", solution);
        }

        String lowerProof = proof.toLowerCase(Locale.ROOT);
        if (lowerProof.contains(ProofTask.PLACEHOLDER_PROOF)) {
            return TaskEvaluation.rejected(taskId, "Sorry placeholder detected", solution);
        }

        if (proof.strip().length() < MIN_PROOF_LENGTH
                && VALID_SHORT_PROOFS.stream().noneMatch(lowerProof::contains)) {
            return TaskEvaluation.rejected(taskId, "Trivial or placeholder proof detected", solution);
        }

        ProofTask proofTask = new ProofTask(task.getDescription(), task.getTemplate());

        CompilationResult impl = checker.testImplementationOnly(proofTask, code);
        if (!impl.isSuccess()) {
            return TaskEvaluation.rejected(taskId, "Implementation failed: " + impl.getDiagnostics(), solution);
        }

        CompilationResult full = checker.testFullSolution(proofTask, code, proof);
        return TaskEvaluation.compiled(
                taskId,
                full.isSuccess(),
                full.isSuccess() ? "" : full.getDiagnostics(),
                full.getOutput(),
                solution
        );
    }
}
