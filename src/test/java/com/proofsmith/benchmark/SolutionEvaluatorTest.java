package com.proofsmith.benchmark;

import com.proofsmith.core.compiler.CompilationResult;
import com.proofsmith.core.compiler.ProofChecker;
import com.proofsmith.orchestrator.ProofSolution;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolutionEvaluatorTest {

    private static final BenchmarkTask TASK = new BenchmarkTask(
            "task_id_0",
            "Return the minimum of three natural numbers",
            "def minOfThree (a b c : Nat) : Nat :=\n  {{code}}\n\ntheorem spec : True := by\n  {{proof}}",
            "",
            Path.of("tasks", "task_id_0"));

    private final List<String> compiled = new ArrayList<>();

    private SolutionEvaluator evaluator(boolean implOk, boolean fullOk) {
        ProofChecker checker = (source, fileName) -> {
            compiled.add(fileName);
            boolean ok = fileName.equals(ProofChecker.IMPLEMENTATION_FILE) ? implOk : fullOk;
            return new CompilationResult(ok ? 0 : 1, "lake output", ok ? "" : "error: " + fileName, 10);
        };
        return new SolutionEvaluator(checker);
    }

    @Test
    void testAcceptedSolutionScoresOne() {
        TaskEvaluation evaluation = evaluator(true, true)
                .evaluate(TASK, new ProofSolution("if a ≤ b then a else b", "omega"));

        assertTrue(evaluation.isSuccess());
        assertTrue(evaluation.isCodeCompiles());
        assertTrue(evaluation.isProofValid());
        assertEquals(1.0, evaluation.getScore());
        assertEquals("", evaluation.getError());
        assertEquals(List.of(ProofChecker.IMPLEMENTATION_FILE, ProofChecker.FULL_SOLUTION_FILE), compiled);
    }

    @Test
    void testSorryIsRejectedWithoutCompiling() {
        TaskEvaluation evaluation = evaluator(true, true)
                .evaluate(TASK, new ProofSolution("a", "intro h\n  Sorry"));

        assertFalse(evaluation.isSuccess());
        assertEquals(0.0, evaluation.getScore());
        assertEquals("Sorry placeholder detected", evaluation.getError());
        assertTrue(compiled.isEmpty());
    }

    @Test
    void testMissingPartsAreRejected() {
        TaskEvaluation evaluation = evaluator(true, true).evaluate(TASK, new ProofSolution("  ", "omega"));

        assertEquals("Missing code or proof", evaluation.getError());
        assertTrue(compiled.isEmpty());
    }

    @Test
    void testShortProofNeedsKnownTactic() {
        SolutionEvaluator evaluator = evaluator(true, true);

        assertEquals("Trivial or placeholder proof detected",
                evaluator.evaluate(TASK, new ProofSolution("a", "trivial")).getError());
        assertTrue(evaluator.evaluate(TASK, new ProofSolution("a", "simp")).isSuccess());
        assertTrue(evaluator.evaluate(TASK, new ProofSolution("a", "exact Nat.le_refl _")).isSuccess());
    }

    @Test
    void testImplementationFailureSkipsFullCheck() {
        TaskEvaluation evaluation = evaluator(false, true).evaluate(TASK, new ProofSolution("a", "omega"));

        assertFalse(evaluation.isCodeCompiles());
        assertTrue(evaluation.getError().startsWith("Implementation failed: "));
        assertEquals(List.of(ProofChecker.IMPLEMENTATION_FILE), compiled);
    }

    @Test
    void testProofFailureKeepsCompilerDiagnostics() {
        TaskEvaluation evaluation = evaluator(true, false).evaluate(TASK, new ProofSolution("a", "omega"));

        assertTrue(evaluation.isCodeCompiles());
        assertFalse(evaluation.isProofValid());
        assertEquals(0.0, evaluation.getScore());
        assertEquals("error: " + ProofChecker.FULL_SOLUTION_FILE, evaluation.getError());
        assertEquals("lake output", evaluation.getExecutionOutput());
    }

    @Test
    void testSummaryAggregatesEvaluations() {
        ProofSolution solution = new ProofSolution("a", "omega");
        BenchmarkSummary summary = BenchmarkSummary.of(List.of(
                TaskEvaluation.compiled("task_id_0", true, "", "", solution),
                TaskEvaluation.rejected("task_id_1", "Sorry placeholder detected", solution),
                TaskEvaluation.compiled("task_id_2", true, "", "", solution),
                TaskEvaluation.compiled("task_id_3", false, "error", "", solution)));

        assertEquals(4, summary.getTotalTasks());
        assertEquals(2, summary.getSuccessfulTasks());
        assertEquals(2, summary.getFailedTasks());
        assertEquals(50.0, summary.getSuccessRate(), 1e-9);
        assertEquals(2.0, summary.getTotalScore(), 1e-9);
        assertEquals(0.5, summary.getAverageScore(), 1e-9);
        assertEquals(List.of("task_id_1", "task_id_3"), summary.getFailedTaskIds());
    }

    @Test
    void testEmptySummaryHasZeroRates() {
        BenchmarkSummary summary = BenchmarkSummary.of(List.of());

        assertEquals(0.0, summary.getSuccessRate());
        assertEquals(0.0, summary.getAverageScore());
    }
}
