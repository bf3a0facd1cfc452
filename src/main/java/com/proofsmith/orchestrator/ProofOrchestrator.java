package com.proofsmith.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.proofsmith.config.WorkflowLimits;
import com.proofsmith.core.agent.GeneratorAgent;
import com.proofsmith.core.agent.PlannerAgent;
import com.proofsmith.core.agent.StageResult;
import com.proofsmith.core.generator.GeneratedSolution;
import com.proofsmith.core.generator.GenerationRequest;
import com.proofsmith.core.planner.PlanRequest;
import com.proofsmith.core.planner.ProofPlan;
import com.proofsmith.core.retrieval.RetrievalContextProvider;
import com.proofsmith.core.state.AttemptRecord;
import com.proofsmith.core.state.AttemptStage;
import com.proofsmith.core.state.WorkflowContext;
import com.proofsmith.core.task.ProofTask;
import com.proofsmith.core.verification.VerificationLoop;
import com.proofsmith.core.verification.VerificationOutcome;

/**
 * ProofOrchestrator - top-level controller for one proving task.
 *
 * Attempt flow:  PLAN → GENERATE → VERIFICATION LOOP
 *
 * At most max-attempts attempts run, strictly in sequence. A successful verification
 * returns immediately. Every failed attempt, including one that throws, is recorded in
 * the {@link WorkflowContext} and its error signature carried into later prompts. When
 * the budget runs out the best partial attempt is returned.
 *
 * Nothing thrown inside an attempt escapes {@link #solve} or {@link #run}.
 */
@Component
public class ProofOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProofOrchestrator.class);

    private static final int PLAN_CONTEXT_CHUNKS     = 3;
    private static final int GENERATE_CONTEXT_CHUNKS = 5;
    private static final int PLAN_HISTORY            = 3;
    private static final int GENERATE_HISTORY        = 2;

    private final PlannerAgent             planner;
    private final GeneratorAgent           generator;
    private final VerificationLoop         verificationLoop;
    private final RetrievalContextProvider retrieval;
    private final int                      maxAttempts;

    public ProofOrchestrator(
            PlannerAgent             planner,
            GeneratorAgent           generator,
            VerificationLoop         verificationLoop,
            RetrievalContextProvider retrieval,
            WorkflowLimits           limits
    ) {
        this.planner          = planner;
        this.generator        = generator;
        this.verificationLoop = verificationLoop;
        this.retrieval        = retrieval;
        this.maxAttempts      = limits.getMaxAttempts();
    }

    // =========================================================================
    // MAIN ENTRY POINTS
    // =========================================================================

    /**
     * @return the verified pair, or the best partial attempt; never null, never throws
     */
    public ProofSolution solve(String description, String template) {
        return run(description, template).getSolution();
    }

    public WorkflowResult run(String description, String template) {

        log.info("========== PROOFSMITH WORKFLOW START ==========");
        long startTime = System.currentTimeMillis();

        ProofTask task = new ProofTask(description, template);
        if (!task.hasBothSlots()) {
            log.warn("[Orchestrator] Template is missing {{code}} or {{proof}}; compiler checks will likely fail");
        }

        WorkflowContext context = WorkflowContext.start(task);
        int attemptsUsed = 0;
        AttemptStage lastStage = AttemptStage.PLANNING;

        while (attemptsUsed < maxAttempts) {
            attemptsUsed++;
            log.info("[Orchestrator] --- Attempt {}/{} ---", attemptsUsed, maxAttempts);

            AttemptRecord failure;
            try {
                AttemptOutcome outcome = runAttempt(context, attemptsUsed);

                if (outcome.solution != null) {
                    log.info("========== PROOFSMITH SUCCESS (attempt {}) ==========", attemptsUsed);
                    WorkflowResult result = new WorkflowResult(outcome.solution, true, attemptsUsed,
                            AttemptStage.SUCCESS, context.getAttempts(), context.getErrorSignatures(),
                            System.currentTimeMillis() - startTime);
                    logBenchmark(task, result);
                    return result;
                }
                failure = outcome.failure;

            } catch (RuntimeException e) {
                log.error("[Orchestrator] Attempt {} failed with exception: {}", attemptsUsed, e.getMessage(), e);
                failure = AttemptRecord.exception(attemptsUsed, e);
            }

            log.info("[Orchestrator] Attempt {} stopped at {}", attemptsUsed, failure.getStage().wireName());
            context = context.withFailure(failure);
            lastStage = failure.getStage();
        }

        log.warn("========== PROOFSMITH EXHAUSTED ({} attempts) - returning best effort ==========", attemptsUsed);
        ProofSolution bestEffort = BestEffortSelector.select(context.getAttempts());

        WorkflowResult result = new WorkflowResult(bestEffort, false, attemptsUsed, lastStage,
                context.getAttempts(), context.getErrorSignatures(),
                System.currentTimeMillis() - startTime);
        logBenchmark(task, result);
        return result;
    }

    // =========================================================================
    // SINGLE ATTEMPT
    // =========================================================================

    private AttemptOutcome runAttempt(WorkflowContext context, int attemptNumber) {

        ProofTask task = context.getTask();

        // PLAN
        String planContext = retrieval.contextFor(
                "Lean 4 planning strategy " + task.getDescription(), PLAN_CONTEXT_CHUNKS);

        StageResult<ProofPlan> planResult = planner.process(new PlanRequest(
                task.getDescription(),
                task.getTemplate(),
                context.recentAttempts(PLAN_HISTORY),
                context.getErrorSignatures(),
                planContext
        ));

        if (!planResult.hasValue()) {
            return AttemptOutcome.failed(AttemptRecord.builder(attemptNumber, AttemptStage.PLANNING)
                    .error(planResult.getDetail())
                    .build());
        }
        ProofPlan plan = planResult.getValue();
        log.info("[Orchestrator] Plan ready ({})", planResult.getKind());

        // GENERATE
        String generateContext = retrieval.contextFor(
                "Lean 4 code proof " + task.getDescription() + " " + plan.getPlanText(), GENERATE_CONTEXT_CHUNKS);

        StageResult<GeneratedSolution> genResult = generator.process(new GenerationRequest(
                task.getDescription(),
                task.getTemplate(),
                plan.getPlanText(),
                generateContext,
                context.recentAttempts(GENERATE_HISTORY),
                attemptNumber
        ));

        if (!genResult.hasValue()) {
            return AttemptOutcome.failed(AttemptRecord.builder(attemptNumber, AttemptStage.GENERATION)
                    .error(genResult.getDetail())
                    .build());
        }
        GeneratedSolution candidate = genResult.getValue();
        log.info("[Orchestrator] Candidate ready ({}): {}", genResult.getKind(), candidate);

        // VERIFY
        VerificationOutcome verification = verificationLoop.verify(task, candidate.getCode(), candidate.getProof());

        if (verification.isSuccess()) {
            return AttemptOutcome.solved(new ProofSolution(verification.getCode(), verification.getProof()));
        }

        return AttemptOutcome.failed(AttemptRecord.builder(attemptNumber, verification.getStage())
                .code(verification.getCode())
                .proof(verification.getProof())
                .error(verification.getError())
                .build());
    }

    private static final class AttemptOutcome {
        final ProofSolution solution;
        final AttemptRecord failure;

        private AttemptOutcome(ProofSolution solution, AttemptRecord failure) {
            this.solution = solution;
            this.failure  = failure;
        }

        static AttemptOutcome solved(ProofSolution solution) {
            return new AttemptOutcome(solution, null);
        }

        static AttemptOutcome failed(AttemptRecord failure) {
            return new AttemptOutcome(null, failure);
        }
    }

    // =========================================================================
    // BENCHMARK LOGGING
    // =========================================================================

    private void logBenchmark(ProofTask task, WorkflowResult result) {
        String description = task.getDescription();
        String preview = description.length() > 60 ? description.substring(0, 60) : description;

        String json = String.format(
                "{\"task\":\"%s\",\"success\":%b,\"attempts_used\":%d,\"max_attempts\":%d," +
                "\"final_stage\":\"%s\",\"error_signatures\":%d,\"wall_time_ms\":%d}",
                preview.replace("\"", "'").replace("\n", " "),
                result.isSuccess(),
                result.getAttemptsUsed(), maxAttempts,
                result.getFinalStage().wireName(),
                result.getErrorSignatures().size(),
                result.getWallTimeMs()
        );

        log.info("[Benchmark] {}", json);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
