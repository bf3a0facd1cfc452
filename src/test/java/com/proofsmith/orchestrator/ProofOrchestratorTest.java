package com.proofsmith.orchestrator;

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
import com.proofsmith.core.task.ProofTask;
import com.proofsmith.core.verification.VerificationLoop;
import com.proofsmith.core.verification.VerificationOutcome;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProofOrchestratorTest {

    private static final String DESCRIPTION = "Return the sum of two natural numbers";
    private static final String TEMPLATE =
            "def add (a b : Nat) : Nat :=\n  {{code}}\n\ntheorem add_spec : True := by\n  {{proof}}";

    private PlannerAgent             planner;
    private GeneratorAgent           generator;
    private VerificationLoop         verificationLoop;
    private RetrievalContextProvider retrieval;
    private ProofOrchestrator        orchestrator;

    @BeforeEach
    void setUp() {
        planner          = mock(PlannerAgent.class);
        generator        = mock(GeneratorAgent.class);
        verificationLoop = mock(VerificationLoop.class);
        retrieval        = mock(RetrievalContextProvider.class);

        when(retrieval.contextFor(anyString(), anyInt())).thenReturn("");
        when(planner.process(any())).thenReturn(StageResult.parsed(ProofPlan.rawText("use Nat.add"), "use Nat.add"));
        when(generator.process(any())).thenReturn(
                StageResult.parsed(GeneratedSolution.of("a + b", "rfl", ""), "{}"));

        orchestrator = new ProofOrchestrator(planner, generator, verificationLoop, retrieval,
                new WorkflowLimits(3, 2));
    }

    @Test
    void testSuccessReturnsVerifiedPairImmediately() {
        when(verificationLoop.verify(any(ProofTask.class), eq("a + b"), eq("rfl")))
                .thenReturn(VerificationOutcome.success("a + b", "rfl", 1));

        WorkflowResult result = orchestrator.run(DESCRIPTION, TEMPLATE);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getAttemptsUsed());
        assertEquals(AttemptStage.SUCCESS, result.getFinalStage());
        assertEquals("a + b", result.getSolution().getCode());
        assertEquals("rfl", result.getSolution().getProof());
        assertTrue(result.getFailedAttempts().isEmpty());
        verify(planner, times(1)).process(any());
    }

    @Test
    void testAttemptBudgetIsRespectedAndBestEffortReturned() {
        when(verificationLoop.verify(any(), anyString(), anyString()))
                .thenReturn(VerificationOutcome.failure(AttemptStage.IMPLEMENTATION_VERIFICATION,
                        "a + b", "sorry", "Main.lean:2:2: error: unknown identifier 'x'", 1))
                .thenReturn(VerificationOutcome.failure(AttemptStage.PROOF_VERIFICATION,
                        "b + a", "omega", "Main.lean:5:2: error: unsolved goals", 1))
                .thenReturn(VerificationOutcome.failure(AttemptStage.IMPLEMENTATION_VERIFICATION,
                        "a * b", "simp", "Main.lean:2:2: error: unknown identifier 'x'", 1));

        WorkflowResult result = orchestrator.run(DESCRIPTION, TEMPLATE);

        assertFalse(result.isSuccess());
        assertEquals(3, result.getAttemptsUsed());
        assertEquals(3, result.getFailedAttempts().size());
        assertEquals(AttemptStage.IMPLEMENTATION_VERIFICATION, result.getFinalStage());
        assertEquals(2, result.getErrorSignatures().size());
        assertEquals("b + a", result.getSolution().getCode());
        assertEquals("omega", result.getSolution().getProof());
        verify(planner, times(3)).process(any());
        verify(verificationLoop, times(3)).verify(any(), anyString(), anyString());
    }

    @Test
    void testPlanningFailureIsRecordedAndNextAttemptRuns() {
        when(planner.process(any()))
                .thenReturn(StageResult.failed("Planning failed: connection refused"))
                .thenReturn(StageResult.parsed(ProofPlan.rawText("plan"), "plan"));
        when(verificationLoop.verify(any(), anyString(), anyString()))
                .thenReturn(VerificationOutcome.success("a + b", "rfl", 1));

        WorkflowResult result = orchestrator.run(DESCRIPTION, TEMPLATE);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getAttemptsUsed());
        AttemptRecord first = result.getFailedAttempts().get(0);
        assertEquals(AttemptStage.PLANNING, first.getStage());
        assertEquals("Planning failed: connection refused", first.getError());
        verifyNoInteractions(generator);
    }

    @Test
    void testGenerationFailureIsRecorded() {
        when(generator.process(any())).thenReturn(StageResult.failed("Generation failed: 500"));

        WorkflowResult result = orchestrator.run(DESCRIPTION, TEMPLATE);

        assertFalse(result.isSuccess());
        assertEquals(AttemptStage.GENERATION, result.getFinalStage());
        assertEquals(ProofSolution.NO_IMPLEMENTATION, result.getSolution().getCode());
        verifyNoInteractions(verificationLoop);
    }

    @Test
    void testExceptionInsideAttemptIsCaughtAndRecorded() {
        when(verificationLoop.verify(any(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("compiler crashed"))
                .thenReturn(VerificationOutcome.success("a + b", "rfl", 1));

        WorkflowResult result = orchestrator.run(DESCRIPTION, TEMPLATE);

        assertTrue(result.isSuccess());
        AttemptRecord first = result.getFailedAttempts().get(0);
        assertEquals(AttemptStage.EXCEPTION, first.getStage());
        assertEquals("compiler crashed", first.getError());
    }

    @Test
    void testHistoryIsPassedToLaterPrompts() {
        when(verificationLoop.verify(any(), anyString(), anyString()))
                .thenReturn(VerificationOutcome.failure(AttemptStage.PROOF_VERIFICATION,
                        "a + b", "simp", "error: unsolved goals", 1))
                .thenReturn(VerificationOutcome.success("a + b", "rfl", 1));

        orchestrator.run(DESCRIPTION, TEMPLATE);

        ArgumentCaptor<PlanRequest> plans = ArgumentCaptor.forClass(PlanRequest.class);
        verify(planner, times(2)).process(plans.capture());
        assertTrue(plans.getAllValues().get(0).getPreviousAttempts().isEmpty());
        assertEquals(1, plans.getAllValues().get(1).getPreviousAttempts().size());
        assertEquals(1, plans.getAllValues().get(1).getErrorSignatures().size());

        ArgumentCaptor<GenerationRequest> gens = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generator, times(2)).process(gens.capture());
        assertEquals(2, gens.getAllValues().get(1).getAttemptNumber());
    }

    @Test
    void testRetrievalQueriesUseDescription() {
        when(verificationLoop.verify(any(), anyString(), anyString()))
                .thenReturn(VerificationOutcome.success("a + b", "rfl", 1));

        orchestrator.solve(DESCRIPTION, TEMPLATE);

        verify(retrieval).contextFor("Lean 4 planning strategy " + DESCRIPTION, 3);
        verify(retrieval).contextFor(startsWith("Lean 4 code proof " + DESCRIPTION), eq(5));
    }

    @Test
    void testSolveNeverReturnsNull() {
        when(planner.process(any())).thenThrow(new RuntimeException("down"));

        ProofSolution solution = orchestrator.solve(DESCRIPTION, TEMPLATE);

        assertNotNull(solution);
        assertEquals(ProofSolution.NO_IMPLEMENTATION, solution.getCode());
        assertEquals("sorry", solution.getProof());
        assertEquals(List.of("code", "proof"), List.copyOf(solution.toMap().keySet()));
    }
}
