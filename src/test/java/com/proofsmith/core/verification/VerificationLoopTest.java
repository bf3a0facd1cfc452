package com.proofsmith.core.verification;

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class VerificationLoopTest {

    private static final ProofTask TASK = new ProofTask(
            "Add two natural numbers",
            "def add (a b : Nat) : Nat :=\n  {{code}}\n\ntheorem add_spec (a b : Nat) : add a b = a + b := by\n  {{proof}}");

    private final List<String> compiledFiles = new ArrayList<>();

    private VerifierAgent            verifier;
    private RetrievalContextProvider retrieval;

    /** Implementation compiles when it contains good_code; the full file also needs good_proof. */
    private final ProofChecker checker = (source, fileName) -> {
        compiledFiles.add(fileName);
        boolean ok = source.contains("good_code")
                && (fileName.equals(ProofChecker.IMPLEMENTATION_FILE) || source.contains("good_proof"));
        return ok
                ? new CompilationResult(0, "", "", 5)
                : new CompilationResult(1, "", fileName + ": error: unsolved goals", 5);
    };

    @BeforeEach
    void setUp() {
        verifier  = mock(VerifierAgent.class);
        retrieval = mock(RetrievalContextProvider.class);
        when(retrieval.contextFor(anyString(), anyInt())).thenReturn("Source: tactics\nomega\n");
    }

    private VerificationLoop loop(int rounds) {
        return new VerificationLoop(checker, verifier, retrieval, new WorkflowLimits(5, rounds));
    }

    private static StageResult<RepairAdvice> advice(RepairAdvice advice) {
        return StageResult.parsed(advice, "{}");
    }

    @Test
    void testCorrectCandidatePassesInFirstRound() {
        VerificationOutcome outcome = loop(3).verify(TASK, "good_code", "good_proof");

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getRoundsUsed());
        assertNull(outcome.getError());
        assertEquals(List.of(ProofChecker.IMPLEMENTATION_FILE, ProofChecker.FULL_SOLUTION_FILE), compiledFiles);
        verifyNoInteractions(verifier);
    }

    @Test
    void testImplementationFailureWithoutCorrectionStops() {
        when(verifier.process(any())).thenReturn(advice(RepairAdvice.analysisOnly("type mismatch")));

        VerificationOutcome outcome = loop(3).verify(TASK, "bad", "good_proof");

        assertEquals(AttemptStage.IMPLEMENTATION_VERIFICATION, outcome.getStage());
        assertTrue(outcome.getError().contains("error: unsolved goals"));
        assertEquals(1, outcome.getRoundsUsed());
        assertEquals(List.of(ProofChecker.IMPLEMENTATION_FILE), compiledFiles);
    }

    @Test
    void testProofFailureWithoutCorrectionStops() {
        when(verifier.process(any())).thenReturn(advice(RepairAdvice.analysisOnly("goal not closed")));

        VerificationOutcome outcome = loop(3).verify(TASK, "good_code", "bad");

        assertEquals(AttemptStage.PROOF_VERIFICATION, outcome.getStage());
        assertEquals("good_code", outcome.getCode());
        assertEquals("bad", outcome.getProof());

        ArgumentCaptor<VerificationRequest> captor = ArgumentCaptor.forClass(VerificationRequest.class);
        verify(verifier).process(captor.capture());
        assertEquals(FailureKind.PROOF, captor.getValue().getFailureKind());
        assertTrue(captor.getValue().getErrorOutput().contains(ProofChecker.FULL_SOLUTION_FILE));
    }

    @Test
    void testUnavailableVerifierIsTreatedAsNoCorrection() {
        when(verifier.process(any())).thenReturn(StageResult.failed("Verification failed: timeout"));

        VerificationOutcome outcome = loop(3).verify(TASK, "bad", "bad");

        assertEquals(AttemptStage.IMPLEMENTATION_VERIFICATION, outcome.getStage());
    }

    @Test
    void testCodeThenProofCorrectionsReachSuccess() {
        when(verifier.process(any()))
                .thenReturn(advice(RepairAdvice.correction("good_code", null, "fix body")))
                .thenReturn(advice(RepairAdvice.correction(null, "good_proof", "fix tactic")));

        VerificationOutcome outcome = loop(3).verify(TASK, "bad", "bad");

        assertTrue(outcome.isSuccess());
        assertEquals(3, outcome.getRoundsUsed());
        assertEquals("good_code", outcome.getCode());
        assertEquals("good_proof", outcome.getProof());
        verify(verifier, times(2)).process(any());
    }

    @Test
    void testCombinedCorrectionAppliesBothParts() {
        when(verifier.process(any()))
                .thenReturn(advice(RepairAdvice.correction("good_code", "good_proof", "rewrite")));

        VerificationOutcome outcome = loop(3).verify(TASK, "bad", "bad");

        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.getRoundsUsed());
    }

    @Test
    void testCorrectionInLastRoundEndsInTimeout() {
        when(verifier.process(any())).thenReturn(advice(RepairAdvice.correction("still_bad", null, "try again")));

        VerificationOutcome outcome = loop(2).verify(TASK, "bad", "bad");

        assertEquals(AttemptStage.VERIFICATION_TIMEOUT, outcome.getStage());
        assertTrue(outcome.getError().startsWith(VerificationLoop.ROUNDS_EXHAUSTED));
        assertTrue(outcome.getError().contains("error: unsolved goals"));
        assertEquals(2, outcome.getRoundsUsed());
        assertEquals("still_bad", outcome.getCode());
        verify(verifier, times(2)).process(any());
    }

    @Test
    void testUnrepairedImplementationInLastRoundStaysAtImplementationStage() {
        when(verifier.process(any()))
                .thenReturn(advice(RepairAdvice.correction("still_bad", null, "try again")))
                .thenReturn(advice(RepairAdvice.analysisOnly("out of ideas")));

        VerificationOutcome outcome = loop(2).verify(TASK, "bad", "bad");

        assertEquals(AttemptStage.IMPLEMENTATION_VERIFICATION, outcome.getStage());
        assertFalse(outcome.getStage().reachedProofLevel());
        assertEquals(2, outcome.getRoundsUsed());
        assertEquals("still_bad", outcome.getCode());
    }

    @Test
    void testCheckerCallsAreBoundedByRounds() {
        when(verifier.process(any())).thenReturn(advice(RepairAdvice.correction("good_code", "bad", "partial")));

        VerificationOutcome outcome = loop(3).verify(TASK, "good_code", "bad");

        assertEquals(AttemptStage.VERIFICATION_TIMEOUT, outcome.getStage());
        assertTrue(compiledFiles.size() <= 2 * 3);
        assertEquals(6, compiledFiles.size());
    }

    @Test
    void testRepairQueryMentionsFailureKind() {
        when(verifier.process(any())).thenReturn(advice(RepairAdvice.analysisOnly("")));

        loop(3).verify(TASK, "bad", "bad");

        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(retrieval).contextFor(query.capture(), eq(3));
        assertTrue(query.getValue().startsWith("Lean 4 error debugging implementation"));
    }
}
