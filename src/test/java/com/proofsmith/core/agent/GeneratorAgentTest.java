package com.proofsmith.core.agent;

import com.proofsmith.config.LlmSettings;
import com.proofsmith.core.generator.GeneratedSolution;
import com.proofsmith.core.generator.GenerationRequest;
import com.proofsmith.llm.LLMClient;
import com.proofsmith.llm.LLMTransportException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GeneratorAgentTest {

    private static final String TEMPLATE =
            "def minOfThree (a b c : Int) : Int :=\n  {{code}}\n\ntheorem spec : True := by\n  {{proof}}";

    private LLMClient      llm;
    private GeneratorAgent generator;

    @BeforeEach
    void setUp() {
        llm = mock(LLMClient.class);
        generator = new GeneratorAgent(llm, new LlmSettings("p", "g", "v", 2000));
    }

    private GenerationRequest request(String description) {
        return new GenerationRequest(description, TEMPLATE, "plan", "", List.of(), 1);
    }

    @Test
    void testParsesCodeAndProof() {
        when(llm.complete(any())).thenReturn("{\"code\": \"min a (min b c)\", \"proof\": \"simp\", \"explanation\": \"e\"}");

        StageResult<GeneratedSolution> result = generator.process(request("Find the minimum of three integers"));

        assertEquals(StageResult.Kind.PARSED, result.getKind());
        assertEquals("min a (min b c)", result.getValue().getCode());
        assertEquals("simp", result.getValue().getProof());
    }

    @Test
    void testMinimumOfThreeFallbackUsesConditionalAndDecisionProcedure() {
        when(llm.complete(any())).thenReturn("I think you should use if-then-else.");

        StageResult<GeneratedSolution> result =
                generator.process(request("Return the minimum of three integers a, b and c"));

        assertEquals(StageResult.Kind.FALLBACK, result.getKind());
        GeneratedSolution solution = result.getValue();
        assertEquals("if a <= b then if a <= c then a else c else if b <= c then b else c", solution.getCode());
        assertEquals("omega", solution.getProof());
        assertNotEquals("sorry", solution.getProof());
    }

    @Test
    void testMissingProofFallsBackToAdditionPattern() {
        when(llm.complete(any())).thenReturn("{\"code\": \"a + b\"}");

        StageResult<GeneratedSolution> result = generator.process(request("Add two numbers"));

        assertEquals(StageResult.Kind.FALLBACK, result.getKind());
        assertEquals("a + b", result.getValue().getCode());
        assertEquals("rfl", result.getValue().getProof());
    }

    @Test
    void testTransportFailureIsFailedResult() {
        when(llm.complete(any())).thenThrow(new LLMTransportException("down"));

        StageResult<GeneratedSolution> result = generator.process(request("Add two numbers"));

        assertEquals(StageResult.Kind.FAILED, result.getKind());
    }
}
