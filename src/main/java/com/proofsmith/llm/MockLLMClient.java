package com.proofsmith.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Offline stub: returns one minimal, schema-valid response per stage.
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    @Override
    public String complete(LLMRequest request) {
        return switch (request.getRole()) {
            case PLANNER -> """
                    {
                      "strategy": "Mock strategy: implement directly, prove by unfolding",
                      "implementation_steps": ["Write the function body"],
                      "proof_approach": "unfold the definition and close with simp",
                      "lean_concepts": ["def", "theorem"],
                      "potential_challenges": []
                    }
                    """;
            case GENERATOR -> """
                    {
                      "code": "a + b",
                      "proof": "rfl",
                      "explanation": "Mock solution"
                    }
                    """;
            case VERIFIER -> """
                    {
                      "error_analysis": "Mock analysis",
                      "suggested_fixes": [],
                      "confidence": 0.5
                    }
                    """;
        };
    }
}
