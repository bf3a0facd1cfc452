package com.proofsmith.core.compiler;

import com.proofsmith.core.task.ProofTask;

/**
 * External compiler boundary. Implementations write the source to a temporary file,
 * compile it and report the result; they never throw for compiler failures or timeouts.
 */
public interface ProofChecker {

    String IMPLEMENTATION_FILE = "ImplementationTest.lean";
    String FULL_SOLUTION_FILE  = "FullSolutionTest.lean";
    String SYNTAX_FILE         = "SyntaxTest.lean";

    CompilationResult execute(String source, String fileName);

    /** Implementation slot filled, proof slot set to {@code sorry}. */
    default CompilationResult testImplementationOnly(ProofTask task, String code) {
        return execute(task.renderImplementationOnly(code), IMPLEMENTATION_FILE);
    }

    default CompilationResult testFullSolution(ProofTask task, String code, String proof) {
        return execute(task.renderFull(code, proof), FULL_SOLUTION_FILE);
    }

    /** Compiles a standalone snippet with the Mathlib and Aesop imports prepended. */
    default CompilationResult validateSyntax(String snippet) {
        return execute("import Mathlib\nimport Aesop\n\n" + snippet + "\n", SYNTAX_FILE);
    }
}
