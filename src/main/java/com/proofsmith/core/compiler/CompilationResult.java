package com.proofsmith.core.compiler;

/**
 * CompilationResult - outcome of one compiler invocation.
 *
 * Fields:
 *   - success:   exit code 0
 *   - output:    standard output of the compiler
 *   - error:     standard error, or the timeout / launch-failure message
 *   - exitCode:  process exit code; -1 when timed out or not launched
 *   - elapsedMs: wall-clock time of the invocation
 */
public class CompilationResult {

    private final boolean success;
    private final String  output;
    private final String  error;
    private final int     exitCode;
    private final long    elapsedMs;

    public CompilationResult(int exitCode, String output, String error, long elapsedMs) {
        this.success   = exitCode == 0;
        this.output    = output != null ? output : "";
        this.error     = error != null ? error : "";
        this.exitCode  = exitCode;
        this.elapsedMs = elapsedMs;
    }

    public static CompilationResult timeout(int timeoutSeconds, String partialOutput, long elapsedMs) {
        return new CompilationResult(-1, partialOutput,
                "Execution timed out after " + timeoutSeconds + " seconds", elapsedMs);
    }

    public static CompilationResult failure(String message, long elapsedMs) {
        return new CompilationResult(-1, "", "Execution failed: " + message, elapsedMs);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public int getExitCode() {
        return exitCode;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    /**
     * Text handed to the repair stage. Lean reports most diagnostics on stdout, so
     * fall back to the output when stderr is empty.
     */
    public String getDiagnostics() {
        if (!error.isBlank()) return error;
        if (!output.isBlank()) return output;
        return success ? "" : "Compiler exited with code " + exitCode;
    }

    @Override
    public String toString() {
        return String.format(
            "CompilationResult{success=%s, exitCode=%d, outputLen=%d, errorLen=%d, elapsedMs=%d}",
            success,
            exitCode,
            output.length(),
            error.length(),
            elapsedMs
        );
    }
}
