package com.proofsmith.core.verifier;

public final class VerificationRequest {

    private final String      code;
    private final String      proof;
    private final String      errorOutput;
    private final FailureKind failureKind;
    private final String      retrievalContext;

    public VerificationRequest(String code, String proof, String errorOutput,
                               FailureKind failureKind, String retrievalContext) {
        this.code             = code != null ? code : "";
        this.proof            = proof != null ? proof : "";
        this.errorOutput      = errorOutput != null ? errorOutput : "";
        this.failureKind      = failureKind;
        this.retrievalContext = retrievalContext != null ? retrievalContext : "";
    }

    public String getCode() { return code; }

    public String getProof() { return proof; }

    public String getErrorOutput() { return errorOutput; }

    public FailureKind getFailureKind() { return failureKind; }

    public String getRetrievalContext() { return retrievalContext; }

    public boolean hasError() {
        return !errorOutput.isBlank();
    }
}
