package com.proofsmith.core.verification;

import com.proofsmith.core.state.AttemptStage;

/**
 * Terminal state of one verification loop: SUCCESS, or one of
 * IMPLEMENTATION_VERIFICATION, PROOF_VERIFICATION, VERIFICATION_TIMEOUT with the
 * unrepaired error.
 */
public final class VerificationOutcome {

    private final AttemptStage stage;
    private final String       code;
    private final String       proof;
    private final String       error;
    private final int          roundsUsed;

    private VerificationOutcome(AttemptStage stage, String code, String proof, String error, int roundsUsed) {
        this.stage      = stage;
        this.code       = code;
        this.proof      = proof;
        this.error      = error;
        this.roundsUsed = roundsUsed;
    }

    public static VerificationOutcome success(String code, String proof, int roundsUsed) {
        return new VerificationOutcome(AttemptStage.SUCCESS, code, proof, null, roundsUsed);
    }

    public static VerificationOutcome failure(AttemptStage stage, String code, String proof,
                                              String error, int roundsUsed) {
        return new VerificationOutcome(stage, code, proof, error, roundsUsed);
    }

    public boolean isSuccess() { return stage == AttemptStage.SUCCESS; }

    public AttemptStage getStage() { return stage; }

    public String getCode() { return code; }

    public String getProof() { return proof; }

    /** Null on success. */
    public String getError() { return error; }

    public int getRoundsUsed() { return roundsUsed; }

    @Override
    public String toString() {
        return "VerificationOutcome{" + stage + ", rounds=" + roundsUsed + "}";
    }
}
