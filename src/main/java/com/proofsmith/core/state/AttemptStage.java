package com.proofsmith.core.state;

/**
 * Furthest point an attempt reached, or where it stopped.
 *
 * PLANNING                    - planner call failed
 * GENERATION                  - generator call failed
 * IMPLEMENTATION_VERIFICATION - implementation did not compile and no repair was offered
 * PROOF_VERIFICATION          - implementation compiled, proof failed, no repair offered
 * VERIFICATION_TIMEOUT        - repair rounds exhausted
 * EXCEPTION                   - unexpected fault caught at the attempt boundary
 * SUCCESS                     - implementation and proof accepted by the compiler
 */
public enum AttemptStage {
    PLANNING,
    GENERATION,
    IMPLEMENTATION_VERIFICATION,
    PROOF_VERIFICATION,
    VERIFICATION_TIMEOUT,
    EXCEPTION,
    SUCCESS;

    /**
     * Failure stages that count as having reached proof-level verification when
     * ranking attempts. A timeout counts even if its last failing check was the
     * implementation check.
     */
    public boolean reachedProofLevel() {
        return this == PROOF_VERIFICATION || this == VERIFICATION_TIMEOUT;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
