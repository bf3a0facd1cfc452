package com.proofsmith.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Upper bounds for the two nested retry loops: attempts per workflow run and
 * compiler-check/repair rounds per attempt.
 */
@Component
public class WorkflowLimits {

    private final int maxAttempts;
    private final int maxVerificationRounds;

    public WorkflowLimits(
            @Value("${proofsmith.workflow.max-attempts:5}") int maxAttempts,
            @Value("${proofsmith.workflow.max-verification-rounds:3}") int maxVerificationRounds
    ) {
        if (maxAttempts < 1 || maxVerificationRounds < 1) {
            throw new IllegalArgumentException(
                    "Workflow limits must be positive: attempts=" + maxAttempts
                            + ", rounds=" + maxVerificationRounds);
        }
        this.maxAttempts           = maxAttempts;
        this.maxVerificationRounds = maxVerificationRounds;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getMaxVerificationRounds() {
        return maxVerificationRounds;
    }
}
