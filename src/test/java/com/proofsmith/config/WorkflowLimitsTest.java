package com.proofsmith.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowLimitsTest {

    @Test
    void testAcceptsPositiveBounds() {
        WorkflowLimits limits = new WorkflowLimits(5, 3);

        assertEquals(5, limits.getMaxAttempts());
        assertEquals(3, limits.getMaxVerificationRounds());
    }

    @Test
    void testRejectsZeroBounds() {
        assertThrows(IllegalArgumentException.class, () -> new WorkflowLimits(0, 3));
        assertThrows(IllegalArgumentException.class, () -> new WorkflowLimits(5, 0));
    }
}
