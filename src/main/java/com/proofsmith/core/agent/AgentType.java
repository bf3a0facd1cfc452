package com.proofsmith.core.agent;

public enum AgentType {
    PLANNER,
    GENERATOR,
    VERIFIER
}
