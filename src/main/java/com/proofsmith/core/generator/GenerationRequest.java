package com.proofsmith.core.generator;

import com.proofsmith.core.state.AttemptRecord;

import java.util.List;

public final class GenerationRequest {

    private final String              description;
    private final String              template;
    private final String              planText;
    private final String              retrievalContext;
    private final List<AttemptRecord> previousAttempts;
    private final int                 attemptNumber;

    public GenerationRequest(String description, String template, String planText,
                             String retrievalContext, List<AttemptRecord> previousAttempts,
                             int attemptNumber) {
        this.description      = description != null ? description : "";
        this.template         = template != null ? template : "";
        this.planText         = planText != null ? planText : "";
        this.retrievalContext = retrievalContext != null ? retrievalContext : "";
        this.previousAttempts = previousAttempts != null ? List.copyOf(previousAttempts) : List.of();
        this.attemptNumber    = attemptNumber;
    }

    public String getDescription() { return description; }

    public String getTemplate() { return template; }

    public String getPlanText() { return planText; }

    public String getRetrievalContext() { return retrievalContext; }

    public List<AttemptRecord> getPreviousAttempts() { return previousAttempts; }

    public int getAttemptNumber() { return attemptNumber; }
}
