package com.proofsmith.core.planner;

import com.proofsmith.core.state.AttemptRecord;

import java.util.List;
import java.util.Set;

public final class PlanRequest {

    private final String              description;
    private final String              template;
    private final List<AttemptRecord> previousAttempts;
    private final Set<String>         errorSignatures;
    private final String              retrievalContext;

    public PlanRequest(String description, String template, List<AttemptRecord> previousAttempts,
                       Set<String> errorSignatures, String retrievalContext) {
        this.description      = description;
        this.template         = template;
        this.previousAttempts = previousAttempts != null ? List.copyOf(previousAttempts) : List.of();
        this.errorSignatures  = errorSignatures != null ? Set.copyOf(errorSignatures) : Set.of();
        this.retrievalContext = retrievalContext != null ? retrievalContext : "";
    }

    public String getDescription() { return description; }

    public String getTemplate() { return template; }

    public List<AttemptRecord> getPreviousAttempts() { return previousAttempts; }

    public Set<String> getErrorSignatures() { return errorSignatures; }

    public String getRetrievalContext() { return retrievalContext; }
}
