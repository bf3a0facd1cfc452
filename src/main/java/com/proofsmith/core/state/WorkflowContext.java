package com.proofsmith.core.state;

import com.proofsmith.core.task.ProofTask;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * WorkflowContext - accumulated state of one workflow run.
 *
 * Immutable: {@link #withFailure(AttemptRecord)} returns a new context with the
 * record appended and its error signature added. History is append-only, in
 * chronological order; signatures are unique.
 *
 * Lifetime is one call to the orchestrator's entry point.
 */
public final class WorkflowContext {

    private final ProofTask           task;
    private final List<AttemptRecord> attempts;
    private final Set<String>         errorSignatures;

    private WorkflowContext(ProofTask task, List<AttemptRecord> attempts, Set<String> errorSignatures) {
        this.task            = task;
        this.attempts        = Collections.unmodifiableList(attempts);
        this.errorSignatures = Collections.unmodifiableSet(errorSignatures);
    }

    public static WorkflowContext start(ProofTask task) {
        return new WorkflowContext(task, new ArrayList<>(), new LinkedHashSet<>());
    }

    public WorkflowContext withFailure(AttemptRecord record) {
        List<AttemptRecord> nextAttempts = new ArrayList<>(attempts);
        nextAttempts.add(record);

        Set<String> nextSignatures = new LinkedHashSet<>(errorSignatures);
        String signature = ErrorSignatures.extract(record.getError());
        if (!signature.isEmpty()) {
            nextSignatures.add(signature);
        }

        return new WorkflowContext(task, nextAttempts, nextSignatures);
    }

    public ProofTask getTask() { return task; }

    public List<AttemptRecord> getAttempts() { return attempts; }

    /** The last {@code n} attempts, oldest first. */
    public List<AttemptRecord> recentAttempts(int n) {
        int from = Math.max(0, attempts.size() - n);
        return attempts.subList(from, attempts.size());
    }

    public Set<String> getErrorSignatures() { return errorSignatures; }

    public int attemptCount() { return attempts.size(); }
}
