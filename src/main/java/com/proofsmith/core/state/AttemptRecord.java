package com.proofsmith.core.state;

/**
 * Immutable record of one Plan → Generate → Verify attempt.
 *
 * Appended to {@link WorkflowContext} exactly once per failed attempt and injected
 * into later Plan/Generate prompts as history.
 */
public final class AttemptRecord {

    private static final int PROMPT_ERROR_LIMIT = 500;

    private final int          index;
    private final String       code;
    private final String       proof;
    private final AttemptStage stage;
    private final String       error;

    private AttemptRecord(Builder b) {
        this.index = b.index;
        this.code  = b.code != null ? b.code : "";
        this.proof = b.proof != null ? b.proof : "";
        this.stage = b.stage;
        this.error = b.error;
    }

    public static AttemptRecord exception(int index, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return builder(index, AttemptStage.EXCEPTION).error(message).build();
    }

    // ----------------------------------------------------------------
    // Prompt rendering
    // ----------------------------------------------------------------

    /** Plain-text block for Plan/Generate prompt injection. */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("Attempt #").append(index).append("\n");
        sb.append("  Stage : ").append(stage.wireName()).append("\n");
        if (!code.isBlank()) {
            sb.append("  Code  : ").append(code.strip()).append("\n");
        }
        if (!proof.isBlank()) {
            sb.append("  Proof : ").append(proof.strip()).append("\n");
        }
        if (error != null && !error.isBlank()) {
            String trimmed = error.length() > PROMPT_ERROR_LIMIT
                    ? error.substring(0, PROMPT_ERROR_LIMIT) + " [...]"
                    : error;
            sb.append("  Error : ").append(trimmed.strip()).append("\n");
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public int          getIndex() { return index; }
    public String       getCode()  { return code; }
    public String       getProof() { return proof; }
    public AttemptStage getStage() { return stage; }

    /** Null when the attempt failed without diagnostic text. */
    public String       getError() { return error; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int index, AttemptStage stage) {
        return new Builder(index, stage);
    }

    public static final class Builder {
        private final int          index;
        private final AttemptStage stage;
        private String code  = "";
        private String proof = "";
        private String error = null;

        private Builder(int index, AttemptStage stage) {
            this.index = index;
            this.stage = stage;
        }

        public Builder code(String v)  { this.code = v;  return this; }
        public Builder proof(String v) { this.proof = v; return this; }
        public Builder error(String v) { this.error = v; return this; }

        public AttemptRecord build() { return new AttemptRecord(this); }
    }

    @Override
    public String toString() {
        return "AttemptRecord{#" + index + ", stage=" + stage + "}";
    }
}
