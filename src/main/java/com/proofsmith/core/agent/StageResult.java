package com.proofsmith.core.agent;

/**
 * StageResult - tagged outcome of one stage call.
 *
 *   PARSED   - response matched the stage schema; value is the typed result
 *   FALLBACK - response did not parse; value was synthesized by the stage's fallback,
 *              detail says why
 *   FAILED   - the call itself failed (transport); no value, detail is the error
 *
 * Callers switch on {@link #getKind()} instead of probing for missing fields.
 */
public final class StageResult<T> {

    public enum Kind {
        PARSED,
        FALLBACK,
        FAILED
    }

    private final Kind   kind;
    private final T      value;
    private final String detail;
    private final String rawResponse;

    private StageResult(Kind kind, T value, String detail, String rawResponse) {
        this.kind        = kind;
        this.value       = value;
        this.detail      = detail != null ? detail : "";
        this.rawResponse = rawResponse != null ? rawResponse : "";
    }

    public static <T> StageResult<T> parsed(T value, String rawResponse) {
        return new StageResult<>(Kind.PARSED, value, null, rawResponse);
    }

    public static <T> StageResult<T> fallback(T value, String reason, String rawResponse) {
        return new StageResult<>(Kind.FALLBACK, value, reason, rawResponse);
    }

    public static <T> StageResult<T> failed(String error) {
        return new StageResult<>(Kind.FAILED, null, error, null);
    }

    public Kind getKind() { return kind; }

    /** True for PARSED and FALLBACK - a value is available. */
    public boolean hasValue() { return kind != Kind.FAILED; }

    public T getValue() {
        if (kind == Kind.FAILED) {
            throw new IllegalStateException("No value on a FAILED stage result: " + detail);
        }
        return value;
    }

    /** Fallback reason or failure message; empty for PARSED. */
    public String getDetail() { return detail; }

    public String getRawResponse() { return rawResponse; }

    @Override
    public String toString() {
        return "StageResult{" + kind + (detail.isEmpty() ? "" : ", " + detail) + "}";
    }
}
