package com.proofsmith.core.verifier;

import java.util.Locale;

/** Which compiler check produced the error being repaired. */
public enum FailureKind {
    IMPLEMENTATION,
    PROOF;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
