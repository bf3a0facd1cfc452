package com.proofsmith.orchestrator;

import java.util.LinkedHashMap;
import java.util.Map;

/** The {code, proof} pair returned by the workflow entry point. Both are always non-null. */
public final class ProofSolution {

    public static final String NO_IMPLEMENTATION = "-- No implementation generated";

    private final String code;
    private final String proof;

    public ProofSolution(String code, String proof) {
        this.code  = code != null ? code : "";
        this.proof = proof != null ? proof : "";
    }

    public static ProofSolution placeholder() {
        return new ProofSolution(NO_IMPLEMENTATION, "sorry");
    }

    public String getCode() { return code; }

    public String getProof() { return proof; }

    public Map<String, String> toMap() {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("code",  code);
        result.put("proof", proof);
        return result;
    }

    @Override
    public String toString() {
        return "ProofSolution{code='" + code + "', proof='" + proof + "'}";
    }
}
