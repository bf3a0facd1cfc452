package com.proofsmith.core.task;

/**
 * A theorem-proving task: natural-language description plus a Lean template with
 * exactly two slots, {@code {{code}}} and {@code {{proof}}}.
 *
 * The template is not validated here. A template missing a slot simply renders
 * without that substitution and fails downstream at the compiler.
 */
public final class ProofTask {

    public static final String CODE_SLOT  = "{{code}}";
    public static final String PROOF_SLOT = "{{proof}}";

    /** Unproved-obligation marker; Lean accepts it syntactically. */
    public static final String PLACEHOLDER_PROOF = "sorry";

    private final String description;
    private final String template;

    public ProofTask(String description, String template) {
        this.description = description != null ? description : "";
        this.template    = template != null ? template : "";
    }

    public String getDescription() {
        return description;
    }

    public String getTemplate() {
        return template;
    }

    public boolean hasBothSlots() {
        return template.contains(CODE_SLOT) && template.contains(PROOF_SLOT);
    }

    /** Template with the implementation filled in and the proof left as {@code sorry}. */
    public String renderImplementationOnly(String code) {
        return render(template, code, PLACEHOLDER_PROOF);
    }

    public String renderFull(String code, String proof) {
        return render(template, code, proof);
    }

    public static String render(String template, String code, String proof) {
        return template
                .replace(CODE_SLOT, code != null ? code : "")
                .replace(PROOF_SLOT, proof != null ? proof : "");
    }
}
