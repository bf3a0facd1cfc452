package com.proofsmith.core.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives a short, comparable signature from compiler error text so repeated
 * failure modes collapse to one entry in the accumulated signature set.
 */
public final class ErrorSignatures {

    static final int    LINES_SCANNED = 3;
    static final int    MAX_LENGTH    = 200;
    static final String ERROR_MARKER  = "error:";

    private ErrorSignatures() {}

    /**
     * Lines among the first three that contain {@code error:} (case-insensitive),
     * stripped and joined with {@code " | "}, capped at 200 characters.
     * Empty when no such line exists.
     */
    public static String extract(String error) {
        if (error == null || error.isBlank()) return "";

        String[] lines = error.split("\n", -1);
        List<String> parts = new ArrayList<>();

        for (int i = 0; i < Math.min(LINES_SCANNED, lines.length); i++) {
            if (lines[i].toLowerCase(Locale.ROOT).contains(ERROR_MARKER)) {
                parts.add(lines[i].strip());
            }
        }

        String signature = String.join(" | ", parts);
        return signature.length() > MAX_LENGTH ? signature.substring(0, MAX_LENGTH) : signature;
    }
}
