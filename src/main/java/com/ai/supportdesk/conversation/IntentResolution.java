package com.ai.supportdesk.conversation;

/**
 * Outcome of canonicalizing a message through the synonym groups.
 */
public final class IntentResolution {

    private final String original;
    private final String canonical;
    private final boolean normalized;

    public IntentResolution(String original, String canonical, boolean normalized) {
        this.original = original;
        this.canonical = canonical;
        this.normalized = normalized;
    }

    public String getOriginal() {
        return original;
    }

    public String getCanonical() {
        return canonical;
    }

    /** True when a synonym group supplied a representative different from the input. */
    public boolean isNormalized() {
        return normalized;
    }
}
