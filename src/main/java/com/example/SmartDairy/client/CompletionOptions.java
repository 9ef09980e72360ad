package com.example.SmartDairy.client;

/**
 * Optional generation settings. Null fields keep the model defaults.
 */
public record CompletionOptions(
        Double temperature,
        Integer maxTokens
) {
    public static final CompletionOptions DEFAULTS = new CompletionOptions(null, null);

    /** Deterministic output for routing decisions. */
    public static final CompletionOptions DETERMINISTIC = new CompletionOptions(0.0, 16);

    public boolean isDefault() {
        return temperature == null && maxTokens == null;
    }
}
