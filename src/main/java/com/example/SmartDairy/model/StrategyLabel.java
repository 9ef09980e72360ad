package com.example.SmartDairy.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routing decision for a single query. Exactly one label is resolved per query.
 */
public enum StrategyLabel {
    TABULAR_ANALYSIS("tabular_analysis"),
    DOCUMENT_RETRIEVAL("document_retrieval"),
    WEB_LOOKUP("web_lookup"),
    HYBRID("hybrid"),
    GENERAL("general");

    /** Older routing vocabulary still produced by some local models. */
    private static final Map<String, StrategyLabel> ALIASES = Map.of(
            "csv_analysis", TABULAR_ANALYSIS,
            "rag", DOCUMENT_RETRIEVAL,
            "web_search", WEB_LOOKUP
    );

    private final String label;

    StrategyLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parse a raw completion into a label.
     * Accepts a single token, case-insensitive, ignoring surrounding whitespace,
     * quotes and trailing punctuation. Anything else is rejected.
     */
    public static Optional<StrategyLabel> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String token = raw.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("^[\"'`*]+|[\"'`*.!,;:]+$", "");
        if (token.isEmpty()) {
            return Optional.empty();
        }
        for (StrategyLabel value : values()) {
            if (value.label.equals(token)) {
                return Optional.of(value);
            }
        }
        return Optional.ofNullable(ALIASES.get(token));
    }

    /**
     * Whether answering with this strategy performs a web lookup.
     */
    public boolean triggersWebSearch() {
        return this == WEB_LOOKUP || this == HYBRID;
    }
}
