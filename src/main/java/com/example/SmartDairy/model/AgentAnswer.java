package com.example.SmartDairy.model;

import java.util.List;

/**
 * Output of one retrieval path: answer text plus the sources it was built from.
 */
public record AgentAnswer(
        String text,
        List<SourceReference> sources
) {
    public AgentAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static AgentAnswer withoutSources(String text) {
        return new AgentAnswer(text, List.of());
    }
}
