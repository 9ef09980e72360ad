package com.example.SmartDairy.model;

import java.util.List;

/**
 * Final answer for a query together with the strategy that produced it.
 */
public record SynthesizedAnswer(
        String text,
        List<SourceReference> sources,
        StrategyLabel strategy
) {
    public SynthesizedAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
