package com.example.SmartDairy.model;

import java.util.List;

public record ChatResponse(
        String response,
        List<SourceReference> sources,
        StrategyLabel queryType
) {}
