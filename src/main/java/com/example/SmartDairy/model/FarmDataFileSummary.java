package com.example.SmartDairy.model;

import java.time.Instant;
import java.util.List;

public record FarmDataFileSummary(
        String id,
        String fileName,
        String fileType,
        int rowCount,
        List<String> columns,
        Instant uploadedAt
) {}
