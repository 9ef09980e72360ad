package com.example.SmartDairy.model;

import java.time.Instant;

public record DocumentSummary(
        String id,
        String fileName,
        String fileType,
        long fileSize,
        String category,
        Instant uploadedAt,
        long chunkCount
) {}
