package com.example.SmartDairy.model;

public record SessionCreatedResponse(
        String sessionId,
        String title
) {}
