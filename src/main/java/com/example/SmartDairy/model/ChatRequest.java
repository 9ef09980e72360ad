package com.example.SmartDairy.model;

import java.util.List;

/**
 * Inbound chat query.
 *
 * @param message   user question
 * @param sessionId conversation the turn belongs to
 * @param documents ids of documents the user selected for this turn
 * @param csvFiles  ids of farm data files the user selected for this turn
 */
public record ChatRequest(
        String message,
        String sessionId,
        List<String> documents,
        List<String> csvFiles
) {
    public ChatRequest {
        documents = documents == null ? List.of() : List.copyOf(documents);
        csvFiles = csvFiles == null ? List.of() : List.copyOf(csvFiles);
    }

    public boolean isComplete() {
        return message != null && !message.isBlank()
                && sessionId != null && !sessionId.isBlank();
    }
}
