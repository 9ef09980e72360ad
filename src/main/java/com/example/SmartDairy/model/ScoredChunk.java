package com.example.SmartDairy.model;

/**
 * A document chunk with its lexical relevance score for one query. Never persisted.
 */
public record ScoredChunk(
        DocumentChunk chunk,
        int score
) {}
