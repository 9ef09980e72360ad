package com.example.SmartDairy.service;

import com.example.SmartDairy.model.DocumentChunk;
import com.example.SmartDairy.model.ScoredChunk;

import java.util.List;

/**
 * Ranks candidate chunks against a query.
 * Implementations return only chunks with a positive score, best first, at most {@code limit}.
 */
public interface ChunkScorer {

    List<ScoredChunk> rank(String query, List<DocumentChunk> candidates, int limit);
}
