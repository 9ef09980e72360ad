package com.example.SmartDairy.service;

import com.example.SmartDairy.model.DocumentChunk;
import com.example.SmartDairy.model.ScoredChunk;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Keyword scorer: a chunk scores one point for every query term found in its text.
 *
 * <p>Terms are the lower-cased, whitespace-separated words of the query. Each term is checked
 * once per chunk as a substring match, so term frequency inside the chunk does not matter but a
 * word repeated in the query counts once per repetition. Ties keep the candidates' input order.</p>
 */
@Component
public class LexicalChunkScorer implements ChunkScorer {

    @Override
    public List<ScoredChunk> rank(String query, List<DocumentChunk> candidates, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<String> terms = tokenize(query);
        if (terms.isEmpty()) {
            return List.of();
        }

        return candidates.stream()
                .map(chunk -> new ScoredChunk(chunk, score(terms, chunk.getContent())))
                .filter(scored -> scored.score() > 0)
                // Stream.sorted is stable for ordered streams
                .sorted(Comparator.comparingInt(ScoredChunk::score).reversed())
                .limit(limit)
                .toList();
    }

    static List<String> tokenize(String query) {
        if (query == null) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(term -> !term.isEmpty())
                .toList();
    }

    private static int score(List<String> terms, String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        String text = content.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            if (text.contains(term)) {
                score++;
            }
        }
        return score;
    }
}
