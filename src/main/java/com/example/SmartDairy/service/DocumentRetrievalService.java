package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.PromptMessage;
import com.example.SmartDairy.config.SmartDairyProperties;
import com.example.SmartDairy.model.AgentAnswer;
import com.example.SmartDairy.model.DocumentChunk;
import com.example.SmartDairy.model.FarmDocument;
import com.example.SmartDairy.model.ScoredChunk;
import com.example.SmartDairy.model.SourceReference;
import com.example.SmartDairy.repository.DocumentChunkRepository;
import com.example.SmartDairy.repository.FarmDocumentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Document retrieval path:
 * - Loads candidate chunks of the selected documents
 * - Ranks them with the {@link ChunkScorer}
 * - Answers from the best chunks only, citing each one
 *
 * When nothing relevant is found (no chunks, or every chunk scores zero) the query is
 * handed to the web lookup path and its answer is returned unchanged.
 */
@Service
@RequiredArgsConstructor
public class DocumentRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(DocumentRetrievalService.class);

    static final String CONTEXT_DELIMITER = "\n\n---\n\n";

    private static final String SYSTEM_PROMPT = """
            You are a Smart Dairy AI assistant specializing in dairy farming. \
            Use the provided document excerpts to answer the user's question accurately. \
            If the information is insufficient, acknowledge this limitation.""";

    private static final String EMPTY_COMPLETION = "I could not generate a response from the documents.";

    private final DocumentChunkRepository chunkRepository;
    private final FarmDocumentRepository documentRepository;
    private final ChunkScorer chunkScorer;
    private final WebSearchCacheService webSearchCacheService;
    private final CompletionClient completionClient;
    private final SmartDairyProperties properties;

    public AgentAnswer retrieve(String query, List<String> documentIds) {
        try {
            List<DocumentChunk> candidates = loadCandidates(documentIds);
            if (candidates.isEmpty()) {
                log.debug("Document retrieval: no chunks for documents {}, falling back to web lookup", documentIds);
                return webSearchCacheService.lookup(query);
            }

            List<ScoredChunk> ranked = chunkScorer.rank(query, candidates, properties.getRetrieval().getTopK());
            if (ranked.isEmpty()) {
                log.debug("Document retrieval: none of {} chunks matched, falling back to web lookup",
                        candidates.size());
                return webSearchCacheService.lookup(query);
            }
            log.debug("Document retrieval: kept {} of {} chunks (top score {})",
                    ranked.size(), candidates.size(), ranked.get(0).score());

            String answer = completionClient.complete(List.of(
                    PromptMessage.system(SYSTEM_PROMPT),
                    PromptMessage.user(buildPrompt(query, buildContext(ranked)))
            ));
            return new AgentAnswer(
                    answer == null || answer.isBlank() ? EMPTY_COMPLETION : answer,
                    toSources(ranked)
            );
        } catch (RuntimeException e) {
            log.warn("Document retrieval failed, falling back to web lookup: {}", e.getMessage());
            return webSearchCacheService.lookup(query);
        }
    }

    private List<DocumentChunk> loadCandidates(List<String> documentIds) {
        if (documentIds == null || documentIds.isEmpty()) {
            return List.of();
        }
        return chunkRepository.findByDocumentIdInOrderByDocumentIdAscChunkIndexAsc(
                documentIds,
                PageRequest.of(0, properties.getRetrieval().getCandidateLimit())
        );
    }

    /**
     * Join chunk texts in rank order, separated by {@link #CONTEXT_DELIMITER}.
     */
    String buildContext(List<ScoredChunk> ranked) {
        return ranked.stream()
                .map(scored -> scored.chunk().getContent())
                .collect(Collectors.joining(CONTEXT_DELIMITER));
    }

    private String buildPrompt(String query, String context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Context from dairy farm manuals and scientific papers:\n\n").append(context).append("\n\n");
        sb.append("Question: ").append(query).append("\n\n");
        sb.append("Provide a comprehensive answer based only on the context above. Cite sources when possible.");
        return sb.toString();
    }

    private List<SourceReference> toSources(List<ScoredChunk> ranked) {
        Set<String> documentIds = ranked.stream()
                .map(scored -> scored.chunk().getDocumentId())
                .collect(Collectors.toSet());
        Map<String, String> names = documentRepository.findAllById(documentIds).stream()
                .filter(document -> document.getFileName() != null)
                .collect(Collectors.toMap(FarmDocument::getId, FarmDocument::getFileName));

        return ranked.stream()
                .map(ScoredChunk::chunk)
                .map(chunk -> SourceReference.document(
                        names.getOrDefault(chunk.getDocumentId(), chunk.getDocumentId()),
                        chunk.getChunkIndex()))
                .toList();
    }
}
