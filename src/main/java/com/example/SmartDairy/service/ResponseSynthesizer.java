package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.PromptMessage;
import com.example.SmartDairy.model.AgentAnswer;
import com.example.SmartDairy.model.ChatRequest;
import com.example.SmartDairy.model.SourcePriority;
import com.example.SmartDairy.model.SourceReference;
import com.example.SmartDairy.model.StrategyLabel;
import com.example.SmartDairy.model.SynthesizedAnswer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a query and runs the matching retrieval path(s):
 *  - tabular_analysis   -> {@link FarmDataAnalysisService}
 *  - document_retrieval -> {@link DocumentRetrievalService} (falls back to web lookup itself)
 *  - web_lookup         -> {@link WebSearchCacheService}
 *  - hybrid             -> documents and web in parallel, merged by one completion
 *  - general            -> a single completion without sources
 */
@Service
@RequiredArgsConstructor
public class ResponseSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseSynthesizer.class);

    private static final String GENERAL_PROMPT = """
            You are a helpful Smart Dairy AI assistant specializing in dairy farming. \
            Provide helpful, accurate information about dairy operations, breeding, nutrition, \
            management, and best practices.""";

    private static final String HYBRID_PROMPT = """
            You are a Smart Dairy AI assistant. \
            Combine information from both uploaded documents and web search to provide comprehensive answers.""";

    private static final String EMPTY_COMPLETION = "I could not generate a response.";

    private static final String DOCUMENT_PATH_FAILED = "I could not retrieve an answer from your documents.";

    private final QueryClassifier queryClassifier;
    private final DocumentRetrievalService documentRetrievalService;
    private final WebSearchCacheService webSearchCacheService;
    private final FarmDataAnalysisService farmDataAnalysisService;
    private final CompletionClient completionClient;

    public SynthesizedAnswer respond(ChatRequest request) {
        StrategyLabel strategy = queryClassifier.classify(
                request.message(),
                request.documents().size(),
                request.csvFiles().size()
        );
        log.info("Routing query as {} ({} documents, {} data files)",
                strategy.label(), request.documents().size(), request.csvFiles().size());

        AgentAnswer answer = execute(strategy, request);
        return new SynthesizedAnswer(answer.text(), answer.sources(), strategy);
    }

    AgentAnswer execute(StrategyLabel strategy, ChatRequest request) {
        String query = request.message();
        return switch (strategy) {
            case TABULAR_ANALYSIS -> farmDataAnalysisService.analyze(query, request.csvFiles());
            case DOCUMENT_RETRIEVAL -> documentRetrievalService.retrieve(query, request.documents());
            case WEB_LOOKUP -> webSearchCacheService.lookup(query);
            case HYBRID -> hybrid(query, request.documents());
            case GENERAL -> general(query);
        };
    }

    /**
     * Run both paths independently; neither failure aborts the other.
     * Document sources rank {@code high}, web sources {@code medium}.
     */
    private AgentAnswer hybrid(String query, List<String> documentIds) {
        Mono<AgentAnswer> documentMono = Mono.fromCallable(() -> documentRetrievalService.retrieve(query, documentIds))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Hybrid document path failed: {}", e.getMessage());
                    return Mono.just(AgentAnswer.withoutSources(DOCUMENT_PATH_FAILED));
                });

        Mono<AgentAnswer> webMono = Mono.fromCallable(() -> webSearchCacheService.lookup(query))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Hybrid web path failed: {}", e.getMessage());
                    return Mono.just(AgentAnswer.withoutSources(WebSearchCacheService.searchFailureMessage(
                            e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())));
                });

        Tuple2<AgentAnswer, AgentAnswer> results = Mono.zip(documentMono, webMono).block();
        AgentAnswer documentAnswer = results.getT1();
        AgentAnswer webAnswer = results.getT2();

        List<SourceReference> sources = new ArrayList<>();
        documentAnswer.sources().forEach(source -> sources.add(source.withPriority(SourcePriority.HIGH)));
        webAnswer.sources().forEach(source -> sources.add(source.withPriority(SourcePriority.MEDIUM)));

        String merged;
        try {
            merged = completionClient.complete(List.of(
                    PromptMessage.system(HYBRID_PROMPT),
                    PromptMessage.user("Document-based Answer:\n" + documentAnswer.text()
                            + "\n\nWeb Search Answer:\n" + webAnswer.text()
                            + "\n\nOriginal Question: " + query
                            + "\n\nSynthesize these answers into a comprehensive response "
                            + "that draws from both sources when applicable.")
            ));
        } catch (RuntimeException e) {
            log.warn("Hybrid synthesis failed, returning document answer: {}", e.getMessage());
            merged = null;
        }

        return new AgentAnswer(merged == null || merged.isBlank() ? documentAnswer.text() : merged, sources);
    }

    private AgentAnswer general(String query) {
        try {
            String answer = completionClient.complete(List.of(
                    PromptMessage.system(GENERAL_PROMPT),
                    PromptMessage.user(query)
            ));
            return AgentAnswer.withoutSources(answer == null || answer.isBlank() ? EMPTY_COMPLETION : answer);
        } catch (RuntimeException e) {
            log.warn("General completion failed: {}", e.getMessage());
            return AgentAnswer.withoutSources("I encountered an error generating a response: "
                    + e.getMessage() + ". Please try again later.");
        }
    }
}
