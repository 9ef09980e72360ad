package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.PromptMessage;
import com.example.SmartDairy.client.WebSearchClient;
import com.example.SmartDairy.config.SmartDairyProperties;
import com.example.SmartDairy.exception.WebSearchException;
import com.example.SmartDairy.model.AgentAnswer;
import com.example.SmartDairy.model.SourceReference;
import com.example.SmartDairy.model.WebSearchCacheEntry;
import com.example.SmartDairy.model.WebSearchResult;
import com.example.SmartDairy.repository.WebSearchCacheRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Web lookup path with a time-bounded result cache keyed by the exact query string.
 *
 * <p>Within the freshness window a cached entry is reused and its hit counter incremented.
 * Past the window (or on first use) the external search runs again and the entry's results,
 * timestamp and hit counter (reset to 1) are replaced in one save.</p>
 *
 * <p>Fresh fetches are single-flight per query inside this JVM: concurrent callers for the
 * same query wait for the in-flight search and count as cache hits. Separate application
 * instances can still race between the freshness check and the write, which at worst causes
 * one duplicate search.</p>
 */
@Service
public class WebSearchCacheService {

    private static final Logger log = LoggerFactory.getLogger(WebSearchCacheService.class);

    static final String NO_RESULTS_MESSAGE = "I couldn't find any relevant information from web search. "
            + "Please try rephrasing your question or upload relevant documents.";

    private static final String SYSTEM_PROMPT = """
            You are a Smart Dairy AI assistant. \
            Use the web search results to provide accurate, up-to-date information about dairy farming.""";

    private static final String EMPTY_COMPLETION = "I could not generate a response from the web search results.";

    private static final TypeReference<List<WebSearchResult>> RESULT_LIST = new TypeReference<>() {};

    private final WebSearchCacheRepository cacheRepository;
    private final WebSearchClient webSearchClient;
    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration freshness;
    private final int resultCount;
    private final String domainQualifier;

    private final ConcurrentMap<String, CompletableFuture<List<WebSearchResult>>> inFlight = new ConcurrentHashMap<>();

    public WebSearchCacheService(WebSearchCacheRepository cacheRepository,
                                 WebSearchClient webSearchClient,
                                 CompletionClient completionClient,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 SmartDairyProperties properties) {
        this.cacheRepository = cacheRepository;
        this.webSearchClient = webSearchClient;
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.freshness = properties.getWebSearch().getFreshness();
        this.resultCount = properties.getWebSearch().getResultCount();
        this.domainQualifier = properties.getWebSearch().getDomainQualifier();
    }

    public AgentAnswer lookup(String query) {
        try {
            List<WebSearchResult> results = cachedOrFetch(query);
            if (results.isEmpty()) {
                return AgentAnswer.withoutSources(NO_RESULTS_MESSAGE);
            }

            String context = results.stream()
                    .map(result -> result.title() + "\n" + result.snippet())
                    .collect(Collectors.joining(DocumentRetrievalService.CONTEXT_DELIMITER));

            String answer = completionClient.complete(List.of(
                    PromptMessage.system(SYSTEM_PROMPT),
                    PromptMessage.user("Web Search Results:\n\n" + context
                            + "\n\nQuestion: " + query
                            + "\n\nProvide a comprehensive answer based on these search results.")
            ));

            List<SourceReference> sources = results.stream()
                    .map(result -> SourceReference.web(result.title(), result.url()))
                    .toList();
            return new AgentAnswer(answer == null || answer.isBlank() ? EMPTY_COMPLETION : answer, sources);
        } catch (RuntimeException e) {
            log.warn("Web lookup failed for query='{}': {}", query, e.getMessage());
            return AgentAnswer.withoutSources(searchFailureMessage(describe(e)));
        }
    }

    static String searchFailureMessage(String detail) {
        return "I encountered an error searching the web: " + detail + ". Please try again later.";
    }

    /**
     * Results for the query, served from the cache while fresh.
     */
    List<WebSearchResult> cachedOrFetch(String query) {
        Optional<WebSearchCacheEntry> cached = cacheRepository.findByQuery(query);
        if (cached.isPresent() && isFresh(cached.get())) {
            Optional<List<WebSearchResult>> results = readResults(cached.get());
            if (results.isPresent()) {
                cacheRepository.incrementHitCount(query);
                log.debug("Web search cache hit for query='{}'", query);
                return results.get();
            }
        }
        return fetchSingleFlight(query);
    }

    private boolean isFresh(WebSearchCacheEntry entry) {
        Instant searchedAt = entry.getSearchedAt();
        if (searchedAt == null) {
            return false;
        }
        return Duration.between(searchedAt, clock.instant()).compareTo(freshness) < 0;
    }

    private List<WebSearchResult> fetchSingleFlight(String query) {
        CompletableFuture<List<WebSearchResult>> mine = new CompletableFuture<>();
        CompletableFuture<List<WebSearchResult>> existing = inFlight.putIfAbsent(query, mine);
        if (existing != null) {
            List<WebSearchResult> shared = await(existing);
            cacheRepository.incrementHitCount(query);
            return shared;
        }

        try {
            List<WebSearchResult> fresh = fetchAndStore(query);
            mine.complete(fresh);
            return fresh;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(query, mine);
        }
    }

    private List<WebSearchResult> fetchAndStore(String query) {
        List<WebSearchResult> found = webSearchClient.search(domainQualifier + " " + query, resultCount);
        List<WebSearchResult> results = found == null ? List.of() : List.copyOf(found);
        log.info("Fetched {} web results for query='{}'", results.size(), query);

        String json;
        try {
            json = objectMapper.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize web results, not caching query='{}'", query, e);
            return results;
        }

        WebSearchCacheEntry entry = cacheRepository.findByQuery(query).orElseGet(() -> {
            WebSearchCacheEntry created = new WebSearchCacheEntry();
            created.setQuery(query);
            return created;
        });
        entry.setResultsJson(json);
        entry.setSearchedAt(clock.instant());
        entry.setHitCount(1);
        try {
            cacheRepository.save(entry);
        } catch (RuntimeException e) {
            // another instance may have inserted the same query concurrently
            log.warn("Could not cache web results for query='{}': {}", query, e.getMessage());
        }
        return results;
    }

    private Optional<List<WebSearchResult>> readResults(WebSearchCacheEntry entry) {
        if (entry.getResultsJson() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(List.copyOf(objectMapper.readValue(entry.getResultsJson(), RESULT_LIST)));
        } catch (JsonProcessingException e) {
            log.warn("Cached web results for query='{}' are unreadable, refetching", entry.getQuery(), e);
            return Optional.empty();
        }
    }

    private static List<WebSearchResult> await(CompletableFuture<List<WebSearchResult>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new WebSearchException("shared web search failed", e.getCause());
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
