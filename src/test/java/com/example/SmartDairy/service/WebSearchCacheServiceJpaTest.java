package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.WebSearchClient;
import com.example.SmartDairy.config.SmartDairyProperties;
import com.example.SmartDairy.model.AgentAnswer;
import com.example.SmartDairy.model.WebSearchCacheEntry;
import com.example.SmartDairy.model.WebSearchResult;
import com.example.SmartDairy.repository.WebSearchCacheRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Cache behaviour against the real table, including the hit counter update query.
 */
@DataJpaTest
class WebSearchCacheServiceJpaTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    @Autowired
    private WebSearchCacheRepository cacheRepository;

    private WebSearchClient webSearchClient;
    private MutableClock clock;
    private WebSearchCacheService service;

    @BeforeEach
    void setUp() {
        webSearchClient = mock(WebSearchClient.class);
        CompletionClient completionClient = mock(CompletionClient.class);
        when(completionClient.complete(anyList())).thenReturn("New pricing rules take effect in June.");
        when(webSearchClient.search(anyString(), anyInt())).thenReturn(List.of(
                new WebSearchResult("Milk pricing reform", "https://example.org/reform", "Key dates for producers")));

        clock = new MutableClock(START);
        service = new WebSearchCacheService(cacheRepository, webSearchClient, completionClient,
                new ObjectMapper(), clock, new SmartDairyProperties());
    }

    @Test
    void repeatedQueryWithinWindowReusesCachedResults() {
        AgentAnswer first = service.lookup("latest dairy regulations");
        assertEquals(1, hitCount("latest dairy regulations"));

        clock.advance(Duration.ofMinutes(10));
        AgentAnswer second = service.lookup("latest dairy regulations");

        assertEquals(first.text(), second.text());
        assertEquals(first.sources(), second.sources());
        assertEquals(2, hitCount("latest dairy regulations"));
        verify(webSearchClient, times(1)).search(anyString(), anyInt());
    }

    @Test
    void staleEntryIsRefreshedInPlace() {
        service.lookup("latest dairy regulations");
        clock.advance(Duration.ofMinutes(5));
        service.lookup("latest dairy regulations");
        assertEquals(2, hitCount("latest dairy regulations"));

        clock.advance(Duration.ofSeconds(3600));
        service.lookup("latest dairy regulations");

        WebSearchCacheEntry entry = cacheRepository.findByQuery("latest dairy regulations").orElseThrow();
        assertEquals(1, entry.getHitCount());
        assertEquals(START.plus(Duration.ofMinutes(5)).plusSeconds(3600), entry.getSearchedAt());
        assertEquals(1, cacheRepository.count());
        verify(webSearchClient, times(2)).search("dairy farming latest dairy regulations", 5);
    }

    @Test
    void queriesAreCachedByExactText() {
        service.lookup("latest dairy regulations");
        service.lookup("Latest dairy regulations");

        assertEquals(2, cacheRepository.count());
        verify(webSearchClient, times(2)).search(anyString(), anyInt());
    }

    private int hitCount(String query) {
        return cacheRepository.findByQuery(query).orElseThrow().getHitCount();
    }
}
