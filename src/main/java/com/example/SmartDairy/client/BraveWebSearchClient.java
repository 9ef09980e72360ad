package com.example.SmartDairy.client;

import com.example.SmartDairy.config.SmartDairyProperties;
import com.example.SmartDairy.exception.WebSearchException;
import com.example.SmartDairy.model.WebSearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link WebSearchClient} backed by the Brave Search web API.
 * Without an API key the client is disabled and returns no results.
 */
@Component
public class BraveWebSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(BraveWebSearchClient.class);

    private static final String SEARCH_PATH = "/res/v1/web/search";
    private static final String TOKEN_HEADER = "X-Subscription-Token";
    private static final int MAX_COUNT = 20;

    private static final AtomicBoolean LOGGED_MISSING_KEY = new AtomicBoolean(false);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public BraveWebSearchClient(SmartDairyProperties properties, RestTemplateBuilder restTemplateBuilder) {
        SmartDairyProperties.Brave brave = properties.getWebSearch().getBrave();
        this.baseUrl = trimTrailingSlash(brave.getBaseUrl());
        this.apiKey = brave.getApiKey();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(brave.getConnectTimeout())
                .readTimeout(brave.getReadTimeout())
                .build();
    }

    @Override
    public List<WebSearchResult> search(String query, int count) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        if (apiKey == null || apiKey.isBlank()) {
            if (LOGGED_MISSING_KEY.compareAndSet(false, true)) {
                log.warn("Brave search disabled: smartdairy.web-search.brave.api-key is not set");
            }
            return List.of();
        }

        int effectiveCount = Math.min(MAX_COUNT, Math.max(1, count));
        URI uri = UriComponentsBuilder.fromUriString(baseUrl + SEARCH_PATH)
                .queryParam("q", query)
                .queryParam("count", effectiveCount)
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(TOKEN_HEADER, apiKey);

        try {
            JsonNode body = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class)
                    .getBody();
            List<WebSearchResult> results = parseResults(body, effectiveCount);
            log.debug("Brave search returned {} results", results.size());
            return results;
        } catch (RestClientResponseException e) {
            throw new WebSearchException("search provider responded with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new WebSearchException("search provider unreachable: " + e.getMessage(), e);
        }
    }

    private static List<WebSearchResult> parseResults(JsonNode body, int limit) {
        if (body == null) {
            return List.of();
        }
        JsonNode items = body.path("web").path("results");
        if (!items.isArray()) {
            return List.of();
        }
        List<WebSearchResult> results = new ArrayList<>();
        for (JsonNode item : items) {
            if (results.size() >= limit) {
                break;
            }
            String url = item.path("url").asText("");
            if (url.isBlank()) {
                continue;
            }
            results.add(new WebSearchResult(
                    stripTags(item.path("title").asText(url)),
                    url,
                    stripTags(item.path("description").asText(""))
            ));
        }
        return List.copyOf(results);
    }

    /** Brave highlights matches with inline markup. */
    private static String stripTags(String text) {
        return text.replaceAll("<[^>]+>", "").trim();
    }

    private static String trimTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            return "https://api.search.brave.com";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
