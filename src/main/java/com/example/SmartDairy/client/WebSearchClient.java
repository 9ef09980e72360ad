package com.example.SmartDairy.client;

import com.example.SmartDairy.model.WebSearchResult;

import java.util.List;

/**
 * External web search capability. May return an empty list; failures are thrown as
 * {@link com.example.SmartDairy.exception.WebSearchException}.
 */
public interface WebSearchClient {

    List<WebSearchResult> search(String query, int count);
}
