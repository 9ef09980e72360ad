package com.example.SmartDairy.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

import lombok.Getter;
import lombok.Setter;

/**
 * Cached web search results for one exact query string.
 * Results and fetch timestamp are written together in a single row update.
 */
@Entity
@Table(name = "web_search_cache")
@Getter
@Setter
public class WebSearchCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 2000)
    private String query;

    @Column(name = "results", columnDefinition = "TEXT")
    private String resultsJson;

    private Instant searchedAt;

    private int hitCount;
}
