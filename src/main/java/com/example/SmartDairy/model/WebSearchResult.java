package com.example.SmartDairy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebSearchResult(
        String title,
        String url,
        String snippet
) {}
