package com.example.SmartDairy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "smartdairy")
public class SmartDairyProperties {

    private Retrieval retrieval = new Retrieval();
    private WebSearch webSearch = new WebSearch();
    private Tabular tabular = new Tabular();

    @Data
    public static class Retrieval {
        /** Max chunks loaded from the selected documents before scoring. */
        private int candidateLimit = 20;
        /** Chunks kept after ranking. */
        private int topK = 5;
    }

    @Data
    public static class WebSearch {
        /** Cached results younger than this are reused. */
        private Duration freshness = Duration.ofSeconds(3600);
        private int resultCount = 5;
        /** Prefixed to every outbound search so results stay on topic. */
        private String domainQualifier = "dairy farming";
        private Brave brave = new Brave();
    }

    @Data
    public static class Brave {
        private String baseUrl = "https://api.search.brave.com";
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Tabular {
        private String pythonCommand = "python3";
        private Duration timeout = Duration.ofSeconds(120);
        private String script = "tabular/analyze_farm_data.py";
    }
}
