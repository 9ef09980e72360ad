package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.CompletionOptions;
import com.example.SmartDairy.client.PromptMessage;
import com.example.SmartDairy.model.StrategyLabel;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks the answering strategy for a query by asking the model for a single label.
 * Never fails: errors and unrecognized output resolve to {@link StrategyLabel#GENERAL}.
 */
@Service
@RequiredArgsConstructor
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    private static final String SYSTEM_PROMPT = "You are a query routing assistant. Respond with ONLY one word.";

    private final CompletionClient completionClient;

    public StrategyLabel classify(String query, int documentCount, int tabularCount) {
        try {
            String raw = completionClient.complete(
                    List.of(PromptMessage.system(SYSTEM_PROMPT),
                            PromptMessage.user(buildPrompt(query, documentCount, tabularCount))),
                    CompletionOptions.DETERMINISTIC
            );
            Optional<StrategyLabel> label = StrategyLabel.parse(raw);
            if (label.isEmpty()) {
                log.warn("Unrecognized routing label '{}', answering as general", raw);
                return StrategyLabel.GENERAL;
            }
            return label.get();
        } catch (RuntimeException e) {
            log.warn("Query classification failed, answering as general: {}", e.getMessage());
            return StrategyLabel.GENERAL;
        }
    }

    private String buildPrompt(String query, int documentCount, int tabularCount) {
        return """
                Analyze this query and determine the best approach:

                Query: "%s"

                Available resources:
                - %d PDF documents (dairy manuals, scientific papers)
                - %d CSV/Excel files (farm data)

                Determine if the query needs:
                1. tabular_analysis: CSV/Excel farm data analysis (keywords: cow, milk, production, average, data, file, csv, excel, herd, yield)
                2. document_retrieval: answers from the uploaded documents (dairy farming domain knowledge)
                3. web_lookup: web search (current information, latest trends, regulations)
                4. hybrid: both documents and web search
                5. general: general chat (no specific resources needed)

                Respond with ONLY one word: tabular_analysis, document_retrieval, web_lookup, hybrid, or general"""
                .formatted(query, documentCount, tabularCount);
    }
}
