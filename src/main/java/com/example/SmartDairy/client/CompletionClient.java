package com.example.SmartDairy.client;

import java.util.List;

/**
 * Stateless text generation capability.
 * Failures surface as runtime exceptions; callers map them to their own fallbacks.
 */
public interface CompletionClient {

    String complete(List<PromptMessage> messages, CompletionOptions options);

    default String complete(List<PromptMessage> messages) {
        return complete(messages, CompletionOptions.DEFAULTS);
    }
}
