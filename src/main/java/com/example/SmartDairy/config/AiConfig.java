package com.example.SmartDairy.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    /**
     * The single ChatClient used by every completion in the app.
     * DeepSeek wins when its model is active (spring.ai.model.chat=deepseek); otherwise the
     * OpenAI-compatible model, which in the default setup points at a local Ollama server.
     * Per-call instructions are supplied as system messages, so no default system prompt is set.
     */
    @Bean
    public ChatClient chatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            log.info("Using DeepSeek chat model for completions");
            return ChatClient.builder(deepseekModel).build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            log.info("Using OpenAI-compatible chat model for completions");
            return ChatClient.builder(openAiModel).build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
