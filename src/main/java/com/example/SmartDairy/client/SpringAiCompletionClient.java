package com.example.SmartDairy.client;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link CompletionClient} backed by the Spring AI {@link ChatClient} built in
 * {@link com.example.SmartDairy.config.AiConfig}.
 */
@Component
@RequiredArgsConstructor
public class SpringAiCompletionClient implements CompletionClient {

    private final ChatClient chatClient;

    @Override
    public String complete(List<PromptMessage> messages, CompletionOptions options) {
        List<Message> prompt = messages.stream()
                .map(SpringAiCompletionClient::toMessage)
                .toList();

        ChatClient.ChatClientRequestSpec request = chatClient.prompt().messages(prompt);
        if (options != null && !options.isDefault()) {
            request = request.options(ChatOptions.builder()
                    .temperature(options.temperature())
                    .maxTokens(options.maxTokens())
                    .build());
        }

        String content = request.call().content();
        return content == null ? "" : content;
    }

    private static Message toMessage(PromptMessage message) {
        return switch (message.role()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
        };
    }
}
