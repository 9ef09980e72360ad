package com.example.SmartDairy.service;

import com.example.SmartDairy.exception.ChatProcessingException;
import com.example.SmartDairy.model.ChatRequest;
import com.example.SmartDairy.model.ChatResponse;
import com.example.SmartDairy.model.SynthesizedAnswer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Request-level driver for one chat query:
 * - Persist the user turn
 * - Route and answer via {@link ResponseSynthesizer}
 * - Persist the assistant turn with sources, strategy and timing
 * - Append the analytics row
 * - Touch the conversation and retitle it
 *
 * Retrieval paths absorb their own failures; whatever still escapes here (persistence, mostly)
 * is reported once as a {@link ChatProcessingException} and never retried.
 */
@Service
@RequiredArgsConstructor
public class ChatOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChatOrchestrator.class);

    private final ResponseSynthesizer responseSynthesizer;
    private final ChatSessionService chatSessionService;
    private final QueryLogService queryLogService;
    private final Clock clock;

    public ChatResponse handle(ChatRequest request) {
        if (request == null || !request.isComplete()) {
            throw new IllegalArgumentException("Message and sessionId are required");
        }

        long startedAt = clock.millis();
        try {
            chatSessionService.appendUserMessage(request.sessionId(), request.message());

            SynthesizedAnswer answer = responseSynthesizer.respond(request);
            double elapsedSeconds = (clock.millis() - startedAt) / 1000.0;

            chatSessionService.appendAssistantMessage(request.sessionId(), answer, elapsedSeconds);
            queryLogService.recordQuery(request, answer.strategy());
            chatSessionService.touch(request.sessionId(), request.message());

            log.debug("Answered session={} as {} in {}s", request.sessionId(), answer.strategy().label(), elapsedSeconds);
            return new ChatResponse(answer.text(), answer.sources(), answer.strategy());
        } catch (RuntimeException e) {
            log.error("Chat processing failed for session={}", request.sessionId(), e);
            throw new ChatProcessingException("Failed to process message", e);
        }
    }
}
