package com.example.SmartDairy.service;

import com.example.SmartDairy.exception.ResourceNotFoundException;
import com.example.SmartDairy.model.ChatMessage;
import com.example.SmartDairy.model.ChatSession;
import com.example.SmartDairy.model.SourceReference;
import com.example.SmartDairy.model.SynthesizedAnswer;
import com.example.SmartDairy.repository.ChatMessageRepository;
import com.example.SmartDairy.repository.ChatSessionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Conversations and their persisted turns.
 */
@Service
@RequiredArgsConstructor
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    static final int TITLE_MAX_LENGTH = 50;

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChatSession createSession() {
        ChatSession session = new ChatSession();
        session.setTitle(ChatSession.DEFAULT_TITLE);
        session.setCreatedAt(clock.instant());
        session.setUpdatedAt(session.getCreatedAt());
        return sessionRepository.save(session);
    }

    public ChatMessage appendUserMessage(String sessionId, String content) {
        ChatMessage message = new ChatMessage();
        message.setSessionId(sessionId);
        message.setRole(ChatMessage.ROLE_USER);
        message.setContent(content);
        message.setCreatedAt(clock.instant());
        return messageRepository.save(message);
    }

    public ChatMessage appendAssistantMessage(String sessionId, SynthesizedAnswer answer, double responseSeconds) {
        ChatMessage message = new ChatMessage();
        message.setSessionId(sessionId);
        message.setRole(ChatMessage.ROLE_ASSISTANT);
        message.setContent(answer.text());
        message.setSourcesJson(serializeSources(answer.sources()));
        message.setQueryType(answer.strategy());
        message.setResponseTime(responseSeconds);
        message.setCreatedAt(clock.instant());
        return messageRepository.save(message);
    }

    /**
     * Mark the conversation active and title it after the latest query.
     */
    public ChatSession touch(String sessionId, String query) {
        ChatSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Chat session not found: " + sessionId));
        session.setUpdatedAt(clock.instant());
        session.setTitle(deriveTitle(query));
        return sessionRepository.save(session);
    }

    public List<ChatMessage> listMessages(String sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new ResourceNotFoundException("Chat session not found: " + sessionId);
        }
        return messageRepository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId);
    }

    static String deriveTitle(String query) {
        if (query == null || query.isBlank()) {
            return ChatSession.DEFAULT_TITLE;
        }
        if (query.length() <= TITLE_MAX_LENGTH) {
            return query;
        }
        return query.substring(0, TITLE_MAX_LENGTH) + "...";
    }

    private String serializeSources(List<SourceReference> sources) {
        if (sources == null || sources.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize answer sources for chat message", e);
            return "[]";
        }
    }
}
