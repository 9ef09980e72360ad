package com.example.SmartDairy.controller;

import com.example.SmartDairy.model.ChatMessage;
import com.example.SmartDairy.model.ChatRequest;
import com.example.SmartDairy.model.ChatResponse;
import com.example.SmartDairy.model.ChatSession;
import com.example.SmartDairy.model.SessionCreatedResponse;
import com.example.SmartDairy.service.ChatOrchestrator;
import com.example.SmartDairy.service.ChatSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatOrchestrator chatOrchestrator;
    private final ChatSessionService chatSessionService;

    /**
     * Answer one question.
     *    POST /api/chat
     *    {
     *      "message": "What is the average milk yield?",
     *      "sessionId": "...",
     *      "documents": ["docId"],
     *      "csvFiles": ["fileId"]
     *    }
     */
    @PostMapping
    public ChatResponse chat(@RequestBody ChatRequest request) {
        return chatOrchestrator.handle(request);
    }

    @PostMapping("/session")
    public SessionCreatedResponse createSession() {
        ChatSession session = chatSessionService.createSession();
        return new SessionCreatedResponse(session.getId(), session.getTitle());
    }

    @GetMapping("/session/{sessionId}/messages")
    public List<ChatMessage> messages(@PathVariable("sessionId") String sessionId) {
        return chatSessionService.listMessages(sessionId);
    }
}
