package com.example.RagChat.controller;

import com.example.RagChat.model.ChatRequest;
import com.example.RagChat.model.ChatResponse;
import com.example.RagChat.service.ConversationOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final ConversationOrchestrator orchestrator;

    /**
     * One conversational turn. Blocked turns are regular 200 responses with {@code blocked=true}.
     *
     * POST /api/chat
     * {
     *   "userId": "alice",
     *   "query": "What is machine learning?"
     * }
     */
    @PostMapping("/chat")
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        return orchestrator.chat(request.userId(), request.query());
    }
}
