package com.ai.assistant.controller;

import com.ai.assistant.dto.ChatRequest;
import com.ai.assistant.dto.ChatResponse;
import com.ai.assistant.dto.TranscriptMessageDto;
import com.ai.assistant.dto.TurnDto;
import com.ai.assistant.service.ChatService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        if (request == null || StringUtils.isBlank(request.getMessage())) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(chatService.chat(request.getSessionId(), request.getMessage(), request.getRefineQuery()));
    }

    @PostMapping("/{sessionId}/reset")
    public Map<String, String> reset(@PathVariable String sessionId) {
        chatService.reset(sessionId);
        return Map.of("sessionId", sessionId, "state", "IDLE");
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        return chatService.endSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/{sessionId}/history")
    public List<TurnDto> history(@PathVariable String sessionId) {
        return chatService.history(sessionId);
    }

    @GetMapping("/{sessionId}/transcript")
    public List<TranscriptMessageDto> transcript(@PathVariable String sessionId) {
        return chatService.transcript(sessionId);
    }
}
