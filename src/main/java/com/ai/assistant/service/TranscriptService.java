package com.ai.assistant.service;

import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.entity.ConversationMessage;
import com.ai.assistant.repository.ConversationMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

/**
 * Audit trail of every chat message. Write failures are logged and never reach the turn.
 */
@Service
public class TranscriptService {

    private static final Logger log = LoggerFactory.getLogger(TranscriptService.class);

    static final int MAX_CONTENT = 4000;

    private final ConversationMessageRepository repository;

    public TranscriptService(ConversationMessageRepository repository) {
        this.repository = repository;
    }

    public void recordUser(String sessionId, String text, IntentLabel intent) {
        append(sessionId, "user", text, intent);
    }

    public void recordAssistant(String sessionId, String text, IntentLabel intent) {
        append(sessionId, "assistant", text, intent);
    }

    @Transactional(readOnly = true)
    public List<ConversationMessage> transcript(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return Collections.emptyList();
        return repository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId);
    }

    private void append(String sessionId, String role, String content, IntentLabel intent) {
        if (sessionId == null || content == null) return;
        try {
            repository.save(ConversationMessage.builder()
                    .sessionId(sessionId)
                    .role(role)
                    .content(content.length() > MAX_CONTENT ? content.substring(0, MAX_CONTENT) : content)
                    .intent(intent != null ? intent.name() : null)
                    .build());
        } catch (Exception e) {
            log.warn("[{}] Failed to persist {} message", sessionId, role, e);
        }
    }
}
