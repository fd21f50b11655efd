package com.ai.assistant.service;

import com.ai.assistant.conversation.ConversationContext;
import com.ai.assistant.conversation.ConversationTurn;
import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.dto.ActionOutcome;
import com.ai.assistant.dto.ChatResponse;
import com.ai.assistant.dto.ComplaintRecord;
import com.ai.assistant.dto.DialogueAction;
import com.ai.assistant.dto.RetrievedDocument;
import com.ai.assistant.dto.TranscriptMessageDto;
import com.ai.assistant.dto.TurnDto;
import com.ai.assistant.entity.ConversationMessage;
import com.ai.assistant.exception.BackendFailureException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs a chat turn end to end: the dialogue engine decides, this class carries out the action
 * against the complaint service, retriever and answer generator, then reports the outcome back.
 * The session lock is held for the whole turn.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final ConversationOrchestrator orchestrator;
    private final ConversationContextStore store;
    private final ComplaintBackendClient complaintClient;
    private final DocumentRetriever documentRetriever;
    private final AnswerGenerator answerGenerator;
    private final TranscriptService transcriptService;
    private final int topK;

    public ChatService(ConversationOrchestrator orchestrator,
                       ConversationContextStore store,
                       ComplaintBackendClient complaintClient,
                       DocumentRetriever documentRetriever,
                       AnswerGenerator answerGenerator,
                       TranscriptService transcriptService,
                       @Value("${assistant.retrieval.top-k:2}") int topK) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.complaintClient = complaintClient;
        this.documentRetriever = documentRetriever;
        this.answerGenerator = answerGenerator;
        this.transcriptService = transcriptService;
        this.topK = topK;
    }

    public ChatResponse chat(String sessionId, String message, Boolean refineQuery) {
        String sid = StringUtils.isBlank(sessionId) ? UUID.randomUUID().toString() : sessionId;
        return store.withSession(sid, context -> {
            if (refineQuery != null) {
                context.setRefinementEnabled(refineQuery);
            }
            DialogueAction action = orchestrator.handleTurn(sid, message);
            String reply = action.is(DialogueAction.Type.REPLY) ? action.getText() : execute(sid, context, action);
            if (StringUtils.isNotBlank(action.getNotice())) {
                reply = action.getNotice() + " " + reply;
            }

            IntentLabel label = action.getIntent() != null ? action.getIntent().getLabel() : IntentLabel.UNKNOWN;
            transcriptService.recordUser(sid, StringUtils.defaultString(message), label);
            transcriptService.recordAssistant(sid, reply, label);

            return ChatResponse.builder()
                    .sessionId(sid)
                    .reply(reply)
                    .action(action.getType().name())
                    .intent(label.name())
                    .confidence(action.getIntent() != null ? action.getIntent().getConfidence() : 0.0)
                    .state(context.getState().toString())
                    .retrievalQuery(action.getQuery())
                    .build();
        });
    }

    public void reset(String sessionId) {
        orchestrator.reset(sessionId);
    }

    public boolean endSession(String sessionId) {
        return orchestrator.endSession(sessionId);
    }

    public List<TurnDto> history(String sessionId) {
        return orchestrator.history(sessionId).stream()
                .map(ChatService::toDto)
                .collect(Collectors.toList());
    }

    /** Every persisted message of the session, oldest first. Survives session end and idle eviction. */
    public List<TranscriptMessageDto> transcript(String sessionId) {
        return transcriptService.transcript(sessionId).stream()
                .map(ChatService::toDto)
                .collect(Collectors.toList());
    }

    private String execute(String sessionId, ConversationContext context, DialogueAction action) {
        ActionOutcome outcome;
        switch (action.getType()) {
            case SUBMIT_COMPLAINT:
                outcome = submit(sessionId, action);
                break;
            case FETCH_COMPLAINT:
                outcome = fetch(sessionId, action.getComplaintId());
                break;
            case RETRIEVE_DOCUMENTS:
            default:
                outcome = answer(sessionId, action.getQuery(), context.getHistory());
                break;
        }
        return orchestrator.completeAction(sessionId, outcome).getText();
    }

    private ActionOutcome submit(String sessionId, DialogueAction action) {
        try {
            return ActionOutcome.submitted(complaintClient.submit(action.getFields()));
        } catch (BackendFailureException e) {
            log.warn("[{}] Complaint submission failed: {}", sessionId, e.getMessage());
            return ActionOutcome.submitFailed();
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error submitting complaint", sessionId, e);
            return ActionOutcome.submitFailed();
        }
    }

    private ActionOutcome fetch(String sessionId, String complaintId) {
        try {
            Optional<ComplaintRecord> record = complaintClient.fetch(complaintId);
            return record.map(ActionOutcome::fetched).orElseGet(() -> ActionOutcome.notFound(complaintId));
        } catch (BackendFailureException e) {
            log.warn("[{}] Complaint lookup failed for {}: {}", sessionId, complaintId, e.getMessage());
            return ActionOutcome.fetchFailed(complaintId);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error fetching complaint {}", sessionId, complaintId, e);
            return ActionOutcome.fetchFailed(complaintId);
        }
    }

    private ActionOutcome answer(String sessionId, String query, List<ConversationTurn> history) {
        try {
            List<RetrievedDocument> documents = documentRetriever.search(query, topK);
            if (documents.isEmpty()) {
                log.info("[{}] No documents for '{}'", sessionId, query);
                return ActionOutcome.answered(null);
            }
            return ActionOutcome.answered(answerGenerator.generate(query, documents, history));
        } catch (BackendFailureException e) {
            log.warn("[{}] Document answer failed for '{}': {}", sessionId, query, e.getMessage());
            return ActionOutcome.retrievalFailed();
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error answering '{}'", sessionId, query, e);
            return ActionOutcome.retrievalFailed();
        }
    }

    private static TranscriptMessageDto toDto(ConversationMessage m) {
        return new TranscriptMessageDto(m.getRole(), m.getContent(), m.getIntent(), m.getCreatedAt());
    }

    private static TurnDto toDto(ConversationTurn t) {
        return new TurnDto(t.getUtterance(), t.getResponse(), t.getIntent().name(), t.getRetrievalQuery(), t.getTimestamp());
    }
}
