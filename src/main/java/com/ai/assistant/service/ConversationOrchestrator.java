package com.ai.assistant.service;

import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.conversation.ConversationContext;
import com.ai.assistant.conversation.ConversationTurn;
import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.dto.ActionOutcome;
import com.ai.assistant.dto.DialogueAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Turn entry point: classify, transition, record. A reply finishes the turn at once; any other
 * action leaves the turn pending until {@link #completeAction} reports how it went.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final ConversationContextStore store;
    private final IntentClassifier intentClassifier;
    private final DialogueStateMachine stateMachine;
    private final ResponsePhrases phrases;

    public ConversationOrchestrator(ConversationContextStore store,
                                    IntentClassifier intentClassifier,
                                    DialogueStateMachine stateMachine,
                                    ResponsePhrases phrases) {
        this.store = store;
        this.intentClassifier = intentClassifier;
        this.stateMachine = stateMachine;
        this.phrases = phrases;
    }

    public DialogueAction handleTurn(String sessionId, String utterance) {
        return store.withSession(sessionId, context -> handleTurn(context, utterance));
    }

    private DialogueAction handleTurn(ConversationContext context, String utterance) {
        flushStalePendingTurn(context);
        String sessionId = context.getSessionId();

        IntentResult intent;
        DialogueAction action;
        try {
            intent = intentClassifier.classify(utterance, context);
            log.info("[{}] User: '{}' -> {} in {}", sessionId, utterance, intent, context.getState());
            action = stateMachine.next(context, utterance, intent);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to process turn", sessionId, e);
            intent = IntentResult.unknown();
            action = DialogueAction.reply(phrases.couldYouRepeat());
        }
        action = action.withIntent(intent);

        if (action.is(DialogueAction.Type.REPLY)) {
            context.appendTurn(new ConversationTurn(utterance, action.getText(), intent.getLabel(), null, Instant.now()));
            log.info("[{}] Assistant: {} (state {})", sessionId, action.getText(), context.getState());
        } else {
            String query = action.is(DialogueAction.Type.RETRIEVE_DOCUMENTS) ? action.getQuery() : null;
            context.stagePendingTurn(new ConversationContext.PendingTurn(utterance, intent.getLabel(), query));
            log.info("[{}] Action: {} (state {})", sessionId, action, context.getState());
        }
        return action;
    }

    /** Finishes the pending turn with the action's outcome and returns the reply for it. */
    public DialogueAction completeAction(String sessionId, ActionOutcome outcome) {
        return store.withSession(sessionId, context -> {
            String text = stateMachine.complete(context, outcome);
            ConversationContext.PendingTurn pending = context.takePendingTurn();
            if (pending == null) {
                log.warn("[{}] Outcome {} arrived with no pending turn", sessionId, outcome);
            } else {
                context.appendTurn(pending.complete(text));
            }
            log.info("[{}] Assistant: {} (state {})", sessionId, text, context.getState());
            return DialogueAction.reply(text);
        });
    }

    public void reset(String sessionId) {
        store.withSession(sessionId, context -> {
            context.reset();
            return null;
        });
        log.info("[{}] Context reset", sessionId);
    }

    public boolean endSession(String sessionId) {
        return store.remove(sessionId);
    }

    public List<ConversationTurn> history(String sessionId) {
        if (!store.contains(sessionId)) return List.of();
        return store.withSession(sessionId, ConversationContext::getHistory);
    }

    public void setRefinementEnabled(String sessionId, boolean enabled) {
        store.withSession(sessionId, context -> {
            context.setRefinementEnabled(enabled);
            return null;
        });
    }

    private void flushStalePendingTurn(ConversationContext context) {
        ConversationContext.PendingTurn stale = context.takePendingTurn();
        if (stale != null) {
            log.warn("[{}] Previous action never reported an outcome; closing that turn", context.getSessionId());
            context.appendTurn(stale.complete(""));
        }
    }
}
