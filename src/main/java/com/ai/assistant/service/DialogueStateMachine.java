package com.ai.assistant.service;

import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.ComplaintDraft;
import com.ai.assistant.conversation.ConversationContext;
import com.ai.assistant.conversation.DialogueState;
import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.conversation.Slot;
import com.ai.assistant.conversation.SlotType;
import com.ai.assistant.conversation.YesNoResult;
import com.ai.assistant.dto.ActionOutcome;
import com.ai.assistant.dto.DialogueAction;
import com.ai.assistant.service.signal.ComplaintIds;
import com.ai.assistant.service.signal.NlpSignals;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

/**
 * Complaint dialogue transitions. Given the session's context, the utterance and its intent, moves
 * the context to its next state and says what should happen next. Slot values are validated here;
 * collaborators are never called.
 */
@Service
public class DialogueStateMachine {

    private static final Logger log = LoggerFactory.getLogger(DialogueStateMachine.class);

    private static final Set<String> CANCEL_PHRASES = Set.of(
            "cancel", "stop", "never mind", "nevermind", "forget it", "quit", "abort", "exit", "cancel it", "cancel that"
    );
    private static final Set<String> RESET_PHRASES = Set.of(
            "reset", "start over", "restart", "clear conversation", "clear the conversation", "clear chat"
    );

    private final DialogueProperties properties;
    private final SlotValidator slotValidator;
    private final YesNoClassifier yesNoClassifier;
    private final QueryRefiner queryRefiner;
    private final ResponsePhrases phrases;

    public DialogueStateMachine(DialogueProperties properties,
                                SlotValidator slotValidator,
                                YesNoClassifier yesNoClassifier,
                                QueryRefiner queryRefiner,
                                ResponsePhrases phrases) {
        this.properties = properties;
        this.slotValidator = slotValidator;
        this.yesNoClassifier = yesNoClassifier;
        this.queryRefiner = queryRefiner;
        this.phrases = phrases;
    }

    public DialogueAction next(ConversationContext context, String utterance, IntentResult intent) {
        String text = StringUtils.trimToEmpty(utterance);
        IntentResult result = intent != null ? intent : IntentResult.unknown();
        DialogueState state = context.getState();

        if (isReset(text)) {
            log.info("[{}] Conversation reset requested", context.getSessionId());
            context.reset();
            return DialogueAction.reply(phrases.conversationReset());
        }
        if (!state.isIdle() && isCancel(text)) {
            log.info("[{}] Flow cancelled from {}", context.getSessionId(), state);
            context.setState(DialogueState.idle());
            return DialogueAction.reply(phrases.flowCancelled());
        }
        if (isTopicSwitch(state, result)) {
            log.info("[{}] Topic switch: {} -> {} ({})", context.getSessionId(), state, result.getLabel(),
                    String.format("%.2f", result.getConfidence()));
            context.setState(DialogueState.idle());
            return fromIdle(context, text, result).withNotice(phrases.flowAbandoned(state.flowIntent()));
        }

        switch (state.getPhase()) {
            case COLLECTING_COMPLAINT:
                return collect(context, text, result);
            case CONFIRM_PENDING:
                return confirm(context, text);
            case AWAITING_COMPLAINT_ID:
                return awaitComplaintId(context, text, result);
            case IDLE:
            default:
                return fromIdle(context, text, result);
        }
    }

    /**
     * Applies the outcome of a submit/fetch/retrieve action and returns the reply text for the turn.
     */
    public String complete(ConversationContext context, ActionOutcome outcome) {
        switch (outcome.getType()) {
            case SUBMITTED:
                if (context.getState().is(DialogueState.Phase.CONFIRM_PENDING)) {
                    context.setState(DialogueState.idle());
                }
                log.info("[{}] Complaint registered: {}", context.getSessionId(), outcome.getComplaintId());
                return phrases.complaintRegistered(outcome.getComplaintId());
            case SUBMIT_FAILED:
                return phrases.submitFailed();
            case FETCHED:
                return phrases.complaintDetails(outcome.getRecord());
            case NOT_FOUND:
                return phrases.complaintNotFound(outcome.getComplaintId());
            case FETCH_FAILED:
                return phrases.fetchFailed();
            case RETRIEVAL_FAILED:
                return phrases.retrievalFailed();
            case ANSWERED:
            default:
                return StringUtils.defaultIfBlank(outcome.getText(), phrases.noRelevantDocuments());
        }
    }

    private DialogueAction fromIdle(ConversationContext context, String text, IntentResult intent) {
        switch (intent.getLabel()) {
            case FILE_COMPLAINT:
                return startFiling(context, intent);
            case RETRIEVE_COMPLAINT: {
                String id = complaintId(text, intent);
                if (id != null) {
                    return DialogueAction.fetchComplaint(id);
                }
                context.setState(DialogueState.awaitingComplaintId());
                return DialogueAction.reply(phrases.askComplaintId());
            }
            case DOCUMENT_QUERY: {
                String query = queryRefiner.refine(text, context);
                return DialogueAction.retrieveDocuments(query);
            }
            case PROVIDE_SLOT_VALUE:
            case UNKNOWN:
            default:
                return DialogueAction.reply(text.isEmpty() ? phrases.couldYouRepeat() : phrases.clarify());
        }
    }

    private DialogueAction startFiling(ConversationContext context, IntentResult intent) {
        ComplaintDraft draft = context.startComplaint(properties.getRequiredSlots());
        for (int i = 0; i < draft.size(); i++) {
            Slot slot = draft.getSlot(i);
            String found = slot.getType() == SlotType.EMAIL ? intent.getSlot(NlpSignals.EMAIL)
                    : slot.getType() == SlotType.PHONE ? intent.getSlot(NlpSignals.PHONE)
                    : null;
            if (found == null) continue;
            SlotValidator.Result r = slotValidator.validate(slot.getType(), found);
            if (r.isValid()) {
                context.updateSlot(i, r.getValue());
                log.debug("[{}] Pre-filled slot {} from opening utterance", context.getSessionId(), slot.getName());
            }
        }
        if (draft.isComplete()) {
            context.setState(DialogueState.confirmPending());
            return DialogueAction.reply(phrases.confirmComplaint(draft.toFields()));
        }
        int first = draft.nextUnfilled(0);
        context.setState(DialogueState.collectingComplaint(first));
        log.info("[{}] Filing started, asking for {}", context.getSessionId(), draft.getSlot(first).getName());
        return DialogueAction.reply(phrases.startFiling(draft.getSlot(first).getDefinition()));
    }

    private DialogueAction collect(ConversationContext context, String text, IntentResult intent) {
        ComplaintDraft draft = context.getDraft();
        int cursor = context.getState().getCursor();
        Slot slot = draft.getSlot(cursor);

        if (intent.is(IntentLabel.FILE_COMPLAINT) && slot.getType() != SlotType.FREE_TEXT) {
            return DialogueAction.reply(phrases.alreadyFiling(slot.getDefinition()));
        }

        String candidate = StringUtils.defaultIfBlank(intent.getSlot(slot.getName()), text);
        SlotValidator.Result r = slotValidator.validate(slot.getType(), candidate);
        if (!r.isValid()) {
            log.info("[{}] Invalid value for slot {}", context.getSessionId(), slot.getName());
            return DialogueAction.reply(phrases.invalidSlot(slot.getDefinition()));
        }
        context.updateSlot(cursor, r.getValue());

        int next = draft.nextUnfilled(cursor + 1);
        if (next < 0) {
            context.setState(DialogueState.confirmPending());
            return DialogueAction.reply(phrases.confirmComplaint(draft.toFields()));
        }
        context.setState(DialogueState.collectingComplaint(next));
        return DialogueAction.reply(phrases.askSlot(draft.getSlot(next).getDefinition()));
    }

    private DialogueAction confirm(ConversationContext context, String text) {
        YesNoResult answer = yesNoClassifier.classify(text);
        if (answer == YesNoResult.YES) {
            log.info("[{}] Complaint confirmed, submitting", context.getSessionId());
            return DialogueAction.submitComplaint(context.getDraft().toFields());
        }
        if (answer == YesNoResult.NO) {
            context.setState(DialogueState.idle());
            return DialogueAction.reply(phrases.complaintDiscarded());
        }
        return DialogueAction.reply(phrases.confirmComplaint(context.getDraft().toFields()));
    }

    private DialogueAction awaitComplaintId(ConversationContext context, String text, IntentResult intent) {
        String id = complaintId(text, intent);
        if (id == null) {
            return DialogueAction.reply(phrases.invalidComplaintId());
        }
        context.setState(DialogueState.idle());
        return DialogueAction.fetchComplaint(id);
    }

    /**
     * A different flow (or a document question) with enough confidence abandons the current one.
     */
    boolean isTopicSwitch(DialogueState state, IntentResult intent) {
        if (state.isIdle()) return false;
        IntentLabel label = intent.getLabel();
        if (label != IntentLabel.DOCUMENT_QUERY && !label.isComplaintFlow()) return false;
        if (label == state.flowIntent()) return false;
        return intent.getConfidence() >= properties.getTopicSwitchThreshold();
    }

    private static String complaintId(String text, IntentResult intent) {
        String id = intent.getSlot(NlpSignals.COMPLAINT_ID);
        if (id == null) id = ComplaintIds.find(text);
        return id != null && ComplaintIds.isWellFormed(id) ? id : null;
    }

    private static boolean isCancel(String text) {
        return CANCEL_PHRASES.contains(normalize(text));
    }

    private static boolean isReset(String text) {
        return RESET_PHRASES.contains(normalize(text));
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("[.!?]+$", "").trim();
    }
}
