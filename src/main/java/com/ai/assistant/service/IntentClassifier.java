package com.ai.assistant.service;

import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.ConversationContext;
import com.ai.assistant.conversation.DialogueState;
import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.conversation.SignalSource;
import com.ai.assistant.conversation.Slot;
import com.ai.assistant.conversation.SlotType;
import com.ai.assistant.conversation.YesNoResult;
import com.ai.assistant.service.signal.ComplaintIds;
import com.ai.assistant.service.signal.FuzzyMatch;
import com.ai.assistant.service.signal.FuzzyMatcher;
import com.ai.assistant.service.signal.NlpExtractor;
import com.ai.assistant.service.signal.NlpSignals;
import com.ai.assistant.service.signal.PatternMatch;
import com.ai.assistant.service.signal.PatternMatcher;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fuses pattern, context, fuzzy and NLP signals into one {@link IntentResult}.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>an exact pattern fires: that label at 1.0;</li>
 *   <li>the dialogue is waiting for something and the utterance fits it: PROVIDE_SLOT_VALUE;</li>
 *   <li>fuzzy catalog score at or above the threshold;</li>
 *   <li>complaint keyword plus action verb: 0.6;</li>
 *   <li>nothing complaint-related: DOCUMENT_QUERY, else UNKNOWN at 0.3.</li>
 * </ol>
 * Reads the context but never changes it.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    public static final String CONFIRMATION_SLOT = "confirmation";

    static final double CONTEXT_CONFIDENCE = 1.0;
    static final double FREE_TEXT_CONFIDENCE = 0.9;
    static final double NLP_CONFIDENCE = 0.6;
    static final double QUESTION_CONFIDENCE = 0.9;
    static final double STATEMENT_CONFIDENCE = 0.6;
    static final double UNKNOWN_CONFIDENCE = 0.3;

    private final PatternMatcher patternMatcher;
    private final FuzzyMatcher fuzzyMatcher;
    private final NlpExtractor nlpExtractor;
    private final SlotValidator slotValidator;
    private final YesNoClassifier yesNoClassifier;
    private final IntentPriorityResolver priorityResolver;
    private final DialogueProperties properties;

    public IntentClassifier(PatternMatcher patternMatcher,
                            FuzzyMatcher fuzzyMatcher,
                            NlpExtractor nlpExtractor,
                            SlotValidator slotValidator,
                            YesNoClassifier yesNoClassifier,
                            IntentPriorityResolver priorityResolver,
                            DialogueProperties properties) {
        this.patternMatcher = patternMatcher;
        this.fuzzyMatcher = fuzzyMatcher;
        this.nlpExtractor = nlpExtractor;
        this.slotValidator = slotValidator;
        this.yesNoClassifier = yesNoClassifier;
        this.priorityResolver = priorityResolver;
        this.properties = properties;
    }

    public IntentResult classify(String utterance, ConversationContext context) {
        if (StringUtils.isBlank(utterance)) {
            return IntentResult.unknown();
        }
        String text = utterance.trim();
        NlpSignals nlp = nlpExtractor.extract(text);
        Map<String, String> entities = nlp.getEntities();

        PatternMatch pattern = patternMatcher.match(text);
        if (pattern.isMatched()) {
            return new IntentResult(pattern.getLabel(), 1.0, SignalSource.PATTERN, entities, pattern.getTemplate());
        }

        DialogueState state = context != null ? context.getState() : DialogueState.idle();
        IntentResult contextual = contextual(text, nlp, state, context);
        if (contextual != null) {
            return contextual;
        }

        List<IntentResult> candidates = new ArrayList<>();
        FuzzyMatch fuzzy = fuzzyMatcher.match(text);
        if (fuzzy.isMatch(properties.getFuzzyThreshold())) {
            candidates.add(new IntentResult(fuzzy.getLabel(), fuzzy.getScore(), SignalSource.FUZZY, entities, fuzzy.getPhrase()));
        }
        IntentLabel keywordIntent = nlp.getKeywordIntent();
        if (keywordIntent != null) {
            candidates.add(new IntentResult(keywordIntent, NLP_CONFIDENCE, SignalSource.NLP, entities, null));
        }
        if (priorityResolver.hasConflict(candidates)) {
            log.debug("Conflicting signals for '{}': {}", text, candidates);
        }
        Optional<IntentResult> resolved = priorityResolver.resolve(candidates);
        if (resolved.isPresent()) {
            return resolved.get();
        }

        if (!nlp.hasComplaintSignal()) {
            double confidence = nlp.isQuestion() ? QUESTION_CONFIDENCE : STATEMENT_CONFIDENCE;
            return new IntentResult(IntentLabel.DOCUMENT_QUERY, confidence, SignalSource.FALLBACK, entities, null);
        }
        log.debug("Ambiguous complaint-related utterance '{}': {}", text, nlp);
        return new IntentResult(IntentLabel.UNKNOWN, UNKNOWN_CONFIDENCE, SignalSource.FALLBACK, entities, null);
    }

    /** PROVIDE_SLOT_VALUE when the utterance fits what the current state is waiting for, else null. */
    private IntentResult contextual(String text, NlpSignals nlp, DialogueState state, ConversationContext context) {
        switch (state.getPhase()) {
            case COLLECTING_COMPLAINT: {
                if (context == null || !context.hasDraft()) return null;
                Slot awaited = context.getDraft().getSlot(state.getCursor());
                if (awaited.getType() == SlotType.FREE_TEXT) {
                    // a question only leaves the slot when it points at the documents
                    if (nlp.isQuestion() && nlp.hasDocumentReference() && !nlp.hasComplaintSignal()) return null;
                    return slotValue(awaited.getName(), text, FREE_TEXT_CONFIDENCE);
                }
                SlotValidator.Result r = slotValidator.validate(awaited.getType(), text);
                return r.isValid() ? slotValue(awaited.getName(), r.getValue(), CONTEXT_CONFIDENCE) : null;
            }
            case AWAITING_COMPLAINT_ID: {
                String id = nlp.getComplaintId() != null ? nlp.getComplaintId() : ComplaintIds.find(text);
                return id != null && ComplaintIds.isWellFormed(id)
                        ? slotValue(NlpSignals.COMPLAINT_ID, id, CONTEXT_CONFIDENCE)
                        : null;
            }
            case CONFIRM_PENDING: {
                YesNoResult yn = yesNoClassifier.classify(text);
                return yn == YesNoResult.UNKNOWN ? null : slotValue(CONFIRMATION_SLOT, yn.name(), CONTEXT_CONFIDENCE);
            }
            default:
                return null;
        }
    }

    private static IntentResult slotValue(String slot, String value, double confidence) {
        Map<String, String> slots = new HashMap<>();
        slots.put(slot, value);
        return new IntentResult(IntentLabel.PROVIDE_SLOT_VALUE, confidence, SignalSource.CONTEXT, slots, null);
    }
}
