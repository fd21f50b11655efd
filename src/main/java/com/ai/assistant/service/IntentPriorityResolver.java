package com.ai.assistant.service;

import com.ai.assistant.conversation.IntentResult;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks one intent when several detectors fired. Source rank decides first (pattern, then
 * fuzzy, then NLP); confidence only breaks ties within one source.
 */
@Service
public class IntentPriorityResolver {

    private static final Comparator<IntentResult> PRIORITY = Comparator
            .comparingInt((IntentResult r) -> r.getSource().ordinal())
            .thenComparing(Comparator.comparingDouble(IntentResult::getConfidence).reversed());

    public Optional<IntentResult> resolve(Collection<IntentResult> candidates) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();
        return candidates.stream()
                .filter(r -> r != null)
                .min(PRIORITY);
    }

    /** True when the candidates disagree on the label. */
    public boolean hasConflict(Collection<IntentResult> candidates) {
        if (candidates == null) return false;
        return candidates.stream().map(IntentResult::getLabel).distinct().count() > 1;
    }
}
