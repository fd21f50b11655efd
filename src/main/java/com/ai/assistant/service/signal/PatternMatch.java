package com.ai.assistant.service.signal;

import com.ai.assistant.conversation.IntentLabel;

/**
 * Outcome of exact pattern matching: whether a template fired, for which intent, and which one.
 */
public final class PatternMatch {

    private static final PatternMatch NONE = new PatternMatch(false, null, null);

    private final boolean matched;
    private final IntentLabel label;
    private final String template;

    private PatternMatch(boolean matched, IntentLabel label, String template) {
        this.matched = matched;
        this.label = label;
        this.template = template;
    }

    public static PatternMatch of(IntentLabel label, String template) {
        return new PatternMatch(true, label, template);
    }

    public static PatternMatch none() {
        return NONE;
    }

    public boolean isMatched() {
        return matched;
    }

    public IntentLabel getLabel() {
        return label;
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public String toString() {
        return matched ? "PatternMatch(" + label + ", /" + template + "/)" : "PatternMatch(none)";
    }
}
