package com.ai.assistant.service.signal;

import com.ai.assistant.conversation.IntentLabel;

/**
 * Best catalog phrase for an utterance and its similarity in [0,1].
 */
public final class FuzzyMatch {

    private static final FuzzyMatch NONE = new FuzzyMatch(null, null, 0.0);

    private final IntentLabel label;
    private final String phrase;
    private final double score;

    public FuzzyMatch(IntentLabel label, String phrase, double score) {
        this.label = label;
        this.phrase = phrase;
        this.score = score;
    }

    public static FuzzyMatch none() {
        return NONE;
    }

    public IntentLabel getLabel() {
        return label;
    }

    public String getPhrase() {
        return phrase;
    }

    public double getScore() {
        return score;
    }

    public boolean isMatch(double threshold) {
        return label != null && score >= threshold;
    }

    @Override
    public String toString() {
        return label == null ? "FuzzyMatch(none)" : String.format("FuzzyMatch(%s, '%s', %.2f)", label, phrase, score);
    }
}
