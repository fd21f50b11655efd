package com.ai.assistant.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fused classification of one utterance: label, confidence, deciding detector and any slot values
 * extracted along the way.
 */
public final class IntentResult {

    private final IntentLabel label;
    private final double confidence;
    private final SignalSource source;
    private final Map<String, String> slots;
    private final String template;

    public IntentResult(IntentLabel label, double confidence, SignalSource source,
                        Map<String, String> slots, String template) {
        this.label = label != null ? label : IntentLabel.UNKNOWN;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.source = source != null ? source : SignalSource.FALLBACK;
        this.slots = slots != null ? Collections.unmodifiableMap(new LinkedHashMap<>(slots)) : Collections.emptyMap();
        this.template = template;
    }

    public IntentLabel getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public SignalSource getSource() {
        return source;
    }

    public Map<String, String> getSlots() {
        return slots;
    }

    public String getSlot(String name) {
        return slots.get(name);
    }

    /** Pattern or catalog phrase that produced the label, when one did. */
    public String getTemplate() {
        return template;
    }

    public boolean is(IntentLabel l) {
        return label == l;
    }

    public IntentResult withSlots(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(slots);
        if (extra != null) merged.putAll(extra);
        return new IntentResult(label, confidence, source, merged, template);
    }

    public static IntentResult of(IntentLabel label, double confidence, SignalSource source) {
        return new IntentResult(label, confidence, source, null, null);
    }

    public static IntentResult unknown() {
        return new IntentResult(IntentLabel.UNKNOWN, 0.0, SignalSource.FALLBACK, null, null);
    }

    @Override
    public String toString() {
        return label + "(" + String.format("%.2f", confidence) + ", " + source + ")";
    }
}
