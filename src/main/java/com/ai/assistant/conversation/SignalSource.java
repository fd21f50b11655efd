package com.ai.assistant.conversation;

/**
 * Detector that decided an intent. Declaration order is the tie-break order (first wins).
 */
public enum SignalSource {
    PATTERN,
    CONTEXT,
    FUZZY,
    NLP,
    FALLBACK
}
