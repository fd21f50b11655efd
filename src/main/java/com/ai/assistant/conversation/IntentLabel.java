package com.ai.assistant.conversation;

/**
 * Closed set of intents a single utterance can be classified into.
 */
public enum IntentLabel {
    FILE_COMPLAINT,
    RETRIEVE_COMPLAINT,
    PROVIDE_SLOT_VALUE,
    DOCUMENT_QUERY,
    UNKNOWN;

    public boolean isComplaintFlow() {
        return this == FILE_COMPLAINT || this == RETRIEVE_COMPLAINT;
    }
}
