package com.ai.assistant.conversation;

import java.time.Instant;

/**
 * One completed exchange. Never mutated after creation.
 */
public final class ConversationTurn {

    private final String utterance;
    private final String response;
    private final IntentLabel intent;
    private final String retrievalQuery;
    private final Instant timestamp;

    public ConversationTurn(String utterance, String response, IntentLabel intent,
                            String retrievalQuery, Instant timestamp) {
        this.utterance = utterance != null ? utterance : "";
        this.response = response != null ? response : "";
        this.intent = intent != null ? intent : IntentLabel.UNKNOWN;
        this.retrievalQuery = retrievalQuery;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public String getUtterance() {
        return utterance;
    }

    public String getResponse() {
        return response;
    }

    public IntentLabel getIntent() {
        return intent;
    }

    /** Query handed to retrieval for a document question; null for any other turn. */
    public String getRetrievalQuery() {
        return retrievalQuery;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isDocumentQuery() {
        return intent == IntentLabel.DOCUMENT_QUERY;
    }
}
