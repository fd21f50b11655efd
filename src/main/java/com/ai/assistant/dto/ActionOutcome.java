package com.ai.assistant.dto;

/**
 * Result of executing a non-reply {@link DialogueAction}, reported back to finish the turn.
 */
public final class ActionOutcome {

    public enum Type {
        SUBMITTED,
        SUBMIT_FAILED,
        FETCHED,
        NOT_FOUND,
        FETCH_FAILED,
        ANSWERED,
        RETRIEVAL_FAILED
    }

    private final Type type;
    private final String complaintId;
    private final ComplaintRecord record;
    private final String text;

    private ActionOutcome(Type type, String complaintId, ComplaintRecord record, String text) {
        this.type = type;
        this.complaintId = complaintId;
        this.record = record;
        this.text = text;
    }

    public Type getType() {
        return type;
    }

    public String getComplaintId() {
        return complaintId;
    }

    public ComplaintRecord getRecord() {
        return record;
    }

    public String getText() {
        return text;
    }

    public boolean isFailure() {
        return type == Type.SUBMIT_FAILED || type == Type.FETCH_FAILED || type == Type.RETRIEVAL_FAILED;
    }

    public static ActionOutcome submitted(String complaintId) {
        return new ActionOutcome(Type.SUBMITTED, complaintId, null, null);
    }

    public static ActionOutcome submitFailed() {
        return new ActionOutcome(Type.SUBMIT_FAILED, null, null, null);
    }

    public static ActionOutcome fetched(ComplaintRecord record) {
        return new ActionOutcome(Type.FETCHED, record != null ? record.getComplaintId() : null, record, null);
    }

    public static ActionOutcome notFound(String complaintId) {
        return new ActionOutcome(Type.NOT_FOUND, complaintId, null, null);
    }

    public static ActionOutcome fetchFailed(String complaintId) {
        return new ActionOutcome(Type.FETCH_FAILED, complaintId, null, null);
    }

    public static ActionOutcome answered(String text) {
        return new ActionOutcome(Type.ANSWERED, null, null, text);
    }

    public static ActionOutcome retrievalFailed() {
        return new ActionOutcome(Type.RETRIEVAL_FAILED, null, null, null);
    }

    @Override
    public String toString() {
        return "ActionOutcome{" + type + (complaintId != null ? ", id=" + complaintId : "") + "}";
    }
}
