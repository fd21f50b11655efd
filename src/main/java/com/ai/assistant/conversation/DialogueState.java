package com.ai.assistant.conversation;

import java.util.Objects;

/**
 * State of the complaint dialogue. Only {@link Phase#COLLECTING_COMPLAINT} carries a slot cursor;
 * instances are created through the factories so a cursor can never exist on any other phase.
 */
public final class DialogueState {

    public enum Phase {
        IDLE,
        COLLECTING_COMPLAINT,
        CONFIRM_PENDING,
        AWAITING_COMPLAINT_ID
    }

    private static final DialogueState IDLE = new DialogueState(Phase.IDLE, -1);
    private static final DialogueState CONFIRM_PENDING = new DialogueState(Phase.CONFIRM_PENDING, -1);
    private static final DialogueState AWAITING_COMPLAINT_ID = new DialogueState(Phase.AWAITING_COMPLAINT_ID, -1);

    private final Phase phase;
    private final int cursor;

    private DialogueState(Phase phase, int cursor) {
        this.phase = phase;
        this.cursor = cursor;
    }

    public static DialogueState idle() {
        return IDLE;
    }

    public static DialogueState collectingComplaint(int cursor) {
        if (cursor < 0) {
            throw new IllegalArgumentException("cursor must be >= 0: " + cursor);
        }
        return new DialogueState(Phase.COLLECTING_COMPLAINT, cursor);
    }

    public static DialogueState confirmPending() {
        return CONFIRM_PENDING;
    }

    public static DialogueState awaitingComplaintId() {
        return AWAITING_COMPLAINT_ID;
    }

    public Phase getPhase() {
        return phase;
    }

    /** Index of the slot being collected. */
    public int getCursor() {
        if (phase != Phase.COLLECTING_COMPLAINT) {
            throw new IllegalStateException("No slot cursor in phase " + phase);
        }
        return cursor;
    }

    public boolean isIdle() {
        return phase == Phase.IDLE;
    }

    public boolean is(Phase p) {
        return phase == p;
    }

    /** True while a complaint is being filed (a draft must exist). */
    public boolean isFilingComplaint() {
        return phase == Phase.COLLECTING_COMPLAINT || phase == Phase.CONFIRM_PENDING;
    }

    /** Flow intent this state belongs to, or null when idle. */
    public IntentLabel flowIntent() {
        switch (phase) {
            case COLLECTING_COMPLAINT:
            case CONFIRM_PENDING:
                return IntentLabel.FILE_COMPLAINT;
            case AWAITING_COMPLAINT_ID:
                return IntentLabel.RETRIEVE_COMPLAINT;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DialogueState)) return false;
        DialogueState that = (DialogueState) o;
        return cursor == that.cursor && phase == that.phase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, cursor);
    }

    @Override
    public String toString() {
        return phase == Phase.COLLECTING_COMPLAINT ? phase + "(" + cursor + ")" : phase.name();
    }
}
