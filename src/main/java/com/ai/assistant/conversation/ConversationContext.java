package com.ai.assistant.conversation;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Per-session conversation state: bounded turn history, current dialogue state, the active
 * complaint draft and the query-refinement toggle. Owned by exactly one session and mutated only
 * by the turn currently being processed for it.
 */
public class ConversationContext {

    private final String sessionId;
    private final int historyWindow;
    private final boolean defaultRefinement;
    private final Deque<ConversationTurn> history = new ArrayDeque<>();

    private DialogueState state = DialogueState.idle();
    private ComplaintDraft draft;
    private boolean refinementEnabled;
    private PendingTurn pendingTurn;

    public ConversationContext(String sessionId, int historyWindow, boolean refinementEnabled) {
        if (historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be >= 1: " + historyWindow);
        }
        this.sessionId = sessionId;
        this.historyWindow = historyWindow;
        this.defaultRefinement = refinementEnabled;
        this.refinementEnabled = refinementEnabled;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    /** Appends a turn, evicting the oldest once the window is exceeded. */
    public void appendTurn(ConversationTurn turn) {
        if (turn == null) return;
        history.addLast(turn);
        while (history.size() > historyWindow) {
            history.removeFirst();
        }
    }

    /** Up to {@code limit} most recent turns, oldest first. A non-positive limit returns the whole window. */
    public List<ConversationTurn> getHistory(int limit) {
        List<ConversationTurn> all = new ArrayList<>(history);
        if (limit <= 0 || limit >= all.size()) {
            return Collections.unmodifiableList(all);
        }
        return Collections.unmodifiableList(all.subList(all.size() - limit, all.size()));
    }

    public List<ConversationTurn> getHistory() {
        return getHistory(0);
    }

    public DialogueState getState() {
        return state;
    }

    /**
     * Moves to {@code next}. Leaving the filing path discards the draft; entering it requires one.
     */
    public void setState(DialogueState next) {
        if (next == null) next = DialogueState.idle();
        if (next.isFilingComplaint() && draft == null) {
            throw new IllegalStateException("No complaint draft for state " + next);
        }
        if (!next.isFilingComplaint()) {
            draft = null;
        }
        this.state = next;
    }

    /** Starts a fresh draft over the given slots and moves to collecting its first slot. */
    public ComplaintDraft startComplaint(List<SlotDefinition> slots) {
        this.draft = new ComplaintDraft(slots);
        this.state = DialogueState.collectingComplaint(0);
        return draft;
    }

    public ComplaintDraft getDraft() {
        return draft;
    }

    public boolean hasDraft() {
        return draft != null;
    }

    public void updateSlot(int index, String value) {
        if (draft == null) {
            throw new IllegalStateException("No complaint draft in session " + sessionId);
        }
        draft.fill(index, value);
    }

    public boolean isRefinementEnabled() {
        return refinementEnabled;
    }

    public void setRefinementEnabled(boolean refinementEnabled) {
        this.refinementEnabled = refinementEnabled;
    }

    public void stagePendingTurn(PendingTurn turn) {
        this.pendingTurn = turn;
    }

    public PendingTurn takePendingTurn() {
        PendingTurn p = pendingTurn;
        pendingTurn = null;
        return p;
    }

    public boolean hasPendingTurn() {
        return pendingTurn != null;
    }

    /** Clears history, draft and pending turn; state returns to idle. Safe to call repeatedly. */
    public void reset() {
        history.clear();
        draft = null;
        pendingTurn = null;
        state = DialogueState.idle();
        refinementEnabled = defaultRefinement;
    }

    /**
     * Turn whose response is produced by an external collaborator; completed once the caller
     * reports the outcome.
     */
    public static final class PendingTurn {
        private final String utterance;
        private final IntentLabel intent;
        private final String retrievalQuery;
        private final Instant timestamp;

        public PendingTurn(String utterance, IntentLabel intent, String retrievalQuery) {
            this.utterance = utterance;
            this.intent = intent;
            this.retrievalQuery = retrievalQuery;
            this.timestamp = Instant.now();
        }

        public String getUtterance() {
            return utterance;
        }

        public IntentLabel getIntent() {
            return intent;
        }

        public String getRetrievalQuery() {
            return retrievalQuery;
        }

        public ConversationTurn complete(String response) {
            return new ConversationTurn(utterance, response, intent, retrievalQuery, timestamp);
        }
    }
}
