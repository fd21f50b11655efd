package com.ai.assistant.conversation;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationContextTest {

    private static final List<SlotDefinition> SLOTS = List.of(
            new SlotDefinition("details", SlotType.FREE_TEXT),
            new SlotDefinition("name", SlotType.NAME));

    private static ConversationTurn turn(String utterance) {
        return new ConversationTurn(utterance, "ok", IntentLabel.DOCUMENT_QUERY, utterance, Instant.now());
    }

    @Test
    void appendTurn_evictsOldestBeyondWindow() {
        ConversationContext ctx = new ConversationContext("s", 2, true);
        ctx.appendTurn(turn("one"));
        ctx.appendTurn(turn("two"));
        ctx.appendTurn(turn("three"));

        List<ConversationTurn> history = ctx.getHistory();
        assertEquals(2, history.size());
        assertEquals("two", history.get(0).getUtterance());
        assertEquals("three", history.get(1).getUtterance());
    }

    @Test
    void getHistory_limitReturnsMostRecentOldestFirst() {
        ConversationContext ctx = new ConversationContext("s", 5, true);
        ctx.appendTurn(turn("one"));
        ctx.appendTurn(turn("two"));
        ctx.appendTurn(turn("three"));

        List<ConversationTurn> lastTwo = ctx.getHistory(2);
        assertEquals(List.of("two", "three"), List.of(lastTwo.get(0).getUtterance(), lastTwo.get(1).getUtterance()));
        assertThrows(UnsupportedOperationException.class, () -> lastTwo.add(turn("x")));
    }

    @Test
    void startComplaint_createsDraftAndCollectsFirstSlot() {
        ConversationContext ctx = new ConversationContext("s", 3, true);
        ComplaintDraft draft = ctx.startComplaint(SLOTS);

        assertSame(draft, ctx.getDraft());
        assertEquals(DialogueState.collectingComplaint(0), ctx.getState());
        assertEquals(0, draft.filledCount());
    }

    @Test
    void leavingFilingStates_discardsDraft() {
        ConversationContext ctx = new ConversationContext("s", 3, true);
        ctx.startComplaint(SLOTS);
        ctx.updateSlot(0, "broken");
        ctx.setState(DialogueState.confirmPending());
        assertTrue(ctx.hasDraft());

        ctx.setState(DialogueState.awaitingComplaintId());
        assertFalse(ctx.hasDraft());
    }

    @Test
    void filingStateWithoutDraft_isRejected() {
        ConversationContext ctx = new ConversationContext("s", 3, true);
        assertThrows(IllegalStateException.class, () -> ctx.setState(DialogueState.collectingComplaint(1)));
        assertThrows(IllegalStateException.class, () -> ctx.setState(DialogueState.confirmPending()));
        assertThrows(IllegalStateException.class, () -> ctx.updateSlot(0, "x"));
    }

    @Test
    void reset_isIdempotent() {
        ConversationContext ctx = new ConversationContext("s", 3, true);
        ctx.appendTurn(turn("one"));
        ctx.startComplaint(SLOTS);
        ctx.setRefinementEnabled(false);
        ctx.stagePendingTurn(new ConversationContext.PendingTurn("q", IntentLabel.DOCUMENT_QUERY, "q"));

        ctx.reset();
        DialogueState afterOnce = ctx.getState();
        int historyAfterOnce = ctx.getHistory().size();
        ctx.reset();

        assertEquals(afterOnce, ctx.getState());
        assertEquals(historyAfterOnce, ctx.getHistory().size());
        assertTrue(ctx.getState().isIdle());
        assertTrue(ctx.getHistory().isEmpty());
        assertFalse(ctx.hasDraft());
        assertFalse(ctx.hasPendingTurn());
        assertTrue(ctx.isRefinementEnabled());
    }

    @Test
    void pendingTurn_completesIntoImmutableTurn() {
        ConversationContext ctx = new ConversationContext("s", 3, true);
        ctx.stagePendingTurn(new ConversationContext.PendingTurn("what about returns?", IntentLabel.DOCUMENT_QUERY, "returns policy"));
        ConversationContext.PendingTurn pending = ctx.takePendingTurn();
        assertFalse(ctx.hasPendingTurn());

        ConversationTurn t = pending.complete("30 days");
        assertEquals("what about returns?", t.getUtterance());
        assertEquals("30 days", t.getResponse());
        assertEquals("returns policy", t.getRetrievalQuery());
        assertTrue(t.isDocumentQuery());
    }

    @Test
    void windowMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ConversationContext("s", 0, true));
    }
}
