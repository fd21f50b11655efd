package com.ai.assistant.conversation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DialogueStateTest {

    @Test
    void cursorOnlyExistsWhileCollecting() {
        assertEquals(2, DialogueState.collectingComplaint(2).getCursor());
        assertThrows(IllegalStateException.class, () -> DialogueState.idle().getCursor());
        assertThrows(IllegalStateException.class, () -> DialogueState.confirmPending().getCursor());
        assertThrows(IllegalArgumentException.class, () -> DialogueState.collectingComplaint(-1));
    }

    @Test
    void flowIntent_perPhase() {
        assertNull(DialogueState.idle().flowIntent());
        assertEquals(IntentLabel.FILE_COMPLAINT, DialogueState.collectingComplaint(0).flowIntent());
        assertEquals(IntentLabel.FILE_COMPLAINT, DialogueState.confirmPending().flowIntent());
        assertEquals(IntentLabel.RETRIEVE_COMPLAINT, DialogueState.awaitingComplaintId().flowIntent());
    }

    @Test
    void equalityAndToString() {
        assertEquals(DialogueState.collectingComplaint(1), DialogueState.collectingComplaint(1));
        assertNotEquals(DialogueState.collectingComplaint(1), DialogueState.collectingComplaint(2));
        assertEquals("COLLECTING_COMPLAINT(1)", DialogueState.collectingComplaint(1).toString());
        assertEquals("IDLE", DialogueState.idle().toString());
    }
}
