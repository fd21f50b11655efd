package com.ai.assistant.service.signal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplaintIdsTest {

    @Test
    void wellFormed_requiresLengthAndDigit() {
        assertTrue(ComplaintIds.isWellFormed("ABC-999"));
        assertTrue(ComplaintIds.isWellFormed("622A9F6E"));
        assertFalse(ComplaintIds.isWellFormed("12345"));
        assertFalse(ComplaintIds.isWellFormed("abcdefgh"));
        assertFalse(ComplaintIds.isWellFormed("ABC 999"));
        assertFalse(ComplaintIds.isWellFormed(null));
    }

    @Test
    void find_bareIdentifier() {
        assertEquals("622A9F6E", ComplaintIds.find("622A9F6E"));
        assertEquals("622A9F6E", ComplaintIds.find("#622A9F6E"));
    }

    @Test
    void find_explicitPhrasing() {
        assertEquals("622A9F6E", ComplaintIds.find("my complaint id is 622A9F6E"));
        assertEquals("ABC-999", ComplaintIds.find("check complaint ABC-999"));
        assertEquals("X12345", ComplaintIds.find("ticket: X12345"));
    }

    @Test
    void find_fallbackTokenNeedsLetterAndDigit() {
        assertEquals("REF2024X", ComplaintIds.find("can you look up REF2024X for me"));
        assertNull(ComplaintIds.find("my order 1234567 never arrived"));
    }

    @Test
    void find_ignoresEmailsAndPlainText() {
        assertNull(ComplaintIds.find("contact me at bob123@mail.com"));
        assertNull(ComplaintIds.find("please check the status"));
        assertNull(ComplaintIds.find(""));
    }
}
