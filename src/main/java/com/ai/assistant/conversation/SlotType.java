package com.ai.assistant.conversation;

/**
 * Expected value shape of a slot.
 */
public enum SlotType {
    FREE_TEXT,
    NAME,
    PHONE,
    EMAIL,
    IDENTIFIER
}
