package com.ai.assistant.conversation;

/**
 * Result of YES/NO classification.
 * Maps all user variations (yes, yeah, yup, correct, no, nope, not now) into a boolean or unknown.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
