package com.ai.assistant.service.signal;

import com.ai.assistant.conversation.IntentLabel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Known intent templates: exact-phrasing patterns and canonical phrases for fuzzy matching.
 */
public final class IntentTemplates {

    private IntentTemplates() {
    }

    static final List<Pattern> FILING_PATTERNS = List.of(
            Pattern.compile("\\bfile\\s+an?\\s+complaint\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsubmit\\s+an?\\s+complaint\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmake\\s+an?\\s+complaint\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bregister\\s+an?\\s+complaint\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\blodge\\s+an?\\s+complaint\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\braise\\s+an?\\s+complaint\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcomplain\\s+about\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\breport\\s+an?\\s+issue\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\breport\\s+a\\s+problem\\b", Pattern.CASE_INSENSITIVE)
    );

    static final List<Pattern> RETRIEVAL_PATTERNS = List.of(
            Pattern.compile("\\b(get|show|view|check|retrieve)\\s+(my\\s+)?(details|status|info)?\\s*(for|of|about)?\\s*(the\\s+)?(complaint|issue|ticket)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(what|where)\\s+is\\s+(my\\s+)?(complaint|issue|ticket)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\btrack\\s+(my\\s+)?(complaint|issue|ticket)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bstatus\\s+of\\s+(my\\s+|the\\s+)?(complaint|ticket)\\b", Pattern.CASE_INSENSITIVE)
    );

    static final List<String> FILING_PHRASES = List.of(
            "file a complaint", "submit a complaint", "make a complaint",
            "register a complaint", "lodge a complaint", "raise a complaint",
            "complain about", "report an issue", "report a problem",
            "I want to complain", "I need to report", "I have an issue",
            "I'm having a problem", "not satisfied with", "unhappy with"
    );

    static final List<String> RETRIEVAL_PHRASES = List.of(
            "show me complaint", "view complaint", "check complaint",
            "retrieve complaint", "what is my complaint", "where is my complaint",
            "track my complaint", "status of complaint", "complaint status",
            "find my complaint", "look up my complaint", "see my complaint details"
    );

    /** Canonical phrase catalog per intent, in tie-break order. */
    static Map<IntentLabel, List<String>> phraseCatalog() {
        Map<IntentLabel, List<String>> catalog = new LinkedHashMap<>();
        catalog.put(IntentLabel.FILE_COMPLAINT, FILING_PHRASES);
        catalog.put(IntentLabel.RETRIEVE_COMPLAINT, RETRIEVAL_PHRASES);
        return catalog;
    }
}
