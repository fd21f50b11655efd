package com.ai.assistant.service.signal;

import com.ai.assistant.conversation.IntentLabel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword and entity signals extracted from a single utterance.
 */
public final class NlpSignals {

    public static final String COMPLAINT_ID = "complaint_id";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String ORDER_NUMBER = "order_number";

    private final List<String> words;
    private final Set<String> domainKeywords;
    private final boolean issueKeyword;
    private final boolean filingVerb;
    private final boolean retrievalVerb;
    private final boolean question;
    private final boolean documentReference;
    private final Map<String, String> entities;

    NlpSignals(List<String> words, Set<String> domainKeywords, boolean issueKeyword, boolean filingVerb,
               boolean retrievalVerb, boolean question, boolean documentReference, Map<String, String> entities) {
        this.words = Collections.unmodifiableList(words);
        this.domainKeywords = Collections.unmodifiableSet(domainKeywords);
        this.issueKeyword = issueKeyword;
        this.filingVerb = filingVerb;
        this.retrievalVerb = retrievalVerb;
        this.question = question;
        this.documentReference = documentReference;
        this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    }

    static NlpSignals empty() {
        return new NlpSignals(List.of(), Set.of(), false, false, false, false, false, Map.of());
    }

    /** Lower-cased surface words in utterance order. */
    public List<String> getWords() {
        return words;
    }

    /** Complaint vocabulary found (stems). */
    public Set<String> getDomainKeywords() {
        return domainKeywords;
    }

    public boolean hasIssueKeyword() {
        return issueKeyword;
    }

    public boolean hasFilingVerb() {
        return filingVerb;
    }

    public boolean hasRetrievalVerb() {
        return retrievalVerb;
    }

    public boolean isQuestion() {
        return question;
    }

    /** Names the document corpus itself ("manual", "policy", "faq"). */
    public boolean hasDocumentReference() {
        return documentReference;
    }

    public Map<String, String> getEntities() {
        return entities;
    }

    public String getEntity(String name) {
        return entities.get(name);
    }

    public String getComplaintId() {
        return entities.get(COMPLAINT_ID);
    }

    /** Any complaint-domain keyword or a complaint identifier. */
    public boolean hasComplaintSignal() {
        return !domainKeywords.isEmpty() || entities.containsKey(COMPLAINT_ID);
    }

    /**
     * Intent suggested by keyword plus action verb alone, or null. Retrieval wins when both verbs occur.
     */
    public IntentLabel getKeywordIntent() {
        boolean keyword = issueKeyword || !domainKeywords.isEmpty();
        if (!keyword) return null;
        if (retrievalVerb) return IntentLabel.RETRIEVE_COMPLAINT;
        if (filingVerb) return IntentLabel.FILE_COMPLAINT;
        return null;
    }

    @Override
    public String toString() {
        return "NlpSignals{keywords=" + domainKeywords + ", issue=" + issueKeyword + ", filingVerb=" + filingVerb
                + ", retrievalVerb=" + retrievalVerb + ", question=" + question
                + ", document=" + documentReference + ", entities=" + entities + "}";
    }
}
