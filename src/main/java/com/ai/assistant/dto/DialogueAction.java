package com.ai.assistant.dto;

import com.ai.assistant.conversation.IntentResult;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller should do after a turn. No collaborator is called by the engine itself: a
 * {@link Type#REPLY} carries finished text, every other type names work for the caller whose
 * outcome is reported back through {@code completeAction}.
 */
public final class DialogueAction {

    public enum Type {
        REPLY,
        SUBMIT_COMPLAINT,
        FETCH_COMPLAINT,
        RETRIEVE_DOCUMENTS
    }

    public static final String TEXT = "text";
    public static final String FIELDS = "fields";
    public static final String COMPLAINT_ID = "complaintId";
    public static final String QUERY = "query";

    private final Type type;
    private final Map<String, Object> payload;
    private final String notice;
    private final IntentResult intent;

    private DialogueAction(Type type, Map<String, Object> payload, String notice, IntentResult intent) {
        this.type = type;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
        this.notice = notice;
        this.intent = intent;
    }

    public Type getType() {
        return type;
    }

    public boolean is(Type t) {
        return type == t;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    /** Reply text; null for non-reply actions. */
    public String getText() {
        return getString(TEXT);
    }

    public String getComplaintId() {
        return getString(COMPLAINT_ID);
    }

    public String getQuery() {
        return getString(QUERY);
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> getFields() {
        Object v = payload.get(FIELDS);
        return v instanceof Map ? Collections.unmodifiableMap((Map<String, String>) v) : Collections.emptyMap();
    }

    /** Set when an unfinished flow was dropped to handle this turn. */
    public String getNotice() {
        return notice;
    }

    public IntentResult getIntent() {
        return intent;
    }

    public DialogueAction withNotice(String notice) {
        return new DialogueAction(type, payload, notice, intent);
    }

    public DialogueAction withIntent(IntentResult intent) {
        return new DialogueAction(type, payload, notice, intent);
    }

    public static DialogueAction reply(String text) {
        Map<String, Object> p = new HashMap<>();
        p.put(TEXT, text != null ? text : "");
        return new DialogueAction(Type.REPLY, p, null, null);
    }

    public static DialogueAction submitComplaint(Map<String, String> fields) {
        Map<String, Object> p = new HashMap<>();
        p.put(FIELDS, new LinkedHashMap<>(fields));
        return new DialogueAction(Type.SUBMIT_COMPLAINT, p, null, null);
    }

    public static DialogueAction fetchComplaint(String complaintId) {
        Map<String, Object> p = new HashMap<>();
        p.put(COMPLAINT_ID, complaintId);
        return new DialogueAction(Type.FETCH_COMPLAINT, p, null, null);
    }

    public static DialogueAction retrieveDocuments(String query) {
        Map<String, Object> p = new HashMap<>();
        p.put(QUERY, query);
        return new DialogueAction(Type.RETRIEVE_DOCUMENTS, p, null, null);
    }

    @Override
    public String toString() {
        return "DialogueAction{" + type + ", " + payload + (notice != null ? ", notice='" + notice + "'" : "") + "}";
    }
}
