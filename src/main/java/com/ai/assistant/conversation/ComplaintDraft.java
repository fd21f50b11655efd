package com.ai.assistant.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-progress complaint: the ordered required slots and whatever has been collected so far.
 * Lives only inside a {@link ConversationContext}.
 */
public class ComplaintDraft {

    private final List<Slot> slots;

    public ComplaintDraft(List<SlotDefinition> definitions) {
        List<Slot> list = new ArrayList<>(definitions.size());
        for (SlotDefinition d : definitions) {
            list.add(new Slot(d));
        }
        this.slots = Collections.unmodifiableList(list);
    }

    public List<Slot> getSlots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public Slot getSlot(int index) {
        return slots.get(index);
    }

    public void fill(int index, String value) {
        slots.get(index).setValue(value);
    }

    /** Index of the first unfilled slot at or after {@code from}, or -1 when none is left. */
    public int nextUnfilled(int from) {
        for (int i = Math.max(0, from); i < slots.size(); i++) {
            if (!slots.get(i).isFilled()) return i;
        }
        for (int i = 0; i < Math.min(from, slots.size()); i++) {
            if (!slots.get(i).isFilled()) return i;
        }
        return -1;
    }

    public boolean isComplete() {
        return nextUnfilled(0) < 0;
    }

    public int filledCount() {
        int n = 0;
        for (Slot s : slots) {
            if (s.isFilled()) n++;
        }
        return n;
    }

    /** Slot name to value, in slot order; unfilled slots are omitted. */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Slot s : slots) {
            if (s.isFilled()) fields.put(s.getName(), s.getValue());
        }
        return fields;
    }
}
