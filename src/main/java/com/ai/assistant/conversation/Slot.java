package com.ai.assistant.conversation;

import org.apache.commons.lang3.StringUtils;

/**
 * A slot definition plus the value collected for it, if any.
 */
public final class Slot {

    private final SlotDefinition definition;
    private String value;

    public Slot(SlotDefinition definition) {
        this.definition = definition;
    }

    public SlotDefinition getDefinition() {
        return definition;
    }

    public String getName() {
        return definition.getName();
    }

    public SlotType getType() {
        return definition.getType();
    }

    public String getValue() {
        return value;
    }

    void setValue(String value) {
        this.value = value;
    }

    public boolean isFilled() {
        return StringUtils.isNotBlank(value);
    }
}
