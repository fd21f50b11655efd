package com.ai.assistant.conversation;

import java.util.Objects;

/**
 * Named, typed field required to complete an action.
 */
public final class SlotDefinition {

    private final String name;
    private final SlotType type;

    public SlotDefinition(String name, SlotType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public SlotType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotDefinition)) return false;
        SlotDefinition that = (SlotDefinition) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
