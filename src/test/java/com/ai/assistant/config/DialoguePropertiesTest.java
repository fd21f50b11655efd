package com.ai.assistant.config;

import com.ai.assistant.conversation.SlotDefinition;
import com.ai.assistant.conversation.SlotType;
import com.ai.assistant.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialoguePropertiesTest {

    @Test
    void defaults_collectDetailsFirst() {
        List<SlotDefinition> slots = DialogueProperties.defaults().getRequiredSlots();

        assertEquals(List.of(
                new SlotDefinition("details", SlotType.FREE_TEXT),
                new SlotDefinition("name", SlotType.NAME),
                new SlotDefinition("phone", SlotType.PHONE),
                new SlotDefinition("email", SlotType.EMAIL)), slots);
    }

    @Test
    void parseSlots_bareNameIsFreeText() {
        List<SlotDefinition> slots = DialogueProperties.parseSlots(" order:free_text , summary ,email:EMAIL");

        assertEquals(3, slots.size());
        assertEquals(SlotType.FREE_TEXT, slots.get(0).getType());
        assertEquals("summary", slots.get(1).getName());
        assertEquals(SlotType.FREE_TEXT, slots.get(1).getType());
        assertEquals(SlotType.EMAIL, slots.get(2).getType());
    }

    @Test
    void parseSlots_rejectsBadEntries() {
        assertThrows(ConfigurationException.class, () -> DialogueProperties.parseSlots(""));
        assertThrows(ConfigurationException.class, () -> DialogueProperties.parseSlots("name:NAME,name:FREE_TEXT"));
        assertThrows(ConfigurationException.class, () -> DialogueProperties.parseSlots("age:NUMBER"));
        assertThrows(ConfigurationException.class, () -> DialogueProperties.parseSlots(":NAME"));
        assertThrows(ConfigurationException.class, () -> DialogueProperties.parseSlots(" , "));
    }

    @Test
    void validate_rejectsOutOfRangeTunables() {
        String slots = "details:FREE_TEXT";
        assertThrows(ConfigurationException.class, () -> new DialogueProperties(0.0, 0.75, 6, true, slots).validate());
        assertThrows(ConfigurationException.class, () -> new DialogueProperties(0.7, 1.5, 6, true, slots).validate());
        assertThrows(ConfigurationException.class, () -> new DialogueProperties(0.7, 0.75, 0, true, slots).validate());
        assertDoesNotThrow(() -> new DialogueProperties(1.0, 1.0, 1, false, slots).validate());
    }
}
