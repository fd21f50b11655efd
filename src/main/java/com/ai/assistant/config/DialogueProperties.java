package com.ai.assistant.config;

import com.ai.assistant.conversation.SlotDefinition;
import com.ai.assistant.conversation.SlotType;
import com.ai.assistant.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tunables recognised by the dialogue engine. Validated once at startup; a bad value stops the
 * application context from starting.
 */
@Component
public class DialogueProperties {

    private static final Logger log = LoggerFactory.getLogger(DialogueProperties.class);

    private final double fuzzyThreshold;
    private final double topicSwitchThreshold;
    private final int historyWindow;
    private final boolean refinementEnabled;
    private final String slotSpec;
    private List<SlotDefinition> requiredSlots;

    public DialogueProperties(
            @Value("${assistant.intent.fuzzy-threshold:0.7}") double fuzzyThreshold,
            @Value("${assistant.intent.topic-switch-threshold:0.75}") double topicSwitchThreshold,
            @Value("${assistant.context.history-window:6}") int historyWindow,
            @Value("${assistant.refinement.enabled:true}") boolean refinementEnabled,
            @Value("${assistant.complaint.slots:}") String slotSpec) {
        this.fuzzyThreshold = fuzzyThreshold;
        this.topicSwitchThreshold = topicSwitchThreshold;
        this.historyWindow = historyWindow;
        this.refinementEnabled = refinementEnabled;
        this.slotSpec = slotSpec;
    }

    @PostConstruct
    public void validate() {
        if (fuzzyThreshold <= 0.0 || fuzzyThreshold > 1.0) {
            throw new ConfigurationException("assistant.intent.fuzzy-threshold must be in (0,1]: " + fuzzyThreshold);
        }
        if (topicSwitchThreshold <= 0.0 || topicSwitchThreshold > 1.0) {
            throw new ConfigurationException("assistant.intent.topic-switch-threshold must be in (0,1]: " + topicSwitchThreshold);
        }
        if (historyWindow < 1) {
            throw new ConfigurationException("assistant.context.history-window must be >= 1: " + historyWindow);
        }
        this.requiredSlots = parseSlots(slotSpec);
        log.info("Dialogue config: fuzzyThreshold={} topicSwitchThreshold={} historyWindow={} refinement={} slots={}",
                fuzzyThreshold, topicSwitchThreshold, historyWindow, refinementEnabled, requiredSlots);
    }

    /** Parses {@code name:TYPE,name:TYPE}; a bare name defaults to FREE_TEXT. */
    static List<SlotDefinition> parseSlots(String spec) {
        if (StringUtils.isBlank(spec)) {
            throw new ConfigurationException("assistant.complaint.slots is required");
        }
        List<SlotDefinition> slots = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String part : spec.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) continue;
            String name = StringUtils.substringBefore(entry, ":").trim();
            String typeName = entry.contains(":") ? StringUtils.substringAfter(entry, ":").trim() : SlotType.FREE_TEXT.name();
            if (name.isEmpty()) {
                throw new ConfigurationException("Slot entry without a name: '" + entry + "'");
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate slot: " + name);
            }
            SlotType type;
            try {
                type = SlotType.valueOf(typeName.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown slot type '" + typeName + "' for slot " + name, e);
            }
            slots.add(new SlotDefinition(name, type));
        }
        if (slots.isEmpty()) {
            throw new ConfigurationException("assistant.complaint.slots lists no slots");
        }
        return Collections.unmodifiableList(slots);
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public double getTopicSwitchThreshold() {
        return topicSwitchThreshold;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public boolean isRefinementEnabled() {
        return refinementEnabled;
    }

    public List<SlotDefinition> getRequiredSlots() {
        if (requiredSlots == null) {
            validate();
        }
        return requiredSlots;
    }

    /** Defaults used when no Spring context is around (tests, tools). */
    public static DialogueProperties defaults() {
        DialogueProperties p = new DialogueProperties(0.7, 0.75, 6, true,
                "details:FREE_TEXT,name:NAME,phone:PHONE,email:EMAIL");
        p.validate();
        return p;
    }
}
