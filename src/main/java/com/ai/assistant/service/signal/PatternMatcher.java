package com.ai.assistant.service.signal;

import com.ai.assistant.conversation.IntentLabel;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic regex detector. When an utterance also carries something shaped like a complaint
 * identifier, retrieval templates are tried before filing ones.
 */
@Component
public class PatternMatcher {

    public PatternMatch match(String utterance) {
        if (StringUtils.isBlank(utterance)) return PatternMatch.none();
        String t = utterance.trim();

        if (ComplaintIds.find(t) != null) {
            PatternMatch retrieval = firstMatch(t, IntentTemplates.RETRIEVAL_PATTERNS, IntentLabel.RETRIEVE_COMPLAINT);
            if (retrieval.isMatched()) return retrieval;
        }
        PatternMatch filing = firstMatch(t, IntentTemplates.FILING_PATTERNS, IntentLabel.FILE_COMPLAINT);
        if (filing.isMatched()) return filing;
        return firstMatch(t, IntentTemplates.RETRIEVAL_PATTERNS, IntentLabel.RETRIEVE_COMPLAINT);
    }

    private static PatternMatch firstMatch(String text, List<Pattern> patterns, IntentLabel label) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return PatternMatch.of(label, p.pattern());
            }
        }
        return PatternMatch.none();
    }
}
