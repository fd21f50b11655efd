package com.ai.assistant.service;

import com.ai.assistant.conversation.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a confirmation answer into YES, NO, or UNKNOWN.
 * Mixed answers ("yes, no wait") stay UNKNOWN so nothing is submitted on a guess.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "y", "yeah", "yep", "ya", "yup", "ok", "okay", "sure", "correct", "right",
            "absolutely", "definitely", "confirm", "submit", "submit it", "go ahead", "do it", "please do"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "n", "nope", "nah", "discard", "discard it", "don't", "dont", "don't submit", "not now"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|yup|ok|okay|sure|correct|confirm|absolutely|definitely|go ahead|submit)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|discard|don't|dont|do not|not now)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public YesNoResult classify(String userInput) {
        if (StringUtils.isBlank(userInput)) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase(Locale.ROOT).replaceAll("[.!?,]+$", "");

        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return YesNoResult.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return YesNoResult.NO;
            }
        }

        boolean yes = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean no = NEGATIVE_PATTERN.matcher(normalized).find();
        if (yes && no) return YesNoResult.UNKNOWN;
        if (yes) return YesNoResult.YES;
        if (no) return YesNoResult.NO;
        return YesNoResult.UNKNOWN;
    }
}
