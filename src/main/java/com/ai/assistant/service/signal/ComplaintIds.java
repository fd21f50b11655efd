package com.ai.assistant.service.signal;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape rules and extraction for complaint identifiers such as {@code 622A9F6E} or {@code ABC-999}.
 */
public final class ComplaintIds {

    private static final Pattern SHAPE = Pattern.compile("^[A-Za-z0-9]+(?:-[A-Za-z0-9]+)*$");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern TOKEN = Pattern.compile("\\b[A-Za-z0-9]+(?:-[A-Za-z0-9]+)*\\b");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern LETTER = Pattern.compile("[A-Za-z]");

    private static final List<Pattern> EXPLICIT = List.of(
            Pattern.compile("\\b(?:my|the)\\s+complaint\\s+id\\s+(?:is|was|:)?\\s*#?([A-Za-z0-9]+(?:-[A-Za-z0-9]+)*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bstatus\\s+of\\s+complaint\\s+id\\s*[:=]?\\s*#?([A-Za-z0-9]+(?:-[A-Za-z0-9]+)*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcomplaint\\s+(?:number|no\\.?|#)\\s*#?([A-Za-z0-9]+(?:-[A-Za-z0-9]+)*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcomplaint\\s+(?:id\\s*[:=]?\\s*)?#?([A-Za-z0-9]+(?:-[A-Za-z0-9]+)*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:id|ticket)\\s*(?:is|:|=)?\\s*#?([A-Za-z0-9]+(?:-[A-Za-z0-9]+)*)", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> COMMON_WORDS = Set.of(
            "number", "status", "complaint", "details", "everywhere", "ticket", "please"
    );

    private static final int MIN_LENGTH = 6;

    private ComplaintIds() {
    }

    /** True for a token of at least six letters/digits (hyphen groups allowed) containing a digit. */
    public static boolean isWellFormed(String candidate) {
        if (StringUtils.isBlank(candidate)) return false;
        String c = candidate.trim();
        return c.length() >= MIN_LENGTH
                && SHAPE.matcher(c).matches()
                && DIGIT.matcher(c).find();
    }

    /** First complaint identifier in the text, or null. */
    public static String find(String text) {
        if (StringUtils.isBlank(text)) return null;
        String t = EMAIL.matcher(text).replaceAll(" ").trim();
        String bare = StringUtils.removeEnd(StringUtils.removeStart(t, "#"), ".");
        if (isWellFormed(bare)) {
            return bare;
        }
        for (Pattern p : EXPLICIT) {
            Matcher m = p.matcher(t);
            while (m.find()) {
                String candidate = m.group(1);
                if (isWellFormed(candidate) && !isCommonWord(candidate)) {
                    return candidate;
                }
            }
        }
        Matcher m = TOKEN.matcher(t);
        while (m.find()) {
            String candidate = m.group();
            if (isWellFormed(candidate) && LETTER.matcher(candidate).find() && !isCommonWord(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isCommonWord(String candidate) {
        return COMMON_WORDS.contains(candidate.toLowerCase(Locale.ROOT));
    }
}
