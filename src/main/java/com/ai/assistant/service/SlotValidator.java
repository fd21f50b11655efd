package com.ai.assistant.service;

import com.ai.assistant.conversation.SlotType;
import com.ai.assistant.service.signal.ComplaintIds;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type-specific validation and normalization of slot values. Never throws for bad input: an
 * invalid value comes back as {@link Result#isValid()} false and the dialogue re-prompts.
 */
@Component
public class SlotValidator {

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern EMAIL_IN_TEXT = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern PHONE_IN_TEXT = Pattern.compile("\\+?[\\d(][\\d\\s\\-().]{8,}\\d");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");
    private static final Pattern PHONE_LOCAL = Pattern.compile("^\\d{10}$");
    private static final Pattern PHONE_INTERNATIONAL = Pattern.compile("^\\+\\d{1,3}\\d{10}$");
    private static final Pattern NAME_PREFIX = Pattern.compile(
            "^(?:my\\s+name\\s+is|name\\s+is|i\\s+am|i'm|im|this\\s+is|it's|call\\s+me)\\s+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME_WORD = Pattern.compile("^[\\p{L}][\\p{L}'.-]*$");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    public Result validate(SlotType type, String raw) {
        if (StringUtils.isBlank(raw)) return Result.invalid();
        String value = raw.trim();
        switch (type) {
            case NAME:
                return validateName(value);
            case PHONE:
                return validatePhone(value);
            case EMAIL:
                return validateEmail(value);
            case IDENTIFIER:
                return validateIdentifier(value);
            case FREE_TEXT:
            default:
                return Result.valid(value);
        }
    }

    private Result validateName(String value) {
        String name = NAME_PREFIX.matcher(value).replaceFirst("").replaceAll("[.!,]+$", "").trim();
        if (name.isEmpty() || name.contains("@") || DIGIT.matcher(name).find()) return Result.invalid();
        String[] words = name.split("\\s+");
        if (words.length > 3) return Result.invalid();
        for (String w : words) {
            if (!NAME_WORD.matcher(w).matches()) return Result.invalid();
        }
        return Result.valid(String.join(" ", words));
    }

    /** Ten digits, or "+" with a 1-3 digit country code and ten digits, once separators are stripped. */
    private Result validatePhone(String value) {
        Matcher m = PHONE_IN_TEXT.matcher(value);
        String candidate = m.find() ? m.group() : value;
        String cleaned = PHONE_SEPARATORS.matcher(candidate).replaceAll("");
        if (PHONE_LOCAL.matcher(cleaned).matches() || PHONE_INTERNATIONAL.matcher(cleaned).matches()) {
            return Result.valid(cleaned);
        }
        return Result.invalid();
    }

    private Result validateEmail(String value) {
        Matcher m = EMAIL_IN_TEXT.matcher(value);
        String candidate = m.find() ? m.group() : value;
        return EMAIL.matcher(candidate).matches() ? Result.valid(candidate) : Result.invalid();
    }

    private Result validateIdentifier(String value) {
        String id = ComplaintIds.find(value);
        return id != null && ComplaintIds.isWellFormed(id) ? Result.valid(id) : Result.invalid();
    }

    public static final class Result {
        private static final Result INVALID = new Result(false, null);

        private final boolean valid;
        private final String value;

        private Result(boolean valid, String value) {
            this.valid = valid;
            this.value = value;
        }

        public static Result valid(String value) {
            return new Result(true, value);
        }

        public static Result invalid() {
            return INVALID;
        }

        public boolean isValid() {
            return valid;
        }

        /** Normalized value; null when invalid. */
        public String getValue() {
            return value;
        }
    }
}
