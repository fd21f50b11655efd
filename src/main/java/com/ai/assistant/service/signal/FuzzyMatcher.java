package com.ai.assistant.service.signal;

import com.ai.assistant.conversation.IntentLabel;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.similarity.LongestCommonSubsequence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores an utterance against the canonical intent phrases with a token-set ratio: both sides are
 * reduced to sorted token sets and compared through their shared and leftover tokens, so word
 * order and extra words around a known phrase do not hurt the score.
 */
@Component
public class FuzzyMatcher {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    /** An overlap made only of these cannot carry a match on its own ("I", "a", "my"). */
    private static final Set<String> FUNCTION_WORDS = Set.of(
            "a", "an", "the", "i", "m", "me", "my", "to", "is", "of", "with", "about", "what", "where", "have", "want", "need"
    );

    private final Map<IntentLabel, List<String>> catalog;

    public FuzzyMatcher() {
        this(IntentTemplates.phraseCatalog());
    }

    FuzzyMatcher(Map<IntentLabel, List<String>> catalog) {
        this.catalog = catalog;
    }

    /** Best-scoring phrase over the whole catalog; earlier intents win exact ties. */
    public FuzzyMatch match(String utterance) {
        if (StringUtils.isBlank(utterance)) return FuzzyMatch.none();
        FuzzyMatch best = FuzzyMatch.none();
        for (Map.Entry<IntentLabel, List<String>> e : catalog.entrySet()) {
            for (String phrase : e.getValue()) {
                double score = tokenSetRatio(utterance, phrase);
                if (score > best.getScore()) {
                    best = new FuzzyMatch(e.getKey(), phrase, score);
                }
            }
        }
        return best;
    }

    /** Normalized indel similarity: 2 * LCS / (|a| + |b|). */
    public static double ratio(String a, String b) {
        if (a == null || b == null) return 0.0;
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        return 2.0 * LCS.apply(a, b) / total;
    }

    public static double tokenSetRatio(String a, String b) {
        TreeSet<String> ta = tokens(a);
        TreeSet<String> tb = tokens(b);
        if (ta.isEmpty() || tb.isEmpty()) return 0.0;

        TreeSet<String> intersection = new TreeSet<>(ta);
        intersection.retainAll(tb);
        TreeSet<String> onlyA = new TreeSet<>(ta);
        onlyA.removeAll(tb);
        TreeSet<String> onlyB = new TreeSet<>(tb);
        onlyB.removeAll(ta);

        String sect = String.join(" ", intersection);
        String combinedA = join(sect, String.join(" ", onlyA));
        String combinedB = join(sect, String.join(" ", onlyB));

        double best = ratio(combinedA, combinedB);
        if (!sect.isEmpty() && !FUNCTION_WORDS.containsAll(intersection)) {
            best = Math.max(best, Math.max(ratio(sect, combinedA), ratio(sect, combinedB)));
        }
        return best;
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) return right;
        if (right.isEmpty()) return left;
        return left + " " + right;
    }

    private static TreeSet<String> tokens(String s) {
        if (s == null) return new TreeSet<>();
        String cleaned = s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
        if (cleaned.isEmpty()) return new TreeSet<>();
        List<String> parts = new ArrayList<>(Arrays.asList(cleaned.split("\\s+")));
        return new TreeSet<>(parts);
    }
}
