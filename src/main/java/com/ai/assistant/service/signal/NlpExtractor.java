package com.ai.assistant.service.signal;

import jakarta.annotation.PreDestroy;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight keyword and entity extraction. Words are stemmed with Lucene's English analyzer so
 * "complained", "complaints" and "complain" meet the same vocabulary entry.
 */
@Component
public class NlpExtractor {

    private static final Logger log = LoggerFactory.getLogger(NlpExtractor.class);

    private static final List<String> DOMAIN_WORDS = List.of(
            "complaint", "complain", "grievance", "ticket", "dissatisfied", "unsatisfied", "unhappy"
    );
    private static final List<String> ISSUE_WORDS = List.of(
            "issue", "problem", "concern", "case", "status", "report"
    );
    private static final List<String> FILING_VERBS = List.of(
            "file", "submit", "make", "register", "lodge", "raise"
    );
    private static final List<String> RETRIEVAL_VERBS = List.of(
            "show", "see", "find", "get", "check", "track", "view", "retrieve", "look"
    );

    private static final List<String> DOCUMENT_WORDS = List.of(
            "manual", "document", "documentation", "docs", "guide", "handbook", "policy", "faq",
            "brochure", "terms", "instructions"
    );

    private static final Set<String> QUESTION_STARTS = Set.of(
            "what", "how", "why", "when", "where", "which", "who", "whom", "whose",
            "is", "are", "can", "could", "does", "do", "did", "should", "would", "will",
            "explain", "describe", "define", "tell"
    );

    /** Leading words dropped when a question is reduced to its subject. */
    private static final Set<String> TOPIC_LEAD_WORDS = Set.of(
            "what", "how", "why", "when", "where", "which", "who", "whose", "is", "are", "was", "were",
            "can", "could", "does", "do", "did", "should", "would", "will", "the", "a", "an", "i", "we",
            "you", "me", "my", "our", "your", "please", "tell", "explain", "describe", "define", "say",
            "says", "about", "there", "any", "much", "many", "long", "it", "they", "this", "that"
    );

    private static final Pattern TOPIC_MARKER = Pattern.compile(
            "\\b(?:about|regarding|concerning)\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_DETERMINER = Pattern.compile(
            "^(?:the|a|an|my|your|our|their|its)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9']+");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\w+])(\\+\\d{1,3}\\s?)?(\\(\\d{3}\\)\\s?|\\d{3}[-. ]?)\\d{3}[-. ]?\\d{4}\\b");
    private static final Pattern ORDER_NUMBER = Pattern.compile(
            "(?:\\border\\s+(?:number|no\\.?)?\\s*#?\\s*|#)(\\d{3,})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS_ONLY = Pattern.compile("^[\\d-]+$");

    private final Analyzer analyzer = new EnglishAnalyzer(CharArraySet.EMPTY_SET);
    private final Set<String> domainStems;
    private final Set<String> issueStems;
    private final Set<String> filingStems;
    private final Set<String> retrievalStems;
    private final Set<String> documentStems;

    public NlpExtractor() {
        this.domainStems = stemAll(DOMAIN_WORDS);
        this.issueStems = stemAll(ISSUE_WORDS);
        this.filingStems = stemAll(FILING_VERBS);
        this.retrievalStems = stemAll(RETRIEVAL_VERBS);
        this.documentStems = stemAll(DOCUMENT_WORDS);
    }

    public NlpSignals extract(String utterance) {
        if (StringUtils.isBlank(utterance)) return NlpSignals.empty();
        String text = utterance.trim();

        List<String> words = words(text);
        List<String> stems = stems(text);

        Set<String> domain = new LinkedHashSet<>();
        boolean issue = false;
        boolean filing = false;
        boolean retrieval = false;
        boolean document = false;
        for (String s : stems) {
            if (domainStems.contains(s)) domain.add(s);
            if (issueStems.contains(s)) issue = true;
            if (filingStems.contains(s)) filing = true;
            if (retrievalStems.contains(s)) retrieval = true;
            if (documentStems.contains(s)) document = true;
        }

        boolean question = text.endsWith("?") || (!words.isEmpty() && QUESTION_STARTS.contains(words.get(0)));

        Map<String, String> entities = new LinkedHashMap<>();
        String email = findEmail(text);
        if (email != null) entities.put(NlpSignals.EMAIL, email);
        String phone = findPhone(text);
        if (phone != null) entities.put(NlpSignals.PHONE, phone);
        Matcher order = ORDER_NUMBER.matcher(text);
        if (order.find()) entities.put(NlpSignals.ORDER_NUMBER, order.group(1));
        String id = ComplaintIds.find(text);
        if (id != null && !(phone != null && DIGITS_ONLY.matcher(id).matches())
                && !(entities.containsKey(NlpSignals.ORDER_NUMBER) && id.equals(entities.get(NlpSignals.ORDER_NUMBER)))) {
            entities.put(NlpSignals.COMPLAINT_ID, id);
        }

        NlpSignals signals = new NlpSignals(words, domain, issue, filing, retrieval, question, document, entities);
        log.debug("NLP signals for '{}': {}", text, signals);
        return signals;
    }

    public String findEmail(String text) {
        if (text == null) return null;
        Matcher m = EMAIL.matcher(text);
        return m.find() ? m.group() : null;
    }

    public String findPhone(String text) {
        if (text == null) return null;
        Matcher m = PHONE.matcher(text);
        return m.find() ? m.group().trim() : null;
    }

    /**
     * Subject of a question: the phrase after "about"/"regarding"/"concerning" when present, else the
     * question with its leading interrogative and filler words removed.
     */
    public String topicPhrase(String text) {
        if (StringUtils.isBlank(text)) return "";
        String t = text.trim().replaceAll("[?!.]+$", "").trim();
        Matcher m = TOPIC_MARKER.matcher(t);
        if (m.find()) {
            String phrase = LEADING_DETERMINER.matcher(m.group(1).trim()).replaceFirst("");
            if (StringUtils.isNotBlank(phrase)) return phrase.trim();
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(t.split("\\s+")));
        int start = 0;
        while (start < tokens.size() && TOPIC_LEAD_WORDS.contains(tokens.get(start).toLowerCase(Locale.ROOT))) {
            start++;
        }
        return String.join(" ", tokens.subList(start, tokens.size())).trim();
    }

    /** Lower-cased words as typed. */
    public List<String> words(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    /** Porter stems of the text's tokens. */
    public List<String> stems(String text) {
        List<String> out = new ArrayList<>();
        if (StringUtils.isBlank(text)) return out;
        try (TokenStream ts = analyzer.tokenStream("text", text)) {
            CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                out.add(term.toString());
            }
            ts.end();
        } catch (IOException e) {
            log.warn("Tokenization failed for '{}': {}", text, e.toString());
        }
        return out;
    }

    private Set<String> stemAll(List<String> words) {
        Set<String> out = new HashSet<>();
        for (String w : words) {
            out.addAll(stems(w));
        }
        return out;
    }

    @PreDestroy
    public void close() {
        analyzer.close();
    }
}
