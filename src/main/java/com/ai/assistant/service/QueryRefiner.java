package com.ai.assistant.service;

import com.ai.assistant.conversation.ConversationContext;
import com.ai.assistant.conversation.ConversationTurn;
import com.ai.assistant.service.signal.NlpExtractor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a follow-up document question into a self-contained retrieval query using the most
 * recent document question in the session. Only ellipsis ("what about X") and pronoun anaphora
 * are resolved; anything else is returned untouched.
 */
@Service
public class QueryRefiner {

    private static final Logger log = LoggerFactory.getLogger(QueryRefiner.class);

    private static final Pattern WHAT_ABOUT = Pattern.compile(
            "^(?:and\\s+)?(?:what|how)\\s+about\\s+(.+?)[?.!]*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_TOPIC = Pattern.compile("^and\\s+(.+?)[?.!]*$", Pattern.CASE_INSENSITIVE);
    /** "and X" is elliptical only for a short noun phrase; longer or clause-like remainders stand alone. */
    private static final int MAX_AND_TOPIC_WORDS = 4;
    private static final Set<String> CLAUSE_STARTS = Set.of(
            "what", "how", "why", "when", "where", "which", "who", "whose", "is", "are", "was", "were",
            "can", "could", "do", "does", "did", "should", "would", "will", "may", "i", "we", "you",
            "he", "she", "it", "they", "there", "then", "also", "tell", "show", "explain", "give", "let"
    );
    private static final Pattern PRONOUN = Pattern.compile(
            "\\b(it|its|they|them|their|this|that|these|those)\\b", Pattern.CASE_INSENSITIVE);
    private static final Set<String> DEMONSTRATIVES = Set.of("this", "that", "these", "those");
    /** A demonstrative followed by one of these (or nothing) stands alone rather than qualifying a noun. */
    private static final Pattern DEMONSTRATIVE_FOLLOWER = Pattern.compile(
            "^\\s*(?:$|[?.!,]|(?:is|are|was|were|mean|means)\\b)",
            Pattern.CASE_INSENSITIVE);

    private final NlpExtractor nlpExtractor;

    public QueryRefiner(NlpExtractor nlpExtractor) {
        this.nlpExtractor = nlpExtractor;
    }

    public String refine(String utterance, ConversationContext context) {
        if (utterance == null || context == null || !context.isRefinementEnabled()) return utterance;
        ConversationTurn previous = lastDocumentQuery(context);
        if (previous == null) return utterance;

        String previousQuery = StringUtils.defaultIfBlank(previous.getRetrievalQuery(), previous.getUtterance());
        String text = utterance.trim();

        String newTopic = ellipsisTopic(text);
        if (newTopic != null) {
            String refined = replaceTopic(previousQuery, newTopic);
            log.debug("Refined ellipsis '{}' -> '{}'", utterance, refined);
            return refined;
        }

        Matcher pronoun = PRONOUN.matcher(text);
        while (pronoun.find()) {
            String word = pronoun.group(1).toLowerCase(Locale.ROOT);
            if (DEMONSTRATIVES.contains(word)
                    && !DEMONSTRATIVE_FOLLOWER.matcher(text.substring(pronoun.end())).find()) {
                continue;
            }
            String topic = nlpExtractor.topicPhrase(previousQuery);
            if (StringUtils.isBlank(topic)) return utterance;
            String replacement = "its".equals(word) || "their".equals(word) ? topic + "'s" : topic;
            String refined = text.substring(0, pronoun.start()) + replacement + text.substring(pronoun.end());
            log.debug("Refined anaphora '{}' -> '{}'", utterance, refined);
            return refined;
        }
        return utterance;
    }

    /** The topic of "what about X" / "and X", or null when the utterance is not elliptical. */
    private static String ellipsisTopic(String text) {
        Matcher whatAbout = WHAT_ABOUT.matcher(text);
        if (whatAbout.matches()) return whatAbout.group(1).trim();

        Matcher and = AND_TOPIC.matcher(text);
        if (!and.matches()) return null;
        String topic = and.group(1).trim();
        String[] words = topic.split("\\s+");
        if (words.length > MAX_AND_TOPIC_WORDS || CLAUSE_STARTS.contains(words[0].toLowerCase(Locale.ROOT))) {
            return null;
        }
        return topic;
    }

    /** Previous query with its topic swapped for {@code newTopic}; appended when the topic cannot be located. */
    private String replaceTopic(String previousQuery, String newTopic) {
        String oldTopic = nlpExtractor.topicPhrase(previousQuery);
        if (StringUtils.isNotBlank(oldTopic)) {
            int at = previousQuery.toLowerCase(Locale.ROOT).lastIndexOf(oldTopic.toLowerCase(Locale.ROOT));
            if (at >= 0) {
                return previousQuery.substring(0, at) + newTopic + previousQuery.substring(at + oldTopic.length());
            }
        }
        return previousQuery.replaceAll("[?.!]+$", "").trim() + " " + newTopic;
    }

    private static ConversationTurn lastDocumentQuery(ConversationContext context) {
        List<ConversationTurn> history = context.getHistory();
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isDocumentQuery()) return history.get(i);
        }
        return null;
    }
}
