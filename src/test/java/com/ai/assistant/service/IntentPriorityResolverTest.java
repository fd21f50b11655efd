package com.ai.assistant.service;

import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.conversation.SignalSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentPriorityResolverTest {

    private final IntentPriorityResolver resolver = new IntentPriorityResolver();

    @Test
    void sourceRankBeatsConfidence() {
        IntentResult fuzzy = IntentResult.of(IntentLabel.FILE_COMPLAINT, 0.72, SignalSource.FUZZY);
        IntentResult nlp = IntentResult.of(IntentLabel.RETRIEVE_COMPLAINT, 0.95, SignalSource.NLP);

        assertSame(fuzzy, resolver.resolve(List.of(nlp, fuzzy)).orElseThrow());
        assertTrue(resolver.hasConflict(List.of(nlp, fuzzy)));
    }

    @Test
    void confidenceBreaksTiesWithinSource() {
        IntentResult low = IntentResult.of(IntentLabel.FILE_COMPLAINT, 0.71, SignalSource.FUZZY);
        IntentResult high = IntentResult.of(IntentLabel.RETRIEVE_COMPLAINT, 0.88, SignalSource.FUZZY);

        assertSame(high, resolver.resolve(List.of(low, high)).orElseThrow());
    }

    @Test
    void emptyCandidates() {
        assertTrue(resolver.resolve(List.of()).isEmpty());
        assertTrue(resolver.resolve(null).isEmpty());
        assertFalse(resolver.hasConflict(List.of(IntentResult.of(IntentLabel.FILE_COMPLAINT, 1.0, SignalSource.PATTERN))));
    }
}
