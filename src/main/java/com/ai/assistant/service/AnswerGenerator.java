package com.ai.assistant.service;

import com.ai.assistant.conversation.ConversationTurn;
import com.ai.assistant.dto.RetrievedDocument;
import com.ai.assistant.exception.BackendFailureException;

import java.util.List;

/**
 * Produces answer text for a document question from the retrieved passages.
 */
public interface AnswerGenerator {

    String generate(String query, List<RetrievedDocument> documents, List<ConversationTurn> history)
            throws BackendFailureException;
}
