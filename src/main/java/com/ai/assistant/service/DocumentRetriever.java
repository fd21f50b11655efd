package com.ai.assistant.service;

import com.ai.assistant.dto.RetrievedDocument;
import com.ai.assistant.exception.BackendFailureException;

import java.util.List;

/**
 * Similarity search over the document corpus.
 */
public interface DocumentRetriever {

    List<RetrievedDocument> search(String query, int topK) throws BackendFailureException;
}
