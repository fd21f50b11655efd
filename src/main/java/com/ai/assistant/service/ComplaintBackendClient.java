package com.ai.assistant.service;

import com.ai.assistant.dto.ComplaintRecord;
import com.ai.assistant.exception.BackendFailureException;

import java.util.Map;
import java.util.Optional;

/**
 * Remote store of complaint records.
 */
public interface ComplaintBackendClient {

    /** Creates a complaint from slot name to value and returns its id. */
    String submit(Map<String, String> fields) throws BackendFailureException;

    /** Empty when no complaint has this id. */
    Optional<ComplaintRecord> fetch(String complaintId) throws BackendFailureException;
}
