package com.ai.assistant.service;

import com.ai.assistant.dto.ComplaintRecord;
import com.ai.assistant.exception.BackendFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Complaint service over HTTP: {@code POST /api/complaints} and {@code GET /api/complaints/{id}}.
 * Slot names are mapped to the service's field names; unknown slots are sent as they are.
 */
@Service
public class RestComplaintBackendClient implements ComplaintBackendClient {

    private static final Logger log = LoggerFactory.getLogger(RestComplaintBackendClient.class);

    private static final Map<String, String> FIELD_NAMES = Map.of(
            "name", "name",
            "phone", "phone_number",
            "email", "email",
            "details", "complaint_details"
    );

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;

    public RestComplaintBackendClient(RestTemplateBuilder builder,
                                      @Value("${assistant.complaint.base-url}") String baseUrl) {
        this.restTemplate = builder.build();
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    @Override
    public String submit(Map<String, String> fields) {
        Map<String, Object> body = new HashMap<>();
        fields.forEach((slot, value) -> body.put(FIELD_NAMES.getOrDefault(slot, slot), value));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/api/complaints", new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String id = root.path("complaint_id").asText(root.path("_id").asText(""));
            if (StringUtils.isBlank(id)) {
                throw new BackendFailureException("Complaint service returned no complaint_id");
            }
            log.info("Complaint created: {}", id);
            return id;
        } catch (RestClientException | IOException e) {
            throw new BackendFailureException("Failed to create complaint", e);
        }
    }

    @Override
    public Optional<ComplaintRecord> fetch(String complaintId) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(
                    baseUrl + "/api/complaints/{id}", String.class, complaintId);
            ComplaintRecord record = mapper.readValue(response.getBody(), ComplaintRecord.class);
            if (StringUtils.isBlank(record.getComplaintId())) {
                record.setComplaintId(complaintId);
            }
            return Optional.of(record);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Complaint {} not found", complaintId);
            return Optional.empty();
        } catch (RestClientException | IOException e) {
            throw new BackendFailureException("Failed to fetch complaint " + complaintId, e);
        }
    }
}
