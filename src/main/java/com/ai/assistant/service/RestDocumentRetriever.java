package com.ai.assistant.service;

import com.ai.assistant.dto.RetrievedDocument;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts {@code {query, topK}} to a search endpoint and reads back {@code results[]} (or a bare
 * array) of {@code {content|text, source, score}}. With no URL configured retrieval is off and
 * every search comes back empty.
 */
@Service
public class RestDocumentRetriever implements DocumentRetriever {

    private static final Logger log = LoggerFactory.getLogger(RestDocumentRetriever.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String url;

    public RestDocumentRetriever(RestTemplateBuilder builder,
                                 @Value("${assistant.retrieval.url:}") String url) {
        this.restTemplate = builder.build();
        this.url = url;
        if (StringUtils.isBlank(url)) {
            log.warn("assistant.retrieval.url is not set; document retrieval is disabled");
        }
    }

    @Override
    public List<RetrievedDocument> search(String query, int topK) {
        if (StringUtils.isBlank(url) || StringUtils.isBlank(query)) return List.of();

        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("topK", topK);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "[]"));
            JsonNode results = root.isArray() ? root : root.path("results");
            List<RetrievedDocument> docs = new ArrayList<>();
            for (JsonNode n : results) {
                docs.add(RetrievedDocument.builder()
                        .content(n.path("content").asText(n.path("text").asText("")))
                        .source(n.path("source").asText(null))
                        .score(n.path("score").asDouble(0.0))
                        .build());
            }
            log.debug("Retrieved {} documents for '{}'", docs.size(), query);
            return docs;
        } catch (RestClientException | IOException e) {
            throw new BackendFailureException("Document search failed", e);
        }
    }
}
