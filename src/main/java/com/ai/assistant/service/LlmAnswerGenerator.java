package com.ai.assistant.service;

import com.ai.assistant.conversation.ConversationTurn;
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
 * Answers from retrieved context with an OpenAI-compatible chat completions endpoint (Groq by default).
 */
@Service
public class LlmAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmAnswerGenerator.class);

    static final String SYSTEM_PROMPT = "Answer the question as truthfully as possible using the provided context.\n"
            + "If the user wants to file a complaint, tell them to write \"I want to file a complaint\" and follow the instructions.\n"
            + "If the user asks about a complaint status, tell them to write \"Get complaint status\" along with the complaint ID.\n"
            + "If the answer is not contained within the text and you don't have enough information, say 'I don't have enough "
            + "information to answer that question. Please provide more details or turn on query refinement.'\n"
            + "Be concise, helpful, and informative.";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${assistant.llm.api-key:}")
    private String apiKey;

    @Value("${assistant.llm.url:https://api.groq.com/openai/v1/chat/completions}")
    private String url;

    @Value("${assistant.llm.model:llama3-70b-8192}")
    private String model;

    @Value("${assistant.llm.temperature:0.7}")
    private double temperature;

    public LlmAnswerGenerator(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    @Override
    public String generate(String query, List<RetrievedDocument> documents, List<ConversationTurn> history) {
        if (StringUtils.isBlank(apiKey)) {
            throw new BackendFailureException("assistant.llm.api-key is not set");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", SYSTEM_PROMPT));
        for (ConversationTurn turn : history) {
            if (StringUtils.isBlank(turn.getResponse())) continue;
            messages.add(message("user", turn.getUtterance()));
            messages.add(message("assistant", turn.getResponse()));
        }
        messages.add(message("user", "Context:\n" + context(documents) + "\n\nQuestion: " + query));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String answer = root.path("choices").path(0).path("message").path("content").asText("").trim();
            log.debug("LLM answer for '{}': {}", query, answer);
            return answer;
        } catch (RestClientException | IOException e) {
            throw new BackendFailureException("Answer generation failed", e);
        }
    }

    private static String context(List<RetrievedDocument> documents) {
        StringBuilder sb = new StringBuilder();
        for (RetrievedDocument d : documents) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(d.getContent());
        }
        return sb.toString();
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }
}
