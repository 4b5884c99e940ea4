package com.ai.eligibility.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion through OpenAI Chat Completions.
 */
public class OpenAiTextCompletion implements TextCompletion {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextCompletion.class);

    private static final String URL = "https://api.openai.com/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final double temperature;

    public OpenAiTextCompletion(RestTemplate restTemplate, String apiKey, String model, double temperature) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
    }

    @Override
    public String complete(String prompt) {
        if (StringUtils.isBlank(apiKey)) {
            log.error("OPENAI_API_KEY is not set");
            throw new TextCompletionException("OpenAI API key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(URL, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            return root.path("choices").path(0).path("message").path("content").asText("");
        } catch (RestClientException ex) {
            throw new TextCompletionException("OpenAI request failed", ex);
        } catch (IOException | IllegalArgumentException ex) {
            throw new TextCompletionException("Unreadable OpenAI response", ex);
        }
    }
}
