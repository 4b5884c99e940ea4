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
 * Completion through a local Ollama server ({@code /api/chat}, non-streaming).
 */
public class OllamaTextCompletion implements TextCompletion {

    private static final Logger log = LoggerFactory.getLogger(OllamaTextCompletion.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String model;
    private final double temperature;

    public OllamaTextCompletion(RestTemplate restTemplate, String baseUrl, String model, double temperature) {
        this.restTemplate = restTemplate;
        this.baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
        this.model = model;
        this.temperature = temperature;
    }

    @Override
    public String complete(String prompt) {
        String url = baseUrl + "/api/chat";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("stream", false);
        body.put("options", Map.of("temperature", temperature));
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String content = root.path("message").path("content").asText("");
            log.debug("Ollama completion model={} chars={}", model, content.length());
            return content;
        } catch (RestClientException ex) {
            throw new TextCompletionException("Ollama request to " + url + " failed", ex);
        } catch (IOException | IllegalArgumentException ex) {
            throw new TextCompletionException("Unreadable Ollama response", ex);
        }
    }
}
