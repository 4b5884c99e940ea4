package com.ai.eligibility.config;

import com.ai.eligibility.service.OllamaTextCompletion;
import com.ai.eligibility.service.OpenAiTextCompletion;
import com.ai.eligibility.service.TextCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Locale;

/**
 * Picks the text-completion provider from {@code llm.provider}.
 */
@Configuration
public class TextCompletionConfig {

    private static final Logger log = LoggerFactory.getLogger(TextCompletionConfig.class);

    @Value("${llm.provider:ollama}")
    private String provider;

    @Value("${llm.temperature:0.3}")
    private double temperature;

    @Value("${llm.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${llm.read-timeout:60s}")
    private Duration readTimeout;

    @Value("${ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ollama.model:llama3.2}")
    private String ollamaModel;

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Bean
    public TextCompletion textCompletion(RestTemplateBuilder builder) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        String name = provider.trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case "ollama":
                log.info("Using Ollama text completion: {} model={}", ollamaBaseUrl, ollamaModel);
                return new OllamaTextCompletion(restTemplate, ollamaBaseUrl, ollamaModel, temperature);
            case "openai":
                log.info("Using OpenAI text completion: model={}", openAiModel);
                return new OpenAiTextCompletion(restTemplate, openAiApiKey, openAiModel, temperature);
            default:
                throw new IllegalStateException("Unknown llm.provider: " + provider + " (expected ollama or openai)");
        }
    }
}
