package com.liquiplan.forecast.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.liquiplan.forecast.config.LiquiplanProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin client for an OpenAI Responses compatible endpoint. Returns empty on any failure.
 */
@Component
public class NarrativeEnrichmentClient {

    private static final Logger log = LoggerFactory.getLogger(NarrativeEnrichmentClient.class);
    private static final int DEFAULT_MAX_TOKENS = 400;
    private static final int MAX_TOKENS = 2048;

    private final LiquiplanProperties.Ai ai;
    private final RestClient restClient;

    public record Message(String role, String content) {}

    public record ResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    public NarrativeEnrichmentClient(LiquiplanProperties properties) {
        this.ai = properties.ai();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(5));
        requestFactory.setReadTimeout(Duration.ofMillis(ai.timeoutOrDefault()));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        log.info("Narrative client configured: model={} enabled={} readTimeoutMs={}", ai.model(), ai.hasApiKey(), ai.timeoutOrDefault());
    }

    public boolean hasCredentials() {
        return ai.hasApiKey();
    }

    public Optional<String> generateText(List<Message> input, Integer maxOutputTokens) {
        if (!hasCredentials()) {
            return Optional.empty();
        }
        int maxTokens = Optional.ofNullable(maxOutputTokens).filter(value -> value > 0).orElse(DEFAULT_MAX_TOKENS);
        ResponsesRequest body = new ResponsesRequest(ai.model(), input, Math.min(maxTokens, MAX_TOKENS));
        try {
            JsonNode response = restClient.post()
                    .uri(ai.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(ai.apiKey()))
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response);
            }
            return Optional.ofNullable(text).map(String::trim).filter(value -> !value.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("Narrative call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("Narrative call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    // Responses payloads nest text under output[].content[].text
    private String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        for (String field : List.of("content", "text", "output_text")) {
            String nested = extractText(node.get(field));
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        return null;
    }
}
