package dev.hiringvault.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Thin client for the Google AI Studio (Gemini) generateContent REST API.
 * Answers are expected to be a single JSON object, optionally wrapped in a markdown fence.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiClient {

    private static final Pattern JSON_FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String geminiPath;
    private final Duration callTimeout;

    public GeminiClient(
            ObjectMapper objectMapper,
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-2.5-flash}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            @Value("${app.ai.gemini.call-timeout:60s}") Duration callTimeout) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);
        this.callTimeout = callTimeout;

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! AI extraction and scoring will fail.");
        } else {
            log.info("Gemini adapters enabled with model: {} (Key present)", model);
        }
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Send a prompt and map the JSON answer to the given type.
     */
    public <T> Mono<T> generateJson(String prompt, Class<T> responseType) {
        return generate(prompt).map(text -> parse(text, responseType));
    }

    /**
     * Send a prompt and return the text of the first candidate answer.
     */
    @SuppressWarnings("null")
    public Mono<String> generate(String prompt) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Gemini API key is not configured"));
        }
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildRequest(prompt))
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .timeout(callTimeout)
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2))
                        .filter(this::isRetryableError)
                        .doBeforeRetry(signal -> log.info("Retrying Gemini call (Attempt {})",
                                signal.totalRetries() + 1)))
                .map(this::extractContent);
    }

    <T> T parse(String text, Class<T> responseType) {
        String json = JSON_FENCE.matcher(text).replaceAll("").trim();
        try {
            return objectMapper.readValue(json, responseType);
        } catch (JsonProcessingException e) {
            // The exception message echoes the payload, do not propagate it
            throw new MalformedAiResponseException(responseType.getSimpleName());
        }
    }

    /**
     * Short description of a failure, safe to log: never includes response bodies.
     */
    public static String describe(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        if (e instanceof MalformedAiResponseException) {
            return e.getMessage();
        }
        if (Exceptions.isRetryExhausted(e) && e.getCause() != null) {
            return describe(e.getCause());
        }
        return e.getClass().getSimpleName();
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.2, 8192, "application/json"));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw new MalformedAiResponseException("empty response");
        }

        var answer = response.candidates().get(0);
        if (answer.finishReason() != null && !answer.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", answer.finishReason());
        }
        if (answer.content() == null || answer.content().parts() == null || answer.content().parts().isEmpty()) {
            throw new MalformedAiResponseException("answer without content");
        }

        String text = answer.content().parts().get(0).text();
        if (text == null || text.isBlank()) {
            throw new MalformedAiResponseException("blank answer");
        }
        return text;
    }

    private boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    /**
     * The model answered, but not with what was asked for.
     */
    public static class MalformedAiResponseException extends RuntimeException {
        MalformedAiResponseException(String detail) {
            super("Malformed AI response: " + detail);
        }
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens, String responseMimeType) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Answer> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Answer(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
