package dev.hiringvault.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Builds Gemini clients pointed at a {@link MockWebServer} and canned generateContent answers.
 */
final class GeminiTestSupport {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private GeminiTestSupport() {
    }

    static GeminiClient client(MockWebServer server, String apiKey) {
        String baseUrl = server.url("/").toString().replaceAll("/$", "");
        return new GeminiClient(MAPPER, apiKey, "gemini-test", baseUrl,
                "/v1beta/models/%s:generateContent", Duration.ofSeconds(5));
    }

    static MockResponse answer(String text) {
        try {
            String body = MAPPER.writeValueAsString(Map.of("candidates", List.of(Map.of(
                    "content", Map.of("parts", List.of(Map.of("text", text))),
                    "finishReason", "STOP"))));
            return new MockResponse()
                    .setBody(body)
                    .setHeader("Content-Type", "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    static MockResponse status(int code) {
        return new MockResponse()
                .setResponseCode(code)
                .setBody("{\"error\":{\"message\":\"jane.doe@example.com rejected\"}}")
                .setHeader("Content-Type", "application/json");
    }
}
