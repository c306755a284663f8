package com.shlawgathon.featuretracker.backend.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classification oracle backed by the Anthropic Messages API.
 * <p>
 * Each HTTP call is bounded by {@code tracker.oracle.timeout}. Transport errors, non-200 responses and
 * unparsable replies are retried up to {@code tracker.oracle.max-attempts} times with a linearly growing delay;
 * when attempts run out the result is {@link OracleResult#failed(String)} and the feature stays pending.
 */
@Service
public class AnthropicClassificationOracle implements ClassificationOracle {

    private static final Logger log = LoggerFactory.getLogger(AnthropicClassificationOracle.class);

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OracleResponseParser responseParser = new OracleResponseParser();
    private final TaggingPromptBuilder promptBuilder;

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration backoff;

    public AnthropicClassificationOracle(ObjectMapper objectMapper,
            @Value("${tracker.oracle.base-url:https://api.anthropic.com}") String baseUrl,
            @Value("${tracker.oracle.api-key:}") String apiKey,
            @Value("${tracker.oracle.model:claude-3-5-haiku-latest}") String model,
            @Value("${tracker.oracle.max-tokens:1024}") int maxTokens,
            @Value("${tracker.oracle.timeout:60s}") Duration timeout,
            @Value("${tracker.oracle.max-attempts:3}") int maxAttempts,
            @Value("${tracker.oracle.backoff:2s}") Duration backoff,
            @Value("${tracker.others-primary:Others}") String fallbackPrimary) {
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff;
        this.promptBuilder = new TaggingPromptBuilder(fallbackPrimary);
    }

    @Override
    public OracleResult classify(String title, String description, Taxonomy taxonomy) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[ORACLE] No API key configured (tracker.oracle.api-key), leaving '{}' pending", title);
            return OracleResult.failed("oracle not configured");
        }

        String prompt = promptBuilder.build(title, description, taxonomy);
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String reply = requestCompletion(prompt);
                Optional<OracleResponseParser.Proposal> proposal = responseParser.parse(reply);
                if (proposal.isPresent()) {
                    log.debug("[ORACLE] '{}' -> {} (hint: {})", title,
                            proposal.get().subtags(), proposal.get().primaryHint());
                    return OracleResult.proposed(proposal.get().subtags(), proposal.get().primaryHint());
                }
                lastError = "unparsable reply";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OracleResult.failed("interrupted");
            } catch (IOException | RuntimeException e) {
                lastError = rootCauseMessage(e);
            }

            if (attempt < maxAttempts) {
                long delay = backoff.toMillis() * attempt;
                log.warn("[ORACLE] Attempt {}/{} for '{}' failed ({}), retrying in {}ms",
                        attempt, maxAttempts, title, lastError, delay);
                if (!sleep(delay)) {
                    return OracleResult.failed("interrupted");
                }
            }
        }

        log.warn("[ORACLE] Giving up on '{}' after {} attempts: {}", title, maxAttempts, lastError);
        return OracleResult.failed(lastError);
    }

    /**
     * Sends one Messages API request and returns the text of the first content block.
     */
    protected String requestCompletion(String prompt) throws IOException, InterruptedException {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", ANTHROPIC_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            log.error("[ORACLE] API error: {} - {}", response.statusCode(), abbreviate(response.body()));
            throw new IOException("Anthropic API error: " + response.statusCode());
        }

        JsonNode responseJson = objectMapper.readTree(response.body());
        return responseJson
                .path("content")
                .path(0)
                .path("text")
                .asText("");
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return abbreviate(msg);
    }

    private static String abbreviate(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
