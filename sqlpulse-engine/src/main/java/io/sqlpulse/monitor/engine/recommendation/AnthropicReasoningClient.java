package io.sqlpulse.monitor.engine.recommendation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlpulse.monitor.engine.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Calls the Anthropic messages API and parses the advice from the first text block of the reply
 */
public class AnthropicReasoningClient implements ReasoningClient {
    private static final Logger logger = LoggerFactory.getLogger(AnthropicReasoningClient.class);

    static final String API_VERSION = "2023-06-01";

    static final String SYSTEM_PROMPT = "You are a MySQL performance analyst. You receive the findings of a "
            + "health check and supporting metrics as JSON. Reply with a single JSON object and nothing else, in "
            + "the form {\"recommendations\":[{\"findings\":[\"<finding key>\"],\"priority\":\"high|medium|low\","
            + "\"advice\":\"<what to do and why>\",\"command\":\"<optional single SQL statement>\"}]}. "
            + "Reference findings only by the keys given. Omit command when no statement applies.";

    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AnthropicReasoningClient(MonitorConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(config.getReasoningTimeout())
                .build(), new ObjectMapper());
    }

    public AnthropicReasoningClient(MonitorConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this.endpoint = config.getReasoningEndpoint();
        this.apiKey = config.getReasoningApiKey();
        this.model = config.getReasoningModel();
        this.maxTokens = config.getReasoningMaxTokens();
        this.temperature = config.getReasoningTemperature();
        this.timeout = config.getReasoningTimeout();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ReasoningResponse analyze(ReasoningRequest request) throws RecommendationServiceException {
        String body = buildBody(request);

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RecommendationServiceException("Reasoning service call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecommendationServiceException("Interrupted while calling the reasoning service", e);
        }

        if (response.statusCode() != 200) {
            throw new RecommendationServiceException("Reasoning service answered with status " + response.statusCode());
        }
        logger.debug("Reasoning service answered with {} bytes", response.body() == null ? 0 : response.body().length());
        return ReasoningResponse.parse(extractText(response.body()), objectMapper);
    }

    String buildBody(ReasoningRequest request) throws RecommendationServiceException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("system", SYSTEM_PROMPT);
        ArrayNode messages = body.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        message.put("content", "Analyse these MySQL monitoring results and propose optimisations:\n" + request.toJson());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RecommendationServiceException("Cannot serialize reasoning request", e);
        }
    }

    private String extractText(String responseBody) throws RecommendationServiceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (JsonProcessingException e) {
            throw new RecommendationServiceException("Reasoning service body is not JSON", e);
        }
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                return block.get("text").asText();
            }
        }
        throw new RecommendationServiceException("Reasoning service reply has no text content");
    }
}
