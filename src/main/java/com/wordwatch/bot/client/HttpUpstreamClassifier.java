package com.wordwatch.bot.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wordwatch.bot.config.MonitorConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpUpstreamClassifier implements UpstreamClassifier {
    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClassifier.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);
    private static final String FORBIDDEN_STATUS = "forbidden";

    private final URI endpoint;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpUpstreamClassifier(MonitorConfig.UpstreamSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    HttpUpstreamClassifier(MonitorConfig.UpstreamSettings settings, HttpClient httpClient) {
        try {
            this.endpoint = URI.create(settings.endpoint());
        } catch (IllegalArgumentException error) {
            throw new IllegalStateException("MOD_API_ENDPOINT is not a valid URI", error);
        }
        this.requestTimeout = settings.timeout();
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Verdict classify(String text) throws UpstreamException, InterruptedException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestPayload(text)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException error) {
            throw new UpstreamException("Classification request failed: " + error.getMessage(), error);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new UpstreamException(
                    response.statusCode(),
                    "Classification service answered HTTP " + response.statusCode()
            );
        }
        return parseResponse(response.body());
    }

    private String buildRequestPayload(String text) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", text);
        return objectMapper.writeValueAsString(payload);
    }

    Verdict parseResponse(String body) throws UpstreamException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException error) {
            throw new UpstreamException("Classification response was not JSON", error);
        }
        if (root == null || !root.isObject()) {
            throw new UpstreamException("Classification response was not a JSON object", null);
        }
        String status = root.path("status").asText("");
        if (!FORBIDDEN_STATUS.equalsIgnoreCase(status.trim())) {
            return Verdict.clean();
        }
        List<String> words = new ArrayList<>();
        for (JsonNode word : root.path("forbidden_words")) {
            String value = word.asText("").trim();
            if (!value.isEmpty() && !words.contains(value)) {
                words.add(value);
            }
        }
        log.debug("Upstream flagged text with {} term(s)", words.size());
        return Verdict.violation(words);
    }
}
