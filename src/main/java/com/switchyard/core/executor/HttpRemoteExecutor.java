package com.switchyard.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.router.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * JSON-over-HTTP remote executor.
 *
 * <p>Sends {@code POST {endpoint}/{tool}} with the parameter map as the request body
 * and expects {@code {"result": ...}} back. Transport failures and request timeouts are
 * reported as {@link RemoteUnreachableException}; error statuses and malformed bodies as
 * {@link ErrorKind#REMOTE_EXECUTION_FAILED}.
 */
@Service
public class HttpRemoteExecutor implements RemoteExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteExecutor.class);

    private final String endpoint;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpRemoteExecutor(RouterProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getRemote().getConnectTimeoutMs()))
                .build());
    }

    HttpRemoteExecutor(RouterProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
        this.endpoint = stripTrailingSlash(properties.getRemote().getEndpoint());
        this.requestTimeout = Duration.ofMillis(properties.getRemote().getTimeoutMs());
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public Object execute(String tool, Map<String, Object> parameters) {
        String body;
        try {
            body = objectMapper.writeValueAsString(parameters == null ? Map.of() : parameters);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(ErrorKind.REMOTE_EXECUTION_FAILED,
                    "Cannot serialize parameters for " + tool, e);
        }

        var request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/" + URLEncoder.encode(tool, StandardCharsets.UTF_8)))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new RemoteUnreachableException("Remote call to " + tool + " timed out after "
                    + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new RemoteUnreachableException("Remote backend unreachable for " + tool + ": "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnreachableException("Interrupted calling remote backend for " + tool, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.debug("Remote {} returned HTTP {}: {}", tool, response.statusCode(), response.body());
            throw new ToolExecutionException(ErrorKind.REMOTE_EXECUTION_FAILED,
                    "Remote " + tool + " returned HTTP " + response.statusCode() + ": " + errorMessage(response.body()));
        }
        return parseResult(tool, response.body());
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    private Object parseResult(String tool, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(ErrorKind.REMOTE_EXECUTION_FAILED,
                    "Malformed response from remote " + tool, e);
        }
        if (root == null || !root.isObject() || !root.has("result")) {
            throw new ToolExecutionException(ErrorKind.REMOTE_EXECUTION_FAILED,
                    "Response from remote " + tool + " has no 'result' field");
        }
        return objectMapper.convertValue(root.get("result"), Object.class);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.hasNonNull("error")) {
                return root.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body from remote is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
