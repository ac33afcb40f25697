package com.codeagent.guard.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Policy backend reached over HTTP. Reads {@code backend.json} from the configuration directory:
 * <pre>{"endpoint": "http://host/check", "timeoutMillis": 1500, "headers": {"Authorization": "..."}}</pre>
 */
public class HttpPolicyBackend implements PolicyBackend {
    public static final String CONFIG_FILE = "backend.json";
    static final String DEFAULT_BLOCK_MESSAGE = "Input blocked by policy backend.";

    private static final Logger log = LoggerFactory.getLogger(HttpPolicyBackend.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private final Path configDirectory;
    private final Duration defaultRequestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private volatile Endpoint endpoint;

    public HttpPolicyBackend(Path configDirectory, Duration requestTimeout) {
        this.configDirectory = Objects.requireNonNull(configDirectory, "configDirectory");
        this.defaultRequestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BackendSettings(String endpoint, Long timeoutMillis, Map<String, String> headers) {}

    private record Endpoint(URI uri, Duration timeout, Map<String, String> headers) {}

    @Override
    public synchronized boolean initialize() {
        if (endpoint != null) {
            return true;
        }
        Path file = configDirectory.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(file)) {
            log.info("No policy backend configuration at {}; using built-in checks only", file);
            return false;
        }
        try {
            BackendSettings settings = objectMapper.readValue(file.toFile(), BackendSettings.class);
            if (settings.endpoint() == null || settings.endpoint().isBlank()) {
                log.error("Policy backend configuration {} has no endpoint", file);
                return false;
            }
            URI uri = URI.create(settings.endpoint().trim());
            if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                log.error("Policy backend endpoint must be http(s): {}", uri);
                return false;
            }
            Duration timeout = settings.timeoutMillis() == null || settings.timeoutMillis() <= 0
                    ? defaultRequestTimeout
                    : Duration.ofMillis(settings.timeoutMillis());
            Map<String, String> headers = settings.headers() == null ? Map.of() : Map.copyOf(settings.headers());
            endpoint = new Endpoint(uri, timeout, headers);
            log.info("Policy backend initialized at {}", uri);
            return true;
        } catch (IOException | IllegalArgumentException error) {
            log.error("Failed to initialize policy backend from {}: {}", file, error.getMessage());
            return false;
        }
    }

    @Override
    public boolean isInitialized() {
        return endpoint != null;
    }

    @Override
    public CompletableFuture<BackendVerdict> evaluate(List<BackendMessage> messages) {
        Endpoint target = endpoint;
        if (target == null) {
            return CompletableFuture.failedFuture(new BackendUnavailableException("Policy backend not initialized"));
        }
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(target.uri())
                    .timeout(target.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestPayload(messages)));
            target.headers().forEach(builder::header);
            request = builder.build();
        } catch (IOException | IllegalArgumentException error) {
            return CompletableFuture.failedFuture(new BackendUnavailableException("Could not build backend request", error));
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::parseResponse);
    }

    private String buildRequestPayload(List<BackendMessage> messages) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("messages");
        for (BackendMessage message : messages) {
            array.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        return objectMapper.writeValueAsString(payload);
    }

    private BackendVerdict parseResponse(HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new CompletionException(
                    new BackendUnavailableException("Policy backend HTTP status " + response.statusCode())
            );
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException error) {
            throw new CompletionException(new BackendUnavailableException("Unreadable policy backend response", error));
        }
        JsonNode blocked = root == null ? null : root.get("blocked");
        if (blocked == null || !blocked.isBoolean()) {
            throw new CompletionException(
                    new BackendUnavailableException("Policy backend response missing boolean 'blocked'")
            );
        }
        String message = root.path("message").asText("");
        if (blocked.booleanValue() && message.isBlank()) {
            message = DEFAULT_BLOCK_MESSAGE;
        }
        return new BackendVerdict(blocked.booleanValue(), message.isBlank() ? null : message.trim());
    }
}
