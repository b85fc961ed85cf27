package com.forecast.sync.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.graph.DocumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * {@link ExternalSystemClient} over HTTP/JSON.
 *
 * <p>Reads with {@code GET /organizations/{org}/entities/{id}} and writes with
 * {@code PUT /organizations/{org}/entities/{id}} carrying {@code expectedVersion} and the changed
 * fields. Status codes map as follows: 2xx success, 409 conflict, 408/429/5xx transient,
 * 400/401/403/404 permanent rejection.</p>
 *
 * <pre>
 * ExternalSystemClient client = HttpExternalSystemClient.builder()
 *     .baseUrl("https://records.example.com/api")
 *     .apiToken(token)
 *     .build();
 * </pre>
 */
public class HttpExternalSystemClient implements ExternalSystemClient {
    private static final Logger log = LoggerFactory.getLogger(HttpExternalSystemClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String apiToken;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpExternalSystemClient(Builder builder) {
        if (builder.baseUrl == null || builder.baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.apiToken = builder.apiToken;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = DocumentCodec.mapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RemoteState fetchCurrentState(String organizationId, String entityId) {
        HttpRequest request = request(organizationId, entityId).GET().build();
        HttpResponse<String> response = send(request, entityId);
        int status = response.statusCode();
        if (status == 404) {
            throw new NotFoundException("Remote entity", organizationId + "/" + entityId);
        }
        if (status / 100 != 2) {
            throw new TransientSyncException(errorCode(status), "Fetch of " + entityId + " returned " + status);
        }
        JsonNode body = parse(response.body());
        return new RemoteState(
                DocumentCodec.fromNode(body.path("document")),
                body.path("version").asLong(),
                body.hasNonNull("lastModifiedBy") ? body.get("lastModifiedBy").asText() : null,
                timestamp(body.path("lastModifiedAt")));
    }

    @Override
    public PushResult pushDelta(String organizationId, String entityId, Document deltaFields,
                                long expectedBaseVersion) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(
                    new PushRequest(expectedBaseVersion, DocumentCodec.toNode(deltaFields)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode delta for " + entityId, e);
        }
        HttpRequest request = request(organizationId, entityId)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        HttpResponse<String> response = send(request, entityId);
        int status = response.statusCode();
        log.debug("external.push entityId={} status={}", entityId, status);
        if (status / 100 == 2) {
            JsonNode body = response.body() == null || response.body().isBlank() ? null : parse(response.body());
            Document confirmed = body != null && body.path("document").isObject()
                    ? DocumentCodec.fromNode(body.get("document"))
                    : null;
            long confirmedVersion = body != null ? body.path("version").asLong(0) : 0;
            return PushResult.success(confirmed, confirmedVersion);
        }
        if (status == 409) {
            return PushResult.conflict("Remote version moved past " + expectedBaseVersion);
        }
        String code = errorCode(status);
        String message = "Push of " + entityId + " returned " + status;
        if (isRetryable(status)) {
            return PushResult.transientError(code, message);
        }
        return PushResult.rejected(code, message);
    }

    private HttpRequest.Builder request(String organizationId, String entityId) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/organizations/" + encode(organizationId)
                        + "/entities/" + encode(entityId)))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (apiToken != null) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String entityId) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientSyncException("NETWORK_ERROR", "Call for " + entityId + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientSyncException("INTERRUPTED", "Call for " + entityId + " interrupted", e);
        }
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientSyncException("INVALID_RESPONSE", "Malformed response body", e);
        }
    }

    static boolean isRetryable(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    static String errorCode(int status) {
        return switch (status) {
            case 400 -> "INVALID_REQUEST";
            case 401, 403 -> "UNAUTHORIZED";
            case 404 -> "NOT_FOUND";
            case 408 -> "TIMEOUT";
            case 409 -> "VERSION_CONFLICT";
            case 429 -> "RATE_LIMIT";
            case 503 -> "SERVICE_UNAVAILABLE";
            default -> status >= 500 ? "SERVER_ERROR" : "HTTP_" + status;
        };
    }

    private static Instant timestamp(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.debug("external.fetch unparseable lastModifiedAt={}", node.asText());
            return null;
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public record PushRequest(
            @JsonProperty("expectedVersion") long expectedVersion,
            @JsonProperty("changes") JsonNode changes
    ) {}

    public static class Builder {
        private String baseUrl;
        private String apiToken;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpExternalSystemClient build() {
            return new HttpExternalSystemClient(this);
        }
    }
}
