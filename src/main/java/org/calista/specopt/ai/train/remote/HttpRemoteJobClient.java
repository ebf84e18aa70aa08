package org.calista.specopt.ai.train.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.Objects;

/**
 * HTTP client for the remote compute service.
 *
 * <ul>
 *   <li>{@code POST {base}/submit} with {@code {"kind":..,"payload":..}} returns {@code {"id":..}}</li>
 *   <li>{@code GET {base}/status/{id}} returns {@code {"id":..,"status":..,"message":..}}</li>
 * </ul>
 * An API key, when set, is sent as a bearer token.
 */
public final class HttpRemoteJobClient implements RemoteJobClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteJobClient.class);

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpRemoteJobClient(String baseUrl, String apiKey, Duration timeout, ObjectMapper objectMapper) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl is blank");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public JobHandle submit(String kind, JsonNode payload) throws IOException {
        Objects.requireNonNull(kind, "kind");
        ObjectNode body = objectMapper.createObjectNode();
        body.put("kind", kind);
        body.set("payload", payload == null ? objectMapper.createObjectNode() : payload);

        HttpRequest req = request("/submit")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();

        JsonNode response = send(req);
        JsonNode id = response.get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw new IOException("Remote compute accepted the job but returned no id: " + response);
        }
        JobHandle handle = new JobHandle(id.asText(), kind, baseUrl, System.currentTimeMillis());
        log.info("Submitted remote job {} (kind={}) to {}", handle.id(), kind, baseUrl);
        return handle;
    }

    @Override
    public JobStatus status(JobHandle handle) throws IOException {
        Objects.requireNonNull(handle, "handle");
        HttpRequest req = request("/status/" + URLEncoder.encode(handle.id(), StandardCharsets.UTF_8))
                .GET()
                .build();
        JsonNode response = send(req);
        String state = response.path("status").asText(response.path("state").asText("unknown"));
        String message = response.hasNonNull("message") ? response.get("message").asText() : null;
        log.debug("Remote job {} status: {}", handle.id(), state);
        return new JobStatus(handle.id(), state, message);
    }

    // ---------------------------------------------------------------------

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (apiKey != null) b.header("Authorization", "Bearer " + apiKey);
        return b;
    }

    private JsonNode send(HttpRequest req) throws IOException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted calling " + req.uri(), e);
        }
        int code = response.statusCode();
        if (code < 200 || code >= 300) {
            throw new IOException("Remote compute " + req.method() + " " + req.uri() + " failed: HTTP " + code
                    + " " + truncate(response.body()));
        }
        String body = response.body();
        if (body == null || body.isBlank()) return objectMapper.createObjectNode();
        return objectMapper.readTree(body);
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
