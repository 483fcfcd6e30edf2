package com.memos.plugin.chroma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memos.config.ChromaTarget;
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
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Chroma client over the server's REST API ({@code /api/v1}). Collections are addressed by name for
 * lifecycle calls (scoped by tenant and database) and by id for record operations.
 * Sends {@code Authorization: Basic ...} when the target has credentials.
 */
public final class ChromaHttpClient implements ChromaClient {

    private static final Logger log = LoggerFactory.getLogger(ChromaHttpClient.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String tenant;
    private final String database;
    private final String authorization;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public ChromaHttpClient(ChromaTarget.RemoteTarget target, String tenant, String database, Duration requestTimeout) {
        Objects.requireNonNull(target, "target");
        this.baseUrl = target.baseUrl() + "/api/v1";
        this.tenant = tenant;
        this.database = database;
        this.authorization = target.hasCredentials() ? basicAuth(target.username(), target.password()) : null;
        this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(30);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    static String basicAuth(String username, String password) {
        String credentials = username + ":" + (password != null ? password : "");
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public ChromaCollection createCollection(String name, Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        if (metadata != null && !metadata.isEmpty()) {
            body.put("metadata", metadata);
        }
        body.put("get_or_create", false);
        JsonNode node = send("POST", "/collections" + scope(), body);
        return toCollection(node);
    }

    @Override
    public ChromaCollection getCollection(String name) {
        try {
            return toCollection(send("GET", "/collections/" + encode(name) + scope(), null));
        } catch (ChromaException e) {
            if (isNotFound(e)) {
                throw new CollectionNotFoundException(name);
            }
            throw e;
        }
    }

    @Override
    public List<ChromaCollection> listCollections() {
        JsonNode node = send("GET", "/collections" + scope(), null);
        List<ChromaCollection> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode c : node) {
                out.add(toCollection(c));
            }
        }
        return out;
    }

    @Override
    public void deleteCollection(String name) {
        send("DELETE", "/collections/" + encode(name) + scope(), null);
    }

    @Override
    public void close() {
        // java.net.http.HttpClient has no close() before JDK 21; connections are released on GC.
    }

    private static boolean isNotFound(ChromaException e) {
        if (e.getStatusCode() == 404) return true;
        String msg = e.getMessage();
        return msg != null && msg.contains("does not exist");
    }

    @SuppressWarnings("unchecked")
    private ChromaCollection toCollection(JsonNode node) {
        if (node == null || !node.hasNonNull("id")) {
            throw new ChromaException("Unexpected collection response: " + node);
        }
        Map<String, Object> metadata = node.hasNonNull("metadata")
                ? MAPPER.convertValue(node.get("metadata"), Map.class)
                : Map.of();
        return new ChromaHttpCollection(this, node.get("id").asText(), node.path("name").asText(), metadata);
    }

    private String scope() {
        return "?tenant=" + encode(tenant) + "&database=" + encode(database);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Sends one request and parses the JSON response.
     *
     * @param body request body serialized with Jackson; null for no body
     * @return parsed body, or null when the response is empty
     * @throws ChromaException on non-2xx status, I/O failure or interruption
     */
    JsonNode send(String method, String path, Object body) {
        URI uri = URI.create(baseUrl + path);
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body != null
                    ? HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8)
                    : HttpRequest.BodyPublishers.noBody();
        } catch (IOException e) {
            throw new ChromaException("Chroma request body for " + path + " cannot be serialized", e);
        }
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .method(method, publisher);
        if (authorization != null) {
            req.header("Authorization", authorization);
        }

        HttpResponse<String> res;
        try {
            res = httpClient.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ChromaException("Chroma " + method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChromaException("Chroma " + method + " " + path + " interrupted", e);
        }
        if (res.statusCode() < 200 || res.statusCode() >= 300) {
            throw new ChromaException("Chroma " + method + " " + path + " failed: "
                    + res.statusCode() + " " + res.body(), res.statusCode());
        }
        log.trace("Chroma {} {} -> {}", method, path, res.statusCode());
        String text = res.body();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new ChromaException("Chroma " + method + " " + path + " returned invalid JSON", e);
        }
    }
}
