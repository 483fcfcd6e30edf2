package com.memos.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Backend selection plus backend-specific settings, e.g.
 * <pre>{"backend": "chroma", "config": {"collection_name": "memories", "vector_dimension": 768, "path": "/data/chroma"}}</pre>
 * The backend name is normalized to lower case; {@code config} is kept as a raw map and interpreted by
 * the backend provider (for Chroma, {@link ChromaVecDbConfig#fromMap(Map)}).
 */
public final class VectorDbConfigFactory {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String backend;
    private final Map<String, Object> config;

    @JsonCreator
    public VectorDbConfigFactory(
            @JsonProperty("backend") String backend,
            @JsonProperty("config") Map<String, Object> config) {
        if (backend == null || backend.isBlank()) {
            throw new IllegalArgumentException("Missing 'backend'");
        }
        this.backend = backend.trim().toLowerCase(Locale.ROOT);
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
    }

    public static VectorDbConfigFactory fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Vector DB config JSON is empty");
        }
        try {
            return MAPPER.readValue(json.trim(), VectorDbConfigFactory.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static VectorDbConfigFactory fromMap(Map<String, Object> raw) {
        return MAPPER.convertValue(raw, new TypeReference<VectorDbConfigFactory>() { });
    }

    @JsonProperty("backend")
    public String getBackend() {
        return backend;
    }

    @JsonProperty("config")
    public Map<String, Object> getConfig() {
        return config;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
