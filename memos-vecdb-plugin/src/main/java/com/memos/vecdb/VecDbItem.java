package com.memos.vecdb;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One record of a vector collection: id, optional vector, payload and (search results only) score.
 * <p>
 * By convention the payload carries a {@value #METADATA} map (arbitrary nested structure) and an
 * optional {@value #MEMORY} string (the document body). The id is immutable; uniqueness within a
 * collection is the backend's concern (upsert: last write wins).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VecDbItem {

    /** Payload key of the metadata map. */
    public static final String METADATA = "metadata";
    /** Payload key of the document body. */
    public static final String MEMORY = "memory";

    private final String id;
    private final List<Float> vector;
    private final Map<String, Object> payload;
    private final Double score;

    @JsonCreator
    public VecDbItem(
            @JsonProperty("id") String id,
            @JsonProperty("vector") List<Float> vector,
            @JsonProperty("payload") Map<String, Object> payload,
            @JsonProperty("score") Double score) {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Item id must not be blank");
        }
        this.id = id;
        this.vector = vector != null ? Collections.unmodifiableList(new ArrayList<>(vector)) : null;
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.score = score;
    }

    public VecDbItem(String id, List<Float> vector, Map<String, Object> payload) {
        this(id, vector, payload, null);
    }

    /**
     * Normalizes an external map ({@code id}, {@code vector}, {@code payload}, {@code score}) into an item.
     * A missing id gets a random UUID; vector entries may be any {@link Number}.
     *
     * @throws IllegalArgumentException if vector or payload have the wrong shape
     */
    @SuppressWarnings("unchecked")
    public static VecDbItem fromMap(Map<String, ?> data) {
        Objects.requireNonNull(data, "data");
        Object rawId = data.get("id");
        String id = rawId != null ? rawId.toString() : UUID.randomUUID().toString();

        List<Float> vector = toVector(data.get("vector"));

        Object rawPayload = data.get("payload");
        Map<String, Object> payload;
        if (rawPayload == null) {
            payload = Map.of();
        } else if (rawPayload instanceof Map) {
            payload = (Map<String, Object>) rawPayload;
        } else {
            throw new IllegalArgumentException("'payload' must be a map, got " + rawPayload.getClass().getSimpleName());
        }

        Object rawScore = data.get("score");
        Double score = rawScore instanceof Number ? ((Number) rawScore).doubleValue() : null;
        return new VecDbItem(id, vector, payload, score);
    }

    public static List<VecDbItem> fromMaps(List<? extends Map<String, ?>> data) {
        List<VecDbItem> items = new ArrayList<>(data.size());
        for (Map<String, ?> m : data) {
            items.add(fromMap(m));
        }
        return items;
    }

    private static List<Float> toVector(Object vecObj) {
        if (vecObj == null) return null;
        if (vecObj instanceof float[]) {
            float[] f = (float[]) vecObj;
            List<Float> out = new ArrayList<>(f.length);
            for (float x : f) out.add(x);
            return out;
        }
        if (vecObj instanceof double[]) {
            double[] d = (double[]) vecObj;
            List<Float> out = new ArrayList<>(d.length);
            for (double x : d) out.add((float) x);
            return out;
        }
        if (vecObj instanceof List) {
            List<?> list = (List<?>) vecObj;
            List<Float> out = new ArrayList<>(list.size());
            for (Object x : list) {
                if (!(x instanceof Number)) {
                    throw new IllegalArgumentException("'vector' entries must be numbers, got " + x);
                }
                out.add(((Number) x).floatValue());
            }
            return out;
        }
        throw new IllegalArgumentException("'vector' must be float[], double[], or List<Number>");
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /** Null for payload-only items. */
    @JsonProperty("vector")
    public List<Float> getVector() {
        return vector;
    }

    public boolean hasVector() {
        return vector != null && !vector.isEmpty();
    }

    @JsonProperty("payload")
    public Map<String, Object> getPayload() {
        return payload;
    }

    /** Similarity/distance from a search; null otherwise. Never persisted. */
    @JsonProperty("score")
    public Double getScore() {
        return score;
    }

    /** The {@value #METADATA} map of the payload, or an empty map when absent or not a map. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMetadata() {
        Object m = payload.get(METADATA);
        return m instanceof Map ? (Map<String, Object>) m : Map.of();
    }

    /** The {@value #MEMORY} document body, or null. */
    public String getMemory() {
        Object m = payload.get(MEMORY);
        return m != null ? m.toString() : null;
    }

    public VecDbItem withScore(Double score) {
        return new VecDbItem(id, vector, payload, score);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("vector", vector);
        out.put("payload", payload);
        if (score != null) out.put("score", score);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VecDbItem)) return false;
        VecDbItem that = (VecDbItem) o;
        return id.equals(that.id)
                && Objects.equals(vector, that.vector)
                && payload.equals(that.payload)
                && Objects.equals(score, that.score);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, vector, payload, score);
    }

    @Override
    public String toString() {
        return "VecDbItem{id=" + id
                + ", dim=" + (vector != null ? vector.size() : 0)
                + ", payload=" + payload
                + (score != null ? ", score=" + score : "") + "}";
    }
}
