package com.memos.plugin.chroma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Result of a collection {@code query}. Every column is nested one level deeper than in
 * {@link ChromaGetResult}: the outer list has one entry per query embedding.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChromaQueryResult(
        List<List<String>> ids,
        List<List<List<Float>>> embeddings,
        List<List<Map<String, Object>>> metadatas,
        List<List<String>> documents,
        List<List<Double>> distances
) {
    public ChromaQueryResult {
        ids = ids != null ? ids : List.of();
    }

    public int batchCount() {
        return ids.size();
    }

    /** Rows of query {@code batch}; empty when there is no such batch. */
    public ChromaGetResult batch(int batch) {
        if (batch >= ids.size()) {
            return ChromaGetResult.empty();
        }
        return new ChromaGetResult(
                ids.get(batch),
                column(embeddings, batch),
                column(metadatas, batch),
                column(documents, batch));
    }

    /** Distances of query {@code batch}, aligned with {@code batch(batch).ids()}; null when not included. */
    public List<Double> distances(int batch) {
        return column(distances, batch);
    }

    private static <T> List<T> column(List<List<T>> nested, int batch) {
        return nested != null && batch < nested.size() ? nested.get(batch) : null;
    }
}
