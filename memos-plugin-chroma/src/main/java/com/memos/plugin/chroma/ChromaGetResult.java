package com.memos.plugin.chroma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Column-oriented result of a collection {@code get}: entry {@code i} of each list belongs to
 * {@code ids.get(i)}. Columns that were not included are null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChromaGetResult(
        List<String> ids,
        List<List<Float>> embeddings,
        List<Map<String, Object>> metadatas,
        List<String> documents
) {
    public ChromaGetResult {
        ids = ids != null ? ids : List.of();
    }

    public static ChromaGetResult empty() {
        return new ChromaGetResult(List.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public int size() {
        return ids.size();
    }

    public List<Float> embedding(int i) {
        return embeddings != null && i < embeddings.size() ? embeddings.get(i) : null;
    }

    public Map<String, Object> metadata(int i) {
        return metadatas != null && i < metadatas.size() ? metadatas.get(i) : null;
    }

    public String document(int i) {
        return documents != null && i < documents.size() ? documents.get(i) : null;
    }
}
