package com.memos.plugin.chroma;

import java.util.List;
import java.util.Map;

/**
 * Handle on one Chroma collection. Handles may go stale when the collection is deleted; operations then
 * fail with {@link CollectionNotFoundException} (local) or a {@link ChromaException} (remote).
 */
public interface ChromaCollection {

    /** Collection metadata key naming the distance function ({@code l2}, {@code cosine}, {@code ip}). */
    String SPACE_KEY = "hnsw:space";

    String name();

    /** Backend id of the collection. */
    String id();

    /** Collection metadata, e.g. {@code hnsw:space}. */
    Map<String, Object> metadata();

    /**
     * Inserts or replaces records. Lists are aligned by index; {@code metadatas} and {@code documents}
     * may be null or contain null entries.
     */
    void upsert(List<String> ids, List<List<Float>> embeddings,
                List<Map<String, Object>> metadatas, List<String> documents);

    /**
     * Updates existing records; null columns are left untouched, unknown ids are skipped.
     */
    void update(List<String> ids, List<List<Float>> embeddings,
                List<Map<String, Object>> metadatas, List<String> documents);

    /**
     * Reads records with embeddings, metadatas and documents.
     *
     * @param ids   restrict to these ids; null = all
     * @param where metadata filter; null = all
     * @param limit maximum rows; null = unlimited
     */
    ChromaGetResult get(List<String> ids, Map<String, Object> where, Integer limit);

    /**
     * Nearest neighbours of each query embedding, closest first, with distances.
     *
     * @param where metadata filter; null = all
     */
    ChromaQueryResult query(List<List<Float>> queryEmbeddings, int nResults, Map<String, Object> where);

    /** Deletes records by id; unknown ids are ignored. */
    void delete(List<String> ids);

    int count();
}
