package com.memos.vecdb;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Contract for a vector database facade over one collection: collection lifecycle, similarity search,
 * point lookup and writes over {@link VecDbItem}s.
 * <p>
 * Filters are backend-native metadata predicates expressed as maps (e.g. {@code {"tag": "x"}});
 * an empty or null filter matches everything. All calls are synchronous; backend failures propagate
 * unchanged.
 */
public interface VecDb extends AutoCloseable {

    /** Default page size of {@link #getByFilter(Map)}, {@link #getAll()} and {@link #count(Map)}. */
    int DEFAULT_LIMIT = 100;

    /** Creates the configured collection unless it already exists. Idempotent. */
    void ensureCollection();

    /** Names of all collections in the backend. */
    Set<String> listCollections();

    void deleteCollection(String name);

    /** Existence probe; any lookup failure counts as "does not exist". */
    boolean collectionExists(String name);

    /**
     * Nearest neighbours of {@code queryVector}, best match first, each with {@link VecDbItem#getScore()} set.
     *
     * @param topK   maximum number of results, positive
     * @param filter optional metadata filter, may be null
     * @return results; empty when nothing matches
     */
    List<VecDbItem> search(List<Float> queryVector, int topK, Map<String, Object> filter);

    default List<VecDbItem> search(List<Float> queryVector, int topK) {
        return search(queryVector, topK, null);
    }

    /** The item with this id, or empty when not found. */
    Optional<VecDbItem> getById(String id);

    /** Found items only; missing ids are omitted. Order is not guaranteed to follow {@code ids}. */
    List<VecDbItem> getByIds(List<String> ids);

    List<VecDbItem> getByFilter(Map<String, Object> filter, int limit);

    default List<VecDbItem> getByFilter(Map<String, Object> filter) {
        return getByFilter(filter, DEFAULT_LIMIT);
    }

    default List<VecDbItem> getAll(int limit) {
        return getByFilter(Map.of(), limit);
    }

    default List<VecDbItem> getAll() {
        return getAll(DEFAULT_LIMIT);
    }

    /**
     * Number of items matching {@code filter}, defined as {@code getByFilter(filter).size()}.
     * Items are fetched to be counted and the result is capped at {@link #DEFAULT_LIMIT}.
     */
    default int count(Map<String, Object> filter) {
        return getByFilter(filter).size();
    }

    default int count() {
        return count(null);
    }

    /** Upserts the items: an existing id is overwritten entirely (vector, metadata, document). */
    void add(List<VecDbItem> items);

    /**
     * Updates one item. With a vector: vector, metadata and document are replaced. Without a vector:
     * only the metadata is replaced, vector and document stay as stored, and an id that does not exist
     * is skipped without error (nothing is created).
     */
    void update(String id, VecDbItem item);

    default void update(String id, Map<String, ?> item) {
        update(id, VecDbItem.fromMap(item));
    }

    /** Insert-or-replace by id; same semantics as {@link #add(List)}. */
    default void upsert(List<VecDbItem> items) {
        add(items);
    }

    /** Deletes by id; unknown ids are not an error. */
    void delete(List<String> ids);

    /**
     * Creates secondary indexes on the given payload fields where the backend supports them.
     * Must be idempotent; may be a no-op.
     */
    void ensurePayloadIndexes(List<String> fields);

    /** Releases the backend client. */
    @Override
    void close();
}
