package com.memos.plugin.chroma;

import com.memos.config.ChromaVecDbConfig;
import com.memos.vecdb.JsonMetadataCodec;
import com.memos.vecdb.MetadataCodec;
import com.memos.vecdb.VecDb;
import com.memos.vecdb.VecDbItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link VecDb} over one Chroma collection.
 * <p>
 * Writes send {@code payload.metadata} (encoded by the {@link MetadataCodec}, since Chroma metadata only
 * holds flat scalars) as the record metadata and {@code payload.memory} as the document. Reads return
 * {@code payload = {"metadata": decoded metadata, "memory": document}}.
 * <p>
 * The collection is created on construction if absent. Every operation fetches the collection handle
 * through {@link #getCollection()}, which recreates the collection once if the fetch fails.
 */
public final class ChromaVecDb implements VecDb {

    private static final Logger log = LoggerFactory.getLogger(ChromaVecDb.class);

    private final ChromaVecDbConfig config;
    private final ChromaClient client;
    private final MetadataCodec codec;

    public ChromaVecDb(ChromaVecDbConfig config) {
        this(config, ChromaClients.create(config));
    }

    public ChromaVecDb(ChromaVecDbConfig config, ChromaClient client) {
        this(config, client, JsonMetadataCodec.getInstance());
    }

    public ChromaVecDb(ChromaVecDbConfig config, ChromaClient client, MetadataCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
        ensureCollection();
    }

    public ChromaVecDbConfig getConfig() {
        return config;
    }

    /**
     * Live handle on the configured collection. If the fetch fails the collection is (re)created and the
     * fetch retried exactly once; a second failure propagates.
     */
    public ChromaCollection getCollection() {
        String name = config.getCollectionName();
        try {
            return client.getCollection(name);
        } catch (RuntimeException e) {
            log.warn("Fetching collection '{}' failed ({}); recreating and retrying once", name, e.getMessage());
            ensureCollection();
            return client.getCollection(name);
        }
    }

    @Override
    public void ensureCollection() {
        String name = config.getCollectionName();
        if (collectionExists(name)) {
            log.warn("Collection '{}' (vector dimension: {}) already exists. Skipping creation.",
                    name, config.getVectorDimension());
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ChromaCollection.SPACE_KEY, config.getDistanceMetric().spaceName());
        metadata.put("dimension", config.getVectorDimension());
        client.createCollection(name, metadata);
        log.info("Collection '{}' created (vector dimension: {}, distance: {})",
                name, config.getVectorDimension(), config.getDistanceMetric().spaceName());
    }

    @Override
    public Set<String> listCollections() {
        Set<String> names = new LinkedHashSet<>();
        for (ChromaCollection c : client.listCollections()) {
            names.add(c.name());
        }
        return names;
    }

    @Override
    public void deleteCollection(String name) {
        client.deleteCollection(name);
        log.info("Collection '{}' deleted", name);
    }

    @Override
    public boolean collectionExists(String name) {
        try {
            client.getCollection(name);
            return true;
        } catch (RuntimeException e) {
            log.debug("Collection '{}' not found: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public List<VecDbItem> search(List<Float> queryVector, int topK, Map<String, Object> filter) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        ChromaQueryResult response = getCollection().query(List.of(queryVector), topK, whereOf(filter));
        ChromaGetResult rows = response.batch(0);
        List<Double> distances = response.distances(0);
        List<VecDbItem> items = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Double score = distances != null && i < distances.size() ? distances.get(i) : null;
            items.add(toItem(rows, i, score));
        }
        log.info("Chroma search completed with {} results.", items.size());
        return items;
    }

    @Override
    public Optional<VecDbItem> getById(String id) {
        Objects.requireNonNull(id, "id");
        ChromaGetResult response = getCollection().get(List.of(id), null, null);
        if (response.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toItem(response, 0, null));
    }

    @Override
    public List<VecDbItem> getByIds(List<String> ids) {
        Objects.requireNonNull(ids, "ids");
        if (ids.isEmpty()) {
            return List.of();
        }
        return toItems(getCollection().get(ids, null, null));
    }

    @Override
    public List<VecDbItem> getByFilter(Map<String, Object> filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<VecDbItem> items = toItems(getCollection().get(null, whereOf(filter), limit));
        log.info("Chroma retrieve by filter completed with {} results.", items.size());
        return items;
    }

    @Override
    public void add(List<VecDbItem> items) {
        Objects.requireNonNull(items, "items");
        if (items.isEmpty()) {
            return;
        }
        List<String> ids = new ArrayList<>(items.size());
        List<List<Float>> embeddings = new ArrayList<>(items.size());
        List<Map<String, Object>> metadatas = new ArrayList<>(items.size());
        List<String> documents = new ArrayList<>(items.size());
        for (VecDbItem item : items) {
            if (!item.hasVector()) {
                throw new IllegalArgumentException("Item " + item.getId() + " has no vector");
            }
            ids.add(item.getId());
            embeddings.add(item.getVector());
            metadatas.add(encode(item));
            documents.add(item.getMemory());
        }
        getCollection().upsert(ids, embeddings, metadatas, documents);
        log.debug("Upserted {} item(s) into '{}'", ids.size(), config.getCollectionName());
    }

    /** Payload-only updates go to Chroma's update endpoint, which skips unknown ids. */
    @Override
    public void update(String id, VecDbItem item) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(item, "item");
        List<Map<String, Object>> metadatas = new ArrayList<>(1);
        metadatas.add(encode(item));
        if (item.hasVector()) {
            List<String> documents = new ArrayList<>(1);
            documents.add(item.getMemory());
            getCollection().upsert(List.of(id), List.of(item.getVector()), metadatas, documents);
        } else {
            getCollection().update(List.of(id), null, metadatas, null);
        }
    }

    @Override
    public void delete(List<String> ids) {
        Objects.requireNonNull(ids, "ids");
        if (ids.isEmpty()) {
            return;
        }
        getCollection().delete(ids);
    }

    /** Chroma has no secondary payload indexes. */
    @Override
    public void ensurePayloadIndexes(List<String> fields) {
        log.debug("Chroma does not support payload indexes; ignoring request for {}", fields);
    }

    @Override
    public void close() {
        client.close();
    }

    /** Empty filter means "no filter" (Chroma rejects an empty where clause). */
    private static Map<String, Object> whereOf(Map<String, Object> filter) {
        return filter == null || filter.isEmpty() ? null : filter;
    }

    /** Null when there is no metadata (Chroma rejects empty metadata maps). */
    private Map<String, Object> encode(VecDbItem item) {
        Map<String, Object> encoded = codec.encodeMetadata(item.getMetadata());
        return encoded.isEmpty() ? null : encoded;
    }

    private List<VecDbItem> toItems(ChromaGetResult response) {
        List<VecDbItem> items = new ArrayList<>(response.size());
        for (int i = 0; i < response.size(); i++) {
            items.add(toItem(response, i, null));
        }
        return items;
    }

    private VecDbItem toItem(ChromaGetResult rows, int i, Double score) {
        Map<String, Object> payload = new LinkedHashMap<>();
        Map<String, Object> metadata = rows.metadata(i);
        payload.put(VecDbItem.METADATA, codec.decodeMetadata(metadata != null ? metadata : Map.of()));
        String document = rows.document(i);
        if (document != null) {
            payload.put(VecDbItem.MEMORY, document);
        }
        return new VecDbItem(rows.ids().get(i), rows.embedding(i), payload, score);
    }
}
