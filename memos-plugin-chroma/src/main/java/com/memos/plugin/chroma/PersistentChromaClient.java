package com.memos.plugin.chroma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Embedded Chroma-compatible store for local mode. Each collection lives in memory and in
 * {@code <path>/<name>.json}, rewritten after every mutation. Queries are exact (brute force) using the
 * collection's {@code hnsw:space}: {@code l2} (squared Euclidean, the default), {@code cosine}
 * (1 - cosine similarity) or {@code ip} (1 - inner product).
 * <p>
 * All methods synchronize on the client; collection handles delegate here and fail with
 * {@link CollectionNotFoundException} once their collection is deleted.
 */
public final class PersistentChromaClient implements ChromaClient {

    private static final Logger log = LoggerFactory.getLogger(PersistentChromaClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FILE_SUFFIX = ".json";
    private static final Pattern NAME_PATTERN = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{1,61}[a-zA-Z0-9]");

    private final Path directory;
    /** name → collection, in creation order. */
    private final Map<String, StoredCollection> collections = new LinkedHashMap<>();

    public PersistentChromaClient(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create Chroma directory " + directory, e);
        }
        load();
    }

    private void load() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                CollectionFile cf = MAPPER.readValue(file.toFile(), CollectionFile.class);
                StoredCollection c = new StoredCollection(cf.id(), cf.name(), cf.metadata());
                if (cf.records() != null) {
                    for (StoredRecord r : cf.records()) {
                        c.records.put(r.id(), r);
                    }
                }
                collections.put(c.name, c);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load Chroma collections from " + directory, e);
        }
        log.debug("Loaded {} Chroma collection(s) from {}", collections.size(), directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized ChromaCollection createCollection(String name, Map<String, Object> metadata) {
        if (name == null || !NAME_PATTERN.matcher(name).matches() || name.contains("..")) {
            throw new IllegalArgumentException("Invalid collection name: " + name
                    + " (3-63 chars of [a-zA-Z0-9._-], starting and ending with a letter or digit)");
        }
        if (collections.containsKey(name)) {
            throw new ChromaException("Collection " + name + " already exists.", 409);
        }
        StoredCollection c = new StoredCollection(UUID.randomUUID().toString(), name, metadata);
        collections.put(name, c);
        persist(c);
        return new Handle(c.name, c.id, c.metadata);
    }

    @Override
    public synchronized ChromaCollection getCollection(String name) {
        StoredCollection c = collections.get(name);
        if (c == null) {
            throw new CollectionNotFoundException(name);
        }
        return new Handle(c.name, c.id, c.metadata);
    }

    @Override
    public synchronized List<ChromaCollection> listCollections() {
        List<ChromaCollection> out = new ArrayList<>();
        for (StoredCollection c : collections.values()) {
            out.add(new Handle(c.name, c.id, c.metadata));
        }
        return out;
    }

    @Override
    public synchronized void deleteCollection(String name) {
        if (collections.remove(name) == null) {
            throw new CollectionNotFoundException(name);
        }
        try {
            Files.deleteIfExists(fileOf(name));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete collection file for " + name, e);
        }
    }

    /** Everything is written on each mutation; nothing to flush. */
    @Override
    public void close() {
        log.debug("Closed local Chroma store at {}", directory);
    }

    private StoredCollection live(String name, String id) {
        StoredCollection c = collections.get(name);
        if (c == null || !c.id.equals(id)) {
            throw new CollectionNotFoundException(name);
        }
        return c;
    }

    private Path fileOf(String name) {
        return directory.resolve(name + FILE_SUFFIX);
    }

    private void persist(StoredCollection c) {
        Path target = fileOf(c.name);
        Path tmp = directory.resolve(c.name + FILE_SUFFIX + ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(),
                    new CollectionFile(c.id, c.name, c.metadata, new ArrayList<>(c.records.values())));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write collection " + c.name + " to " + target, e);
        }
    }

    // ── record operations (called through Handle) ───────────────────────────

    private synchronized void upsert(String name, String id, List<String> ids, List<List<Float>> embeddings,
                                     List<Map<String, Object>> metadatas, List<String> documents) {
        StoredCollection c = live(name, id);
        checkAligned(ids, embeddings, metadatas, documents);
        Map<String, StoredRecord> staged = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            String rid = ids.get(i);
            StoredRecord existing = c.records.get(rid);
            List<Float> embedding = at(embeddings, i);
            if (embedding == null) {
                if (existing == null) {
                    throw new IllegalArgumentException("Record " + rid + " has no embedding");
                }
                embedding = existing.embedding();
            }
            c.checkDimension(embedding, staged);
            staged.put(rid, new StoredRecord(rid, embedding, at(metadatas, i), at(documents, i)));
        }
        c.records.putAll(staged);
        persist(c);
    }

    private synchronized void update(String name, String id, List<String> ids, List<List<Float>> embeddings,
                                     List<Map<String, Object>> metadatas, List<String> documents) {
        StoredCollection c = live(name, id);
        checkAligned(ids, embeddings, metadatas, documents);
        Map<String, StoredRecord> staged = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            String rid = ids.get(i);
            StoredRecord existing = c.records.get(rid);
            if (existing == null) {
                log.warn("Update of nonexisting record ID {} in collection {}; skipping", rid, name);
                continue;
            }
            List<Float> embedding = embeddings != null ? embeddings.get(i) : existing.embedding();
            c.checkDimension(embedding, staged);
            staged.put(rid, new StoredRecord(rid, embedding,
                    metadatas != null ? metadatas.get(i) : existing.metadata(),
                    documents != null ? documents.get(i) : existing.document()));
        }
        if (staged.isEmpty()) {
            return;
        }
        c.records.putAll(staged);
        persist(c);
    }

    private synchronized ChromaGetResult get(String name, String id, List<String> ids,
                                             Map<String, Object> where, Integer limit) {
        StoredCollection c = live(name, id);
        List<StoredRecord> candidates = new ArrayList<>();
        if (ids != null) {
            for (String rid : ids) {
                StoredRecord r = c.records.get(rid);
                if (r != null) candidates.add(r);
            }
        } else {
            candidates.addAll(c.records.values());
        }
        List<StoredRecord> rows = new ArrayList<>();
        for (StoredRecord r : candidates) {
            if (limit != null && rows.size() >= limit) break;
            if (WhereFilter.matches(where, r.metadata())) rows.add(r);
        }
        return toGetResult(rows);
    }

    private synchronized ChromaQueryResult query(String name, String id, List<List<Float>> queryEmbeddings,
                                                 int nResults, Map<String, Object> where) {
        StoredCollection c = live(name, id);
        String space = c.space();
        List<List<String>> ids = new ArrayList<>();
        List<List<List<Float>>> embeddings = new ArrayList<>();
        List<List<Map<String, Object>>> metadatas = new ArrayList<>();
        List<List<String>> documents = new ArrayList<>();
        List<List<Double>> distances = new ArrayList<>();
        for (List<Float> q : queryEmbeddings) {
            c.checkDimension(q, Map.of());
            List<Scored> scored = new ArrayList<>();
            for (StoredRecord r : c.records.values()) {
                if (WhereFilter.matches(where, r.metadata())) {
                    scored.add(new Scored(r, distance(space, q, r.embedding())));
                }
            }
            scored.sort(Comparator.comparingDouble(Scored::distance));
            List<Scored> top = scored.subList(0, Math.min(nResults, scored.size()));
            List<StoredRecord> rows = new ArrayList<>();
            List<Double> d = new ArrayList<>();
            for (Scored s : top) {
                rows.add(s.record());
                d.add(s.distance());
            }
            ChromaGetResult batch = toGetResult(rows);
            ids.add(batch.ids());
            embeddings.add(batch.embeddings());
            metadatas.add(batch.metadatas());
            documents.add(batch.documents());
            distances.add(d);
        }
        return new ChromaQueryResult(ids, embeddings, metadatas, documents, distances);
    }

    private synchronized void delete(String name, String id, List<String> ids) {
        StoredCollection c = live(name, id);
        boolean changed = false;
        for (String rid : ids) {
            changed |= c.records.remove(rid) != null;
        }
        if (changed) persist(c);
    }

    private synchronized int count(String name, String id) {
        return live(name, id).records.size();
    }

    private static ChromaGetResult toGetResult(List<StoredRecord> rows) {
        List<String> ids = new ArrayList<>(rows.size());
        List<List<Float>> embeddings = new ArrayList<>(rows.size());
        List<Map<String, Object>> metadatas = new ArrayList<>(rows.size());
        List<String> documents = new ArrayList<>(rows.size());
        for (StoredRecord r : rows) {
            ids.add(r.id());
            embeddings.add(r.embedding());
            metadatas.add(r.metadata());
            documents.add(r.document());
        }
        return new ChromaGetResult(ids, embeddings, metadatas, documents);
    }

    private static void checkAligned(List<String> ids, List<?>... columns) {
        Objects.requireNonNull(ids, "ids");
        for (List<?> col : columns) {
            if (col != null && col.size() != ids.size()) {
                throw new IllegalArgumentException("Column size " + col.size() + " does not match " + ids.size() + " ids");
            }
        }
    }

    private static <T> T at(List<T> list, int i) {
        return list != null ? list.get(i) : null;
    }

    static double distance(String space, List<Float> a, List<Float> b) {
        double dot = 0, na = 0, nb = 0, l2 = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            na += x * x;
            nb += y * y;
            l2 += (x - y) * (x - y);
        }
        switch (space) {
            case "cosine":
                if (na == 0 || nb == 0) return 1.0;
                return 1.0 - dot / (Math.sqrt(na) * Math.sqrt(nb));
            case "ip":
                return 1.0 - dot;
            default:
                return l2;
        }
    }

    private record Scored(StoredRecord record, double distance) {
    }

    /** Immutable snapshot; rows handed out by get and query share these lists and maps. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredRecord(String id, List<Float> embedding, Map<String, Object> metadata, String document) {
        StoredRecord {
            embedding = embedding != null ? List.copyOf(embedding) : null;
            metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CollectionFile(String id, String name, Map<String, Object> metadata, List<StoredRecord> records) {
    }

    private static final class StoredCollection {
        final String id;
        final String name;
        final Map<String, Object> metadata;
        final Map<String, StoredRecord> records = new LinkedHashMap<>();

        StoredCollection(String id, String name, Map<String, Object> metadata) {
            this.id = id;
            this.name = name;
            this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        }

        String space() {
            Object s = metadata.get(ChromaCollection.SPACE_KEY);
            return s != null ? s.toString() : "l2";
        }

        /**
         * Dimensionality is fixed by the first stored record, or by the first record of the pending batch
         * while the collection is empty.
         */
        void checkDimension(List<Float> embedding, Map<String, StoredRecord> pending) {
            if (embedding == null) return;
            List<Float> reference;
            if (!records.isEmpty()) {
                reference = records.values().iterator().next().embedding();
            } else if (!pending.isEmpty()) {
                reference = pending.values().iterator().next().embedding();
            } else {
                return;
            }
            if (embedding.size() != reference.size()) {
                throw new IllegalArgumentException("Embedding dimension " + embedding.size()
                        + " does not match collection dimensionality " + reference.size());
            }
        }
    }

    /** Handle bound to a collection name and id; the id detects a deleted-and-recreated collection. */
    private final class Handle implements ChromaCollection {
        private final String name;
        private final String id;
        private final Map<String, Object> metadata;

        Handle(String name, String id, Map<String, Object> metadata) {
            this.name = name;
            this.id = id;
            this.metadata = Map.copyOf(metadata);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Map<String, Object> metadata() {
            return metadata;
        }

        @Override
        public void upsert(List<String> ids, List<List<Float>> embeddings,
                           List<Map<String, Object>> metadatas, List<String> documents) {
            PersistentChromaClient.this.upsert(name, id, ids, embeddings, metadatas, documents);
        }

        @Override
        public void update(List<String> ids, List<List<Float>> embeddings,
                           List<Map<String, Object>> metadatas, List<String> documents) {
            PersistentChromaClient.this.update(name, id, ids, embeddings, metadatas, documents);
        }

        @Override
        public ChromaGetResult get(List<String> ids, Map<String, Object> where, Integer limit) {
            return PersistentChromaClient.this.get(name, id, ids, where, limit);
        }

        @Override
        public ChromaQueryResult query(List<List<Float>> queryEmbeddings, int nResults, Map<String, Object> where) {
            return PersistentChromaClient.this.query(name, id, queryEmbeddings, nResults, where);
        }

        @Override
        public void delete(List<String> ids) {
            PersistentChromaClient.this.delete(name, id, ids);
        }

        @Override
        public int count() {
            return PersistentChromaClient.this.count(name, id);
        }

        @Override
        public String toString() {
            return "PersistentChromaCollection{name=" + name + ", id=" + id + "}";
        }
    }
}
