package com.memos.vecdb;

import com.memos.config.VectorDbConfigFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VecDbFactoryTest {

    @Test
    void create_dispatchesOnBackendName() {
        VecDbFactory factory = new VecDbFactory();
        InMemoryVecDb db = new InMemoryVecDb();
        List<Map<String, Object>> seen = new ArrayList<>();
        factory.register(provider("memory", config -> {
            seen.add(config);
            return db;
        }));

        VecDb created = factory.create(new VectorDbConfigFactory("Memory", Map.of("collection_name", "c1")));

        assertSame(db, created);
        assertEquals(List.of(Map.of("collection_name", "c1")), seen);
    }

    @Test
    void register_firstProviderWins() {
        VecDbFactory factory = new VecDbFactory();
        InMemoryVecDb first = new InMemoryVecDb();
        factory.register(provider("memory", config -> first));
        factory.register(provider("memory", config -> new InMemoryVecDb()));

        assertTrue(factory.getBackends().contains("memory"));
        assertSame(first, factory.create(new VectorDbConfigFactory("memory", Map.of())));
    }

    @Test
    void create_unknownBackend_listsAvailable() {
        VecDbFactory factory = new VecDbFactory();
        factory.register(provider("memory", config -> new InMemoryVecDb()));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> factory.create(new VectorDbConfigFactory("qdrant", Map.of())));
        assertTrue(e.getMessage().contains("qdrant"));
        assertTrue(e.getMessage().contains("memory"));
    }

    @Test
    void defaultMethods_delegateToCoreOperations() {
        InMemoryVecDb db = new InMemoryVecDb();
        db.add(List.of(
                new VecDbItem("a", List.of(1f), Map.of("metadata", Map.of("tag", "x"))),
                new VecDbItem("b", List.of(2f), Map.of("metadata", Map.of("tag", "y")))));

        assertEquals(2, db.count());
        assertEquals(1, db.count(Map.of("tag", "x")));
        assertEquals(2, db.getAll().size());
        assertEquals(VecDb.DEFAULT_LIMIT, db.lastLimit);

        db.update("a", Map.of("payload", Map.of("metadata", Map.of("tag", "z"))));
        assertEquals("z", db.getById("a").orElseThrow().getMetadata().get("tag"));
    }

    private static VecDbProvider provider(String backend, Function<Map<String, Object>, VecDb> factory) {
        return new VecDbProvider() {
            @Override
            public String getBackend() {
                return backend;
            }

            @Override
            public VecDb create(Map<String, Object> config) {
                return factory.apply(config);
            }
        };
    }

    /** Minimal map-backed VecDb exercising the interface's default methods. */
    private static final class InMemoryVecDb implements VecDb {
        private final Map<String, VecDbItem> items = new HashMap<>();
        int lastLimit;

        @Override
        public void ensureCollection() {
        }

        @Override
        public Set<String> listCollections() {
            return Set.of("memory");
        }

        @Override
        public void deleteCollection(String name) {
            items.clear();
        }

        @Override
        public boolean collectionExists(String name) {
            return "memory".equals(name);
        }

        @Override
        public List<VecDbItem> search(List<Float> queryVector, int topK, Map<String, Object> filter) {
            return List.of();
        }

        @Override
        public Optional<VecDbItem> getById(String id) {
            return Optional.ofNullable(items.get(id));
        }

        @Override
        public List<VecDbItem> getByIds(List<String> ids) {
            List<VecDbItem> out = new ArrayList<>();
            for (String id : ids) {
                getById(id).ifPresent(out::add);
            }
            return out;
        }

        @Override
        public List<VecDbItem> getByFilter(Map<String, Object> filter, int limit) {
            lastLimit = limit;
            List<VecDbItem> out = new ArrayList<>();
            for (VecDbItem item : items.values()) {
                if (filter == null || item.getMetadata().entrySet().containsAll(filter.entrySet())) {
                    out.add(item);
                }
            }
            return out.size() > limit ? out.subList(0, limit) : out;
        }

        @Override
        public void add(List<VecDbItem> toAdd) {
            for (VecDbItem item : toAdd) {
                items.put(item.getId(), item);
            }
        }

        @Override
        public void update(String id, VecDbItem item) {
            items.put(id, item);
        }

        @Override
        public void delete(List<String> ids) {
            ids.forEach(items::remove);
        }

        @Override
        public void ensurePayloadIndexes(List<String> fields) {
        }

        @Override
        public void close() {
        }
    }
}
