package com.memos.config;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorDbConfigFactoryTest {

    private static final String SAMPLE_JSON = """
            {
              "backend": "Chroma",
              "config": {
                "collection_name": "test_collection",
                "vector_dimension": 4,
                "distance_metric": "cosine",
                "path": "/data/chroma"
              }
            }
            """;

    @Test
    void fromJson_parsesBackendAndConfig() {
        VectorDbConfigFactory factory = VectorDbConfigFactory.fromJson(SAMPLE_JSON);

        assertEquals("chroma", factory.getBackend());
        assertEquals("test_collection", factory.getConfig().get("collection_name"));
        assertEquals(4, factory.getConfig().get("vector_dimension"));

        ChromaVecDbConfig chroma = ChromaVecDbConfig.fromMap(factory.getConfig());
        assertEquals("test_collection", chroma.getCollectionName());
        assertTrue(chroma.isLocal());
    }

    @Test
    void toJson_roundTrip() {
        VectorDbConfigFactory factory = new VectorDbConfigFactory("chroma", Map.of("collection_name", "c1"));

        VectorDbConfigFactory parsed = VectorDbConfigFactory.fromJson(factory.toJson());

        assertEquals(factory.getBackend(), parsed.getBackend());
        assertEquals(factory.getConfig(), parsed.getConfig());
    }

    @Test
    void missingBackend_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new VectorDbConfigFactory(" ", Map.of()));
        assertThrows(UncheckedIOException.class, () -> VectorDbConfigFactory.fromJson("{\"config\": {}}"));
    }

    @Test
    void fromMap_convertsRawMap() {
        VectorDbConfigFactory factory = VectorDbConfigFactory.fromMap(Map.of(
                "backend", "chroma",
                "config", Map.of("collection_name", "c2")));

        assertEquals("chroma", factory.getBackend());
        assertEquals("c2", factory.getConfig().get("collection_name"));
    }
}
