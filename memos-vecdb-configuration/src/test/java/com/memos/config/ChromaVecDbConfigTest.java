package com.memos.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChromaVecDbConfigTest {

    @Test
    void fromMap_withoutHostAndPort_isLocal() {
        ChromaVecDbConfig config = ChromaVecDbConfig.fromMap(Map.of(
                "collection_name", "test_collection",
                "vector_dimension", 4,
                "distance_metric", "cosine",
                "path", "/tmp/memos/chroma"));

        assertEquals("test_collection", config.getCollectionName());
        assertEquals(4, config.getVectorDimension());
        assertEquals(DistanceMetric.COSINE, config.getDistanceMetric());
        assertTrue(config.isLocal());
        assertEquals("/tmp/memos/chroma", ((ChromaTarget.LocalTarget) config.getTarget()).path());
    }

    @Test
    void fromMap_withHostAndPort_isRemoteWithCredentials() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("collection_name", "memories");
        raw.put("host", "chroma.internal");
        raw.put("port", "8443");
        raw.put("username", "admin");
        raw.put("password", "secret");
        raw.put("tls", true);
        raw.put("distance_metric", "euclidean");

        ChromaVecDbConfig config = ChromaVecDbConfig.fromMap(raw);

        assertFalse(config.isLocal());
        ChromaTarget.RemoteTarget remote = assertInstanceOf(ChromaTarget.RemoteTarget.class, config.getTarget());
        assertEquals("https://chroma.internal:8443", remote.baseUrl());
        assertTrue(remote.hasCredentials());
        assertEquals(DistanceMetric.L2, config.getDistanceMetric());
        assertFalse(remote.toString().contains("secret"), "password must not be printed");
    }

    @Test
    void builder_hostOnly_defaultsPort() {
        ChromaVecDbConfig config = ChromaVecDbConfig.builder()
                .collectionName("c1")
                .host("localhost")
                .build();

        ChromaTarget.RemoteTarget remote = assertInstanceOf(ChromaTarget.RemoteTarget.class, config.getTarget());
        assertEquals(8000, remote.port());
        assertFalse(remote.hasCredentials());
        assertEquals(ChromaVecDbConfig.DEFAULT_TENANT, config.getTenant());
        assertEquals(ChromaVecDbConfig.DEFAULT_DATABASE, config.getDatabase());
    }

    @Test
    void builder_rejectsBlankCollectionAndBadDimension() {
        assertThrows(IllegalArgumentException.class,
                () -> ChromaVecDbConfig.builder().collectionName(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> ChromaVecDbConfig.builder().collectionName("c1").vectorDimension(0).build());
    }

    @Test
    void fromEnvironment_readsMemosChromaVariables() {
        Map<String, String> env = Map.of(
                "MEMOS_CHROMA_COLLECTION", "env_collection",
                "MEMOS_CHROMA_VECTOR_DIMENSION", "768",
                "MEMOS_CHROMA_DISTANCE_METRIC", "dot",
                "MEMOS_CHROMA_HOST", "10.0.0.5",
                "MEMOS_CHROMA_PORT", "9000",
                "MEMOS_CHROMA_TIMEOUT_SECONDS", "5");

        ChromaVecDbConfig config = ChromaVecDbConfig.fromEnvironment(env::get);

        assertEquals("env_collection", config.getCollectionName());
        assertEquals(768, config.getVectorDimension());
        assertEquals(DistanceMetric.IP, config.getDistanceMetric());
        assertEquals(5, config.getRequestTimeoutSeconds());
        assertEquals("http://10.0.0.5:9000", ((ChromaTarget.RemoteTarget) config.getTarget()).baseUrl());
    }

    @Test
    void fromEnvironment_emptyEnv_usesLocalDefaults() {
        ChromaVecDbConfig config = ChromaVecDbConfig.fromEnvironment(key -> null);

        assertEquals(ChromaVecDbConfig.DEFAULT_COLLECTION_NAME, config.getCollectionName());
        assertEquals(ChromaVecDbConfig.DEFAULT_VECTOR_DIMENSION, config.getVectorDimension());
        assertEquals(new ChromaTarget.LocalTarget(ChromaVecDbConfig.DEFAULT_PATH), config.getTarget());
    }

    @Test
    void distanceMetric_rejectsUnknownName() {
        assertEquals(DistanceMetric.COSINE, DistanceMetric.fromName(null));
        assertThrows(IllegalArgumentException.class, () -> DistanceMetric.fromName("manhattan"));
    }
}
