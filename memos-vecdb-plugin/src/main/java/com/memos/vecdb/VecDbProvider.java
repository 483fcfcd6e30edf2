package com.memos.vecdb;

import java.util.Map;

/**
 * SPI for vector DB backends. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.memos.vecdb.VecDbProvider) and selected by {@link #getBackend()}.
 */
public interface VecDbProvider {

    /** Backend name matched against the {@code backend} of the config (e.g. "chroma"); lower case. */
    String getBackend();

    /**
     * Creates a vector DB from the backend-specific config map.
     *
     * @throws IllegalArgumentException if the config is invalid for this backend
     */
    VecDb create(Map<String, Object> config);
}
