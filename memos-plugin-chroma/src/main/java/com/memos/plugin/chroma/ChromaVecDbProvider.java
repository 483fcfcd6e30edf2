package com.memos.plugin.chroma;

import com.memos.config.ChromaVecDbConfig;
import com.memos.vecdb.VecDb;
import com.memos.vecdb.VecDbProvider;

import java.util.Map;

/**
 * SPI provider for the Chroma vector DB (backend {@value #BACKEND}). Registered in
 * META-INF/services/com.memos.vecdb.VecDbProvider.
 */
public final class ChromaVecDbProvider implements VecDbProvider {

    public static final String BACKEND = "chroma";

    @Override
    public String getBackend() {
        return BACKEND;
    }

    @Override
    public VecDb create(Map<String, Object> config) {
        return new ChromaVecDb(ChromaVecDbConfig.fromMap(config));
    }
}
