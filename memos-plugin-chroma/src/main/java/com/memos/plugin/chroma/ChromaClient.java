package com.memos.plugin.chroma;

import java.util.List;
import java.util.Map;

/**
 * Client handle on a Chroma backend: collection lifecycle. Implementations: {@link ChromaHttpClient}
 * (remote server) and {@link PersistentChromaClient} (local on-disk store).
 */
public interface ChromaClient extends AutoCloseable {

    /**
     * Creates a collection.
     *
     * @throws ChromaException if it already exists or the backend rejects it
     */
    ChromaCollection createCollection(String name, Map<String, Object> metadata);

    /**
     * @throws CollectionNotFoundException if no collection has that name
     */
    ChromaCollection getCollection(String name);

    List<ChromaCollection> listCollections();

    void deleteCollection(String name);

    @Override
    void close();
}
