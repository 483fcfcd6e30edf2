package com.memos.plugin.chroma;

/** The named collection does not exist (or a cached handle points at a deleted collection). */
public class CollectionNotFoundException extends ChromaException {

    private final String collectionName;

    public CollectionNotFoundException(String collectionName) {
        super("Collection " + collectionName + " does not exist.", 404);
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
