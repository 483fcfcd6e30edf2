package com.memos.vecdb;

import java.util.Map;

/**
 * Converts payload metadata to and from the flat scalar form a backend can store.
 * Backends whose metadata fields accept only strings, numbers and booleans encode nested
 * values on write and decode them on read.
 */
public interface MetadataCodec {

    /**
     * Returns a flat copy of {@code metadata}: nested maps and sequences become scalar strings.
     *
     * @throws IllegalArgumentException if a value cannot be encoded
     */
    Map<String, Object> encodeMetadata(Map<String, ?> metadata);

    /**
     * Reverses {@link #encodeMetadata(Map)} on a best-effort basis. Never throws: a value that cannot
     * be decoded is returned unchanged.
     */
    Map<String, Object> decodeMetadata(Map<String, ?> metadata);
}
