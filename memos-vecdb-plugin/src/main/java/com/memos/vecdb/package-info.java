/**
 * Vector DB contracts shared by all backends.
 * <ul>
 *   <li>{@link com.memos.vecdb.VecDbItem} – id, vector, payload (metadata + memory), score</li>
 *   <li>{@link com.memos.vecdb.VecDb} – collection lifecycle, search, lookup and writes</li>
 *   <li>{@link com.memos.vecdb.MetadataCodec} / {@link com.memos.vecdb.JsonMetadataCodec} – nested metadata to flat scalars and back</li>
 *   <li>{@link com.memos.vecdb.VecDbProvider} – SPI for backends (ServiceLoader)</li>
 *   <li>{@link com.memos.vecdb.VecDbFactory} – backend lookup from {@link com.memos.config.VectorDbConfigFactory}</li>
 * </ul>
 */
package com.memos.vecdb;
