package com.memos.plugin.chroma;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Collection handle of {@link ChromaHttpClient}; record operations go to {@code /collections/{id}/...}. */
final class ChromaHttpCollection implements ChromaCollection {

    private static final List<String> GET_INCLUDE = List.of("embeddings", "metadatas", "documents");
    private static final List<String> QUERY_INCLUDE = List.of("embeddings", "metadatas", "documents", "distances");

    private final ChromaHttpClient client;
    private final String id;
    private final String name;
    private final Map<String, Object> metadata;

    ChromaHttpCollection(ChromaHttpClient client, String id, String name, Map<String, Object> metadata) {
        this.client = client;
        this.id = id;
        this.name = name;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
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
        client.send("POST", path("/upsert"), recordsBody(ids, embeddings, metadatas, documents));
    }

    @Override
    public void update(List<String> ids, List<List<Float>> embeddings,
                       List<Map<String, Object>> metadatas, List<String> documents) {
        client.send("POST", path("/update"), recordsBody(ids, embeddings, metadatas, documents));
    }

    private static Map<String, Object> recordsBody(List<String> ids, List<List<Float>> embeddings,
                                                   List<Map<String, Object>> metadatas, List<String> documents) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ids", ids);
        if (embeddings != null) body.put("embeddings", embeddings);
        if (metadatas != null) body.put("metadatas", metadatas);
        if (documents != null) body.put("documents", documents);
        return body;
    }

    @Override
    public ChromaGetResult get(List<String> ids, Map<String, Object> where, Integer limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (ids != null) body.put("ids", ids);
        if (where != null && !where.isEmpty()) body.put("where", where);
        if (limit != null) body.put("limit", limit);
        body.put("include", GET_INCLUDE);
        JsonNode node = client.send("POST", path("/get"), body);
        return node != null ? convert(node, ChromaGetResult.class) : ChromaGetResult.empty();
    }

    @Override
    public ChromaQueryResult query(List<List<Float>> queryEmbeddings, int nResults, Map<String, Object> where) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query_embeddings", queryEmbeddings);
        body.put("n_results", nResults);
        if (where != null && !where.isEmpty()) body.put("where", where);
        body.put("include", QUERY_INCLUDE);
        JsonNode node = client.send("POST", path("/query"), body);
        return node != null ? convert(node, ChromaQueryResult.class) : new ChromaQueryResult(null, null, null, null, null);
    }

    @Override
    public void delete(List<String> ids) {
        client.send("POST", path("/delete"), Map.of("ids", ids));
    }

    @Override
    public int count() {
        JsonNode node = client.send("GET", path("/count"), null);
        return node != null ? node.asInt() : 0;
    }

    private String path(String op) {
        return "/collections/" + id + op;
    }

    private static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return ChromaHttpClient.MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ChromaException("Unexpected Chroma response for " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "ChromaHttpCollection{name=" + name + ", id=" + id + "}";
    }
}
