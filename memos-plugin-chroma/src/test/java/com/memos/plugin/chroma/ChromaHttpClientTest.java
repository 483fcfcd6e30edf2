package com.memos.plugin.chroma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memos.config.ChromaTarget;
import com.memos.config.ChromaVecDbConfig;
import com.memos.vecdb.VecDbItem;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChromaHttpClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String COLLECTION_JSON =
            "{\"id\":\"c-1\",\"name\":\"memories\",\"metadata\":{\"hnsw:space\":\"cosine\",\"dimension\":3}}";

    private HttpServer server;
    private final Map<String, String[]> routes = new ConcurrentHashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    private record Recorded(String method, String path, String query, String authorization, JsonNode body) {
    }

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        String text = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        requests.add(new Recorded(method, path, exchange.getRequestURI().getQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                text.isEmpty() ? null : MAPPER.readTree(text)));
        String[] route = routes.getOrDefault(method + " " + path,
                new String[]{"404", "{\"error\":\"not found\"}"});
        byte[] out = route[1].getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(Integer.parseInt(route[0]), out.length == 0 ? -1 : out.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(out);
        }
    }

    private void route(String method, String path, int status, String body) {
        routes.put(method + " " + path, new String[]{String.valueOf(status), body});
    }

    private int port() {
        return server.getAddress().getPort();
    }

    private ChromaHttpClient client() {
        return new ChromaHttpClient(new ChromaTarget.RemoteTarget("127.0.0.1", port()),
                "default_tenant", "default_database", Duration.ofSeconds(5));
    }

    private Recorded last() {
        return requests.get(requests.size() - 1);
    }

    @Test
    void getCollection_scopedByTenantAndDatabase() {
        route("GET", "/api/v1/collections/memories", 200, COLLECTION_JSON);

        ChromaCollection c = client().getCollection("memories");

        assertEquals("c-1", c.id());
        assertEquals("memories", c.name());
        assertEquals("cosine", c.metadata().get(ChromaCollection.SPACE_KEY));
        assertEquals("tenant=default_tenant&database=default_database", last().query());
        assertNull(last().authorization());
    }

    @Test
    void credentials_sendBasicAuth() {
        route("GET", "/api/v1/collections", 200, "[" + COLLECTION_JSON + "]");
        ChromaHttpClient client = new ChromaHttpClient(
                new ChromaTarget.RemoteTarget("127.0.0.1", port(), "admin", "s3cret", false),
                "t", "d", Duration.ofSeconds(5));

        List<ChromaCollection> collections = client.listCollections();

        assertEquals(1, collections.size());
        assertEquals("Basic YWRtaW46czNjcmV0", last().authorization());
        assertEquals("tenant=t&database=d", last().query());
        assertEquals("Basic dXNlcjo=", ChromaHttpClient.basicAuth("user", null));
    }

    @Test
    void getCollection_missing_isNotFound() {
        assertThrows(CollectionNotFoundException.class, () -> client().getCollection("ghost"));

        route("GET", "/api/v1/collections/legacy", 500,
                "{\"error\":\"ValueError('Collection legacy does not exist.')\"}");
        assertThrows(CollectionNotFoundException.class, () -> client().getCollection("legacy"));
    }

    @Test
    void serverError_carriesStatus() {
        route("GET", "/api/v1/collections/broken", 500, "{\"error\":\"disk full\"}");

        ChromaException e = assertThrows(ChromaException.class, () -> client().getCollection("broken"));

        assertFalse(e instanceof CollectionNotFoundException);
        assertEquals(500, e.getStatusCode());
        assertTrue(e.getMessage().contains("disk full"));
    }

    @Test
    void createCollection_postsNameAndMetadata() {
        route("POST", "/api/v1/collections", 200, COLLECTION_JSON);

        client().createCollection("memories", Map.of(ChromaCollection.SPACE_KEY, "cosine"));

        JsonNode body = last().body();
        assertEquals("memories", body.get("name").asText());
        assertEquals("cosine", body.get("metadata").get("hnsw:space").asText());
        assertFalse(body.get("get_or_create").asBoolean());
    }

    @Test
    void deleteCollection_usesDelete() {
        route("DELETE", "/api/v1/collections/memories", 200, "");

        client().deleteCollection("memories");

        assertEquals("DELETE", last().method());
        assertEquals("/api/v1/collections/memories", last().path());
    }

    @Test
    void recordOperations_addressCollectionById() {
        route("GET", "/api/v1/collections/memories", 200, COLLECTION_JSON);
        route("POST", "/api/v1/collections/c-1/get", 200,
                "{\"ids\":[\"a\"],\"embeddings\":[[0.1,0.2,0.3]],\"metadatas\":[{\"tag\":\"x\"}],"
                        + "\"documents\":[\"m\"],\"uris\":null,\"data\":null}");
        route("POST", "/api/v1/collections/c-1/query", 200,
                "{\"ids\":[[\"a\"]],\"embeddings\":[[[0.1,0.2,0.3]]],\"metadatas\":[[{\"tag\":\"x\"}]],"
                        + "\"documents\":[[\"m\"]],\"distances\":[[0.25]]}");
        route("GET", "/api/v1/collections/c-1/count", 200, "7");
        ChromaCollection c = client().getCollection("memories");

        ChromaGetResult rows = c.get(List.of("a"), Map.of(), 10);
        assertEquals(List.of("a"), rows.ids());
        assertEquals(List.of(0.1f, 0.2f, 0.3f), rows.embedding(0));
        JsonNode getBody = last().body();
        assertFalse(getBody.has("where"));
        assertEquals(10, getBody.get("limit").asInt());
        assertEquals("[\"embeddings\",\"metadatas\",\"documents\"]", getBody.get("include").toString());

        ChromaQueryResult result = c.query(List.of(List.of(0.1f, 0.2f, 0.3f)), 4, Map.of("tag", "x"));
        assertEquals(List.of(0.25), result.distances(0));
        assertEquals("m", result.batch(0).document(0));
        JsonNode queryBody = last().body();
        assertEquals(4, queryBody.get("n_results").asInt());
        assertEquals("x", queryBody.get("where").get("tag").asText());
        assertTrue(queryBody.get("include").toString().contains("distances"));

        assertEquals(7, c.count());
    }

    @Test
    void vecDb_payloadOnlyUpdate_omitsEmbeddingsAndDocuments() {
        route("GET", "/api/v1/collections/memories", 200, COLLECTION_JSON);
        route("POST", "/api/v1/collections/c-1/update", 200, "true");
        route("POST", "/api/v1/collections/c-1/upsert", 200, "true");
        ChromaVecDbConfig config = ChromaVecDbConfig.builder()
                .collectionName("memories")
                .vectorDimension(3)
                .host("127.0.0.1")
                .port(port())
                .build();
        ChromaVecDb db = new ChromaVecDb(config);

        db.update("a", new VecDbItem("a", null, Map.of(VecDbItem.METADATA, Map.of("info", Map.of("k", "v")))));

        Recorded update = last();
        assertEquals("/api/v1/collections/c-1/update", update.path());
        assertEquals("[\"a\"]", update.body().get("ids").toString());
        assertEquals("{\"k\":\"v\"}", update.body().get("metadatas").get(0).get("info").asText());
        assertFalse(update.body().has("embeddings"));
        assertFalse(update.body().has("documents"));

        db.add(List.of(new VecDbItem("b", List.of(1f, 0f, 0f), Map.of(VecDbItem.MEMORY, "doc"))));

        Recorded upsert = last();
        assertEquals("/api/v1/collections/c-1/upsert", upsert.path());
        assertTrue(upsert.body().get("metadatas").get(0).isNull());
        assertEquals("doc", upsert.body().get("documents").get(0).asText());
    }

    @Test
    void connectionFailure_isChromaException() {
        ChromaHttpClient client = client();
        server.stop(0);
        server = null;

        ChromaException e = assertThrows(ChromaException.class, client::listCollections);
        assertEquals(-1, e.getStatusCode());
    }
}
