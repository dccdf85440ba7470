package org.finos.stitch.engine.test;

import org.finos.stitch.dsl.IncludeCompiler;
import org.finos.stitch.engine.config.StitchSettings;
import org.finos.stitch.engine.execution.BatchStitcher;
import org.finos.stitch.engine.execution.IncludeController;
import org.finos.stitch.engine.execution.JdbcQueryBackend;
import org.finos.stitch.engine.execution.QueryBackend;
import org.finos.stitch.engine.server.ListService;
import org.finos.stitch.engine.server.SchemaLoader;
import org.finos.stitch.engine.server.StitchHttpServer;
import org.finos.stitch.engine.server.StitchJson;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.transpiler.DuckDBDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the list endpoint over HTTP.
 */
class StitchHttpServerIntegrationTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private Connection connection;
    private StitchHttpServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.stop();
        }
        executor.shutdownNow();
        if (connection != null) {
            connection.close();
        }
    }

    private void startServer(StitchSettings settings, boolean breakTags) throws Exception {
        connection = LibraryDatabase.open();
        RelationGraph graph = SchemaLoader.load(Path.of(
                StitchHttpServerIntegrationTest.class.getResource("/library-schema.json").toURI()));
        QueryBackend jdbc = JdbcQueryBackend.shared(connection);
        QueryBackend backend = !breakTags ? jdbc : (sql, params) -> {
            if (sql.contains("FROM \"book_tags\"")) {
                throw new SQLException("book_tags is offline");
            }
            return jdbc.execute(sql, params);
        };

        BatchStitcher stitcher = new BatchStitcher(graph, backend, DuckDBDialect.INSTANCE, executor,
                settings.fanOut(), LoggerFactory.getLogger(BatchStitcher.class));
        IncludeController controller = new IncludeController(new IncludeCompiler(graph), stitcher, settings);
        server = new StitchHttpServer(0, new ListService(graph, backend, DuckDBDialect.INSTANCE, controller));
        server.start();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + server.getPort() + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        System.out.println(path + " -> " + response.statusCode() + " " + response.body());
        return response;
    }

    @Test
    @DisplayName("GET /health")
    void testHealth() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);
        HttpResponse<String> response = client.send(HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + server.getPort() + "/health")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("ok"));
    }

    @Test
    @DisplayName("list with nested includes")
    @SuppressWarnings("unchecked")
    void testListWithIncludes() throws Exception {
        // GIVEN
        startServer(StitchSettings.DEFAULTS, false);

        // WHEN
        HttpResponse<String> response = post("/authors/list",
                "{\"limit\": 2, \"include\": {\"books\": {\"orderBy\": \"published\", \"order\": \"desc\","
                        + " \"include\": {\"tags\": true}}, \"profile\": true}}");

        // THEN
        assertEquals(200, response.statusCode());
        List<Map<String, Object>> rows = (List<Map<String, Object>>) StitchJson.parse(response.body());
        assertEquals(2, rows.size());
        Map<String, Object> ann = rows.get(0);
        assertEquals("Ann", ann.get("name"));
        List<Map<String, Object>> books = (List<Map<String, Object>>) ann.get("books");
        assertEquals(List.of(10L, 11L), books.stream().map(b -> b.get("id")).toList());
        assertEquals(2, ((List<?>) books.get(0).get("tags")).size());
        assertEquals("Ann bio", ((Map<String, Object>) ann.get("profile")).get("bio"));

        Map<String, Object> ben = rows.get(1);
        assertEquals(List.of(), ben.get("books"));
        assertTrue(ben.containsKey("profile"));
        assertNull(ben.get("profile"));
    }

    @Test
    @DisplayName("unknown include key is a 400")
    void testUnknownInclude() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);
        HttpResponse<String> response = post("/authors/list", "{\"include\": {\"nonExistentRelation\": true}}");

        assertEquals(400, response.statusCode());
        Map<String, Object> body = StitchJson.parseObject(response.body());
        assertEquals("invalid-include", body.get("error"));
        assertEquals("nonExistentRelation", body.get("key"));
    }

    @Test
    @DisplayName("non-strict failure degrades to root rows with includeError")
    @SuppressWarnings("unchecked")
    void testDegrade() throws Exception {
        startServer(StitchSettings.DEFAULTS, true);
        HttpResponse<String> response = post("/authors/list",
                "{\"include\": {\"books\": {\"include\": {\"tags\": true}}}}");

        assertEquals(200, response.statusCode());
        Map<String, Object> body = StitchJson.parseObject(response.body());
        List<Map<String, Object>> data = (List<Map<String, Object>>) body.get("data");
        assertEquals(3, data.size());
        assertFalse(data.get(0).containsKey("books"));
        Map<String, Object> includeError = (Map<String, Object>) body.get("includeError");
        assertTrue(((String) includeError.get("message")).contains("book_tags is offline"));
    }

    @Test
    @DisplayName("strict failure is a 500 without data")
    void testStrict() throws Exception {
        startServer(StitchSettings.DEFAULTS.withStrictIncludes(true).withDebug(true), true);
        HttpResponse<String> response = post("/authors/list",
                "{\"include\": {\"books\": {\"include\": {\"tags\": true}}}}");

        assertEquals(500, response.statusCode());
        Map<String, Object> body = StitchJson.parseObject(response.body());
        assertEquals("include-stitch-failed", body.get("error"));
        assertEquals("tags", body.get("relation"));
        assertEquals(1L, body.get("depth"));
        assertNotNull(body.get("stack"));
        assertFalse(body.containsKey("data"));
    }

    @Test
    @DisplayName("request errors map to 4xx")
    void testRequestErrors() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);

        assertEquals(404, post("/publishers/list", "{}").statusCode());
        assertEquals(400, post("/authors/list", "{\"limit\": 0}").statusCode());
        assertEquals(400, post("/authors/list", "{\"limit\": 1001}").statusCode());
        assertEquals(400, post("/authors/list", "{\"orderBy\": \"missing\"}").statusCode());
        assertEquals(400, post("/authors/list", "{\"filter\": {}}").statusCode());
        assertEquals(400, post("/authors/list", "{\"where\": {\"missing\": 1}}").statusCode());
        assertEquals(400, post("/authors/list", "{\"where\": {\"id\": {\"$near\": 1}}}").statusCode());
        assertEquals(400, post("/authors/list", "{\"where\": {\"id\": \"one\"}}").statusCode());
        assertEquals(400, post("/authors/list", "{\"where\": {\"id\": {\"$in\": [1, null]}}}").statusCode());
        assertEquals(400, post("/authors/list", "{\"where\": {\"$or\": {}}}").statusCode());
        assertEquals(400, post("/authors/list", "{\"orderBy\": [\"name\"], \"order\": [\"asc\", \"desc\"]}")
                .statusCode());
        assertEquals(400, post("/authors/list", "{not json").statusCode());
        assertEquals(404, post("/authors/lists", "{}").statusCode());
    }

    @Test
    @DisplayName("root pagination and ordering")
    void testRootPaging() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);
        HttpResponse<String> response = post("/books/list",
                "{\"orderBy\": \"published\", \"order\": \"desc\", \"limit\": 2, \"offset\": 1}");

        assertEquals(200, response.statusCode());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) StitchJson.parse(response.body());
        assertEquals(List.of(20L, 30L), rows.stream().map(r -> r.get("id")).toList());
    }

    @Test
    @DisplayName("root where filter with operators and $or")
    void testWhere() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);

        HttpResponse<String> response = post("/books/list",
                "{\"where\": {\"published\": {\"$gte\": 2000, \"$lt\": 2010},"
                        + " \"$or\": [{\"author_id\": 3}, {\"author_id\": null}]}}");
        assertEquals(200, response.statusCode());
        assertEquals(List.of(20, 22, 30), LibraryDatabase.ints(StitchJson.parse(response.body()), "id"));

        response = post("/books/list", "{\"where\": {\"title\": {\"$ilike\": \"ann%\"}, \"id\": {\"$nin\": [11]}}}");
        assertEquals(List.of(10), LibraryDatabase.ints(StitchJson.parse(response.body()), "id"));

        response = post("/books/list", "{\"where\": {\"author_id\": {\"$isNot\": null, \"$in\": [1, 2]}}}");
        assertEquals(List.of(10, 11), LibraryDatabase.ints(StitchJson.parse(response.body()), "id"));

        response = post("/books/list", "{\"where\": {\"$or\": []}}");
        assertEquals(List.of(), LibraryDatabase.ints(StitchJson.parse(response.body()), "id"));
    }

    @Test
    @DisplayName("filtered roots still get their includes")
    @SuppressWarnings("unchecked")
    void testWhereWithInclude() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);

        HttpResponse<String> response = post("/authors/list",
                "{\"where\": {\"name\": {\"$like\": \"C%\"}}, \"include\": {\"books\": {\"limit\": 1}}}");

        assertEquals(200, response.statusCode());
        List<Map<String, Object>> rows = (List<Map<String, Object>>) StitchJson.parse(response.body());
        assertEquals(1, rows.size());
        assertEquals(List.of(20), LibraryDatabase.ints(rows.get(0).get("books"), "id"));
    }

    @Test
    @DisplayName("orderBy accepts several columns with per-column directions")
    void testMultiColumnOrder() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);

        HttpResponse<String> response = post("/books/list",
                "{\"where\": {\"author_id\": {\"$isNot\": null}},"
                        + " \"orderBy\": [\"author_id\", \"published\"], \"order\": [\"desc\"]}");

        assertEquals(200, response.statusCode());
        assertEquals(List.of(22, 20, 21, 11, 10), LibraryDatabase.ints(StitchJson.parse(response.body()), "id"));
    }

    @Test
    @DisplayName("deeply nested body is a 400 and the server keeps serving")
    void testDeepNesting() throws Exception {
        startServer(StitchSettings.DEFAULTS, false);
        int levels = 20_000;
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            body.append("{\"include\":");
        }
        body.append("true");
        body.append("}".repeat(levels));

        HttpResponse<String> response = post("/authors/list", body.toString());

        assertEquals(400, response.statusCode());
        assertEquals("invalid-json", StitchJson.parseObject(response.body()).get("error"));
        assertEquals(200, post("/authors/list", "{}").statusCode());
    }
}
