package org.finos.stitch.engine.execution;

import org.finos.stitch.dsl.IncludeCompiler;
import org.finos.stitch.engine.plan.IncludePlan;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.test.LibraryDatabase;
import org.finos.stitch.engine.transpiler.DuckDBDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sibling fan-out and failure propagation of {@link BatchStitcher}.
 */
class BatchStitcherConcurrencyTest {

    private final RelationGraph graph = LibraryDatabase.graph();
    private final IncludeCompiler compiler = new IncludeCompiler(graph);
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    private final List<Map<String, Object>> authors = List.of(
            Map.of("id", 1, "name", "Ann"),
            Map.of("id", 2, "name", "Ben"));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BatchStitcher stitcher(QueryBackend backend, int fanOut) {
        return new BatchStitcher(graph, backend, DuckDBDialect.INSTANCE, executor, fanOut,
                LoggerFactory.getLogger(BatchStitcherConcurrencyTest.class));
    }

    private IncludePlan siblings() {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("books", true);
        spec.put("profile", true);
        spec.put("profiles", true);
        return compiler.compile("authors", spec, 3);
    }

    @Test
    @DisplayName("a failing sibling surfaces only after the others have finished")
    void testWaitForAllSiblings() {
        // GIVEN: books fails at once while the profile queries are slow
        ScriptedBackend backend = new ScriptedBackend()
                .failing("books", "connection reset")
                .delayed("profiles", 200);

        // WHEN
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> stitcher(backend, 3).stitch(siblings(), authors));

        // THEN: failure carries where it happened
        assertEquals("authors", e.getEntity());
        assertEquals("books", e.getRelationKey());
        assertEquals(0, e.getDepth());
        assertInstanceOf(SQLException.class, e.getCause());
        assertEquals("Failed to load include 'books' of 'authors' at depth 0: connection reset", e.getMessage());

        // AND: both slow siblings were issued and completed before the failure surfaced
        assertEquals(3, backend.executed.size());
        assertTrue(backend.completed.contains("profiles"));
    }

    @Test
    @DisplayName("the first failure in plan order wins")
    void testFirstFailureInPlanOrder() {
        ScriptedBackend backend = new ScriptedBackend()
                .failing("books", "books down")
                .failing("profiles", "profiles down")
                .delayed("books", 100);

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> stitcher(backend, 3).stitch(siblings(), authors));
        assertEquals("books", e.getRelationKey());
    }

    @Test
    @DisplayName("fan-out cap bounds the sibling queries in flight")
    void testFanOutCap() throws Exception {
        ScriptedBackend backend = new ScriptedBackend()
                .delayed("books", 100)
                .delayed("profiles", 100);

        List<Map<String, Object>> result = stitcher(backend, 2).stitch(siblings(), authors);

        assertEquals(3, backend.executed.size());
        assertTrue(backend.maxInFlight.get() <= 2, "max in flight " + backend.maxInFlight.get());
        for (Map<String, Object> row : result) {
            assertEquals(List.of(), row.get("books"));
            assertNull(row.get("profile"));
            assertTrue(row.containsKey("profile"));
        }
    }

    @Test
    @DisplayName("a nested failure reports the nested entity and depth")
    void testNestedFailure() {
        ScriptedBackend backend = new ScriptedBackend()
                .table("books", Map.of("id", 10, "author_id", 1, "title", "Ann One", "published", 2001))
                .failing("book_tags", "join table missing");

        IncludePlan plan = compiler.compile("authors", Map.of("books", Map.of("include", Map.of("tags", true))), 3);
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> stitcher(backend, 2).stitch(plan, authors));

        assertEquals("books", e.getEntity());
        assertEquals("tags", e.getRelationKey());
        assertEquals(1, e.getDepth());
    }

    @Test
    @DisplayName("unexpected runtime errors from the backend are wrapped too")
    void testRuntimeFailureWrapped() {
        QueryBackend backend = (sql, params) -> {
            throw new IllegalStateException("pool closed");
        };
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> new BatchStitcher(graph, backend, DuckDBDialect.INSTANCE)
                        .stitch(compiler.compile("authors", Map.of("books", true), 3), authors));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
