package org.finos.stitch.dsl;

import org.finos.stitch.engine.plan.IncludeNode;
import org.finos.stitch.engine.plan.IncludePlan;
import org.finos.stitch.engine.plan.SortDirection;
import org.finos.stitch.engine.store.Column;
import org.finos.stitch.engine.store.EntityDefinition;
import org.finos.stitch.engine.store.ForeignKey;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.store.RelationKind;
import org.finos.stitch.engine.store.SqlDataType;
import org.finos.stitch.engine.test.LibraryDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for compiling raw include requests into plans.
 */
class IncludeCompilerTest {

    private final IncludeCompiler compiler = new IncludeCompiler(LibraryDatabase.graph());

    @Test
    @DisplayName("unknown relation key rejects the request")
    void testUnknownRelation() {
        UnknownRelationException e = assertThrows(UnknownRelationException.class,
                () -> compiler.compile("authors", Map.of("nonExistentRelation", true), 3));

        assertEquals("authors", e.getEntity());
        assertEquals("nonExistentRelation", e.getKey());
        assertEquals("Unknown include key 'nonExistentRelation' on entity 'authors'", e.getMessage());
    }

    @Test
    @DisplayName("unknown key at a nested level names the nested entity")
    void testUnknownNestedRelation() {
        UnknownRelationException e = assertThrows(UnknownRelationException.class,
                () -> compiler.compile("authors", Map.of("books", Map.of("include", Map.of("chapters", true))), 3));
        assertEquals("books", e.getEntity());
        assertEquals("chapters", e.getKey());
    }

    @Test
    @DisplayName("unknown root entity is rejected")
    void testUnknownEntity() {
        assertThrows(UnknownEntityException.class, () -> compiler.compile("publishers", null, 3));
    }

    @Test
    @DisplayName("nesting beyond maxDepth is pruned without validation")
    void testDepthPruning() {
        // GIVEN: books -> tags -> chapters, where chapters does not exist on tags
        Map<String, Object> spec = Map.of("books",
                Map.of("include", Map.of("tags",
                        Map.of("include", Map.of("chapters", true)))));

        // WHEN: compiled with maxDepth 2
        IncludePlan plan = compiler.compile("authors", spec, 2);
        System.out.println(plan.explain());

        // THEN: books and tags resolve, chapters is silently dropped
        assertEquals(2, plan.depth());
        IncludeNode books = plan.nodes().get(0);
        assertEquals("books", books.key());
        assertEquals(RelationKind.MANY, books.relation().kind());
        IncludeNode tags = books.children().get(0);
        assertEquals("tags", tags.key());
        assertEquals(1, tags.depth());
        assertEquals(RelationKind.MANY_VIA_JOIN, tags.relation().kind());
        assertFalse(tags.hasChildren());

        // AND: with maxDepth 3 the same request is rejected
        assertThrows(UnknownRelationException.class, () -> compiler.compile("authors", spec, 3));
    }

    @Test
    @DisplayName("a request deeper than maxDepth compiles like its truncation")
    void testTruncationEquivalence() {
        Map<String, Object> deep = Map.of("books", Map.of("limit", 2,
                "include", Map.of("author", Map.of("include", Map.of("books", Map.of("include",
                        Map.of("tags", true)))))));
        Map<String, Object> truncated = Map.of("books", Map.of("limit", 2,
                "include", Map.of("author", Map.of())));

        assertEquals(compiler.compile("authors", truncated, 2), compiler.compile("authors", deep, 2));
    }

    @Test
    @DisplayName("maxDepth 0 and null requests yield an empty plan")
    void testEmptyPlans() {
        assertTrue(compiler.compile("authors", null, 3).isEmpty());
        assertTrue(compiler.compile("authors", Map.of("bogus", true), 0).isEmpty());
        assertTrue(compiler.compile("authors", Map.of(), 3).isEmpty());
    }

    @Test
    @DisplayName("false omits the relation")
    void testFalseOmitted() {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("books", false);
        spec.put("profile", true);

        IncludePlan plan = compiler.compile("authors", spec, 3);
        assertEquals(List.of("profile"), plan.nodes().stream().map(IncludeNode::key).toList());
        assertInstanceOf(IncludeNode.Leaf.class, plan.nodes().get(0));
    }

    @Test
    @DisplayName("options are compiled into the node")
    void testOptions() {
        IncludePlan plan = compiler.compile("authors", Map.of("books", Map.of(
                "limit", 5L, "offset", 2, "orderBy", "published", "order", "desc",
                "select", List.of("title", "title", "published"))), 3);

        IncludeNode books = plan.nodes().get(0);
        assertEquals(OptionalInt.of(5), books.options().limit());
        assertEquals(2, books.options().offset());
        assertEquals(Optional.of("published"), books.options().orderBy());
        assertEquals(SortDirection.DESC, books.options().order());
        assertEquals(List.of("title", "published"), books.options().select());
    }

    @Test
    @DisplayName("integral doubles are accepted as integers")
    void testIntegralDouble() {
        IncludePlan plan = compiler.compile("authors", Map.of("books", Map.of("limit", 3.0)), 3);
        assertEquals(OptionalInt.of(3), plan.nodes().get(0).options().limit());
    }

    @Test
    @DisplayName("malformed options are rejected")
    void testInvalidOptions() {
        assertInvalid(Map.of("books", Map.of("limit", 0)), "limit");
        assertInvalid(Map.of("books", Map.of("limit", 1.5)), "limit");
        assertInvalid(Map.of("books", Map.of("limit", "10")), "limit");
        assertInvalid(Map.of("books", Map.of("offset", -1)), "offset");
        assertInvalid(Map.of("books", Map.of("orderBy", "isbn")), "isbn");
        assertInvalid(Map.of("books", Map.of("order", "up")), "order");
        assertInvalid(Map.of("books", Map.of("select", "title")), "select");
        assertInvalid(Map.of("books", Map.of("exclude", List.of("missing"))), "missing");
        assertInvalid(Map.of("books", Map.of("where", Map.of())), "where");
        assertInvalid(Map.of("books", "yes"), "books");
        assertInvalid(Map.of("books", Map.of("include", List.of("tags"))), "include");
    }

    @Test
    @DisplayName("a non-object request is rejected")
    void testNonObjectRequest() {
        InvalidIncludeSpecException e = assertThrows(InvalidIncludeSpecException.class,
                () -> compiler.compile("authors", List.of("books"), 3));
        assertNull(e.getKey());
    }

    @Test
    @DisplayName("compilation is deterministic")
    void testDeterministic() {
        Map<String, Object> spec = Map.of("books", Map.of("orderBy", "title",
                "include", Map.of("tags", true, "author", true)), "profile", true);
        assertEquals(compiler.compile("authors", spec, 3), compiler.compile("authors", spec, 3));
    }

    private void assertInvalid(Map<String, Object> spec, String mentioned) {
        InvalidIncludeSpecException e = assertThrows(InvalidIncludeSpecException.class,
                () -> compiler.compile("authors", spec, 3), () -> "expected rejection of " + spec);
        assertEquals("authors", e.getEntity());
        assertEquals("books", e.getKey());
        assertTrue(e.getMessage().contains(mentioned), e.getMessage());
    }

    @Test
    @DisplayName("orderBy on a JSON column is rejected")
    void testUnorderableColumn() {
        RelationGraph graph = RelationGraph.builder()
                .addEntities(List.of(
                        new EntityDefinition("authors", List.of(Column.required("id", SqlDataType.INTEGER)),
                                List.of("id")),
                        new EntityDefinition("events",
                                List.of(Column.required("id", SqlDataType.INTEGER),
                                        Column.required("author_id", SqlDataType.INTEGER),
                                        Column.nullable("payload", SqlDataType.JSON)),
                                List.of("id"),
                                List.of(ForeignKey.of("author_id", "authors", "id")))))
                .deriveFromForeignKeys()
                .build();
        IncludeCompiler events = new IncludeCompiler(graph);

        InvalidIncludeSpecException e = assertThrows(InvalidIncludeSpecException.class,
                () -> events.compile("authors", Map.of("events", Map.of("orderBy", "payload")), 3));
        assertEquals("events", e.getKey());
        assertNotNull(events.compile("authors", Map.of("events", Map.of("orderBy", "id")), 3));
    }
}
