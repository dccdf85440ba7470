package org.finos.stitch.engine.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StitchJsonTest {

    @Test
    @DisplayName("parses nested include requests preserving key order")
    void testParseRequest() {
        Map<String, Object> request = StitchJson.parseObject("""
                {
                  "limit": 10,
                  "include": {
                    "books": {"orderBy": "published", "order": "desc", "limit": 2.5e0,
                              "include": {"tags": true, "author": false}},
                    "profile": null
                  }
                }
                """);

        assertEquals(10L, request.get("limit"));
        @SuppressWarnings("unchecked")
        Map<String, Object> include = (Map<String, Object>) request.get("include");
        assertEquals(List.of("books", "profile"), List.copyOf(include.keySet()));
        @SuppressWarnings("unchecked")
        Map<String, Object> books = (Map<String, Object>) include.get("books");
        assertEquals(2.5, books.get("limit"));
        assertEquals(Map.of("tags", true, "author", false), books.get("include"));
        assertTrue(include.containsKey("profile"));
        assertNull(include.get("profile"));
    }

    @Test
    @DisplayName("blank body is an empty object")
    void testBlank() {
        assertEquals(Map.of(), StitchJson.parseObject("  "));
    }

    @Test
    @DisplayName("malformed documents are rejected")
    void testMalformed() {
        for (String bad : List.of("{", "{\"a\" 1}", "[1,]", "{\"a\":1} x", "tru", "\"open", "01x", "-", "[1 2]")) {
            assertThrows(StitchJson.JsonSyntaxException.class, () -> StitchJson.parse(bad), bad);
        }
        assertThrows(StitchJson.JsonSyntaxException.class, () -> StitchJson.parseObject("[1]"));
    }

    @Test
    @DisplayName("escapes and unicode")
    void testStrings() {
        assertEquals("a\"b\\c\n\u00e9", StitchJson.parse("\"a\\\"b\\\\c\\n\\u00e9\""));
        assertEquals("\"line\\nbreak \\\"q\\\" \\u0001\"", StitchJson.toJson("line\nbreak \"q\" \u0001"));
    }

    @Test
    @DisplayName("writes rows with JDBC value types")
    void testWriteRows() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 1);
        row.put("price", new BigDecimal("12.50"));
        row.put("published", Date.valueOf(LocalDate.of(2001, 2, 3)));
        row.put("bio", null);
        row.put("tags", Arrays.asList(Map.of("label", "x"), null));

        assertEquals("[{\"id\":1,\"price\":12.50,\"published\":\"2001-02-03\",\"bio\":null,"
                + "\"tags\":[{\"label\":\"x\"},null]}]", StitchJson.toJson(List.of(row)));
        assertEquals("null", StitchJson.toJson(Double.NaN));
    }

    @Test
    @DisplayName("large integers stay exact")
    void testBigInteger() {
        assertEquals(new java.math.BigInteger("123456789012345678901234"),
                StitchJson.parse("123456789012345678901234"));
        assertEquals(-5L, StitchJson.parse("-5"));
    }

    @Test
    @DisplayName("nesting beyond the limit is a syntax error")
    void testNestingLimit() {
        String ok = "[".repeat(StitchJson.MAX_DEPTH) + "]".repeat(StitchJson.MAX_DEPTH);
        assertEquals(List.of(), unwrap(StitchJson.parse(ok), StitchJson.MAX_DEPTH - 1));

        int levels = 20_000;
        String deep = "{\"include\":".repeat(levels) + "true" + "}".repeat(levels);
        StitchJson.JsonSyntaxException e = assertThrows(StitchJson.JsonSyntaxException.class,
                () -> StitchJson.parseObject(deep));
        assertTrue(e.getMessage().contains("Nesting deeper than " + StitchJson.MAX_DEPTH));
        assertThrows(StitchJson.JsonSyntaxException.class,
                () -> StitchJson.parse("[".repeat(StitchJson.MAX_DEPTH + 1) + "]".repeat(StitchJson.MAX_DEPTH + 1)));
    }

    private static Object unwrap(Object value, int levels) {
        for (int i = 0; i < levels; i++) {
            value = ((List<?>) value).get(0);
        }
        return value;
    }

    @Test
    @DisplayName("only JSON whitespace and ASCII digits are accepted")
    void testNonJsonCharacters() {
        // Arabic-Indic digit one, then em spaces
        assertThrows(StitchJson.JsonSyntaxException.class, () -> StitchJson.parse("1\u0661"));
        assertThrows(StitchJson.JsonSyntaxException.class, () -> StitchJson.parse("\u2003{}"));
        assertThrows(StitchJson.JsonSyntaxException.class, () -> StitchJson.parse("{\u2003}"));
        assertEquals(12L, StitchJson.parse(" \t\r\n12\n"));
    }
}
