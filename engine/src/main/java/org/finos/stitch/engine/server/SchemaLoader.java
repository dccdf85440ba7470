package org.finos.stitch.engine.server;

import org.finos.stitch.engine.store.Column;
import org.finos.stitch.engine.store.EntityDefinition;
import org.finos.stitch.engine.store.ForeignKey;
import org.finos.stitch.engine.store.JoinDescriptor;
import org.finos.stitch.engine.store.RelationDescriptor;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.store.RelationKind;
import org.finos.stitch.engine.store.SqlDataType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link RelationGraph} from a JSON schema document.
 * 
 * <pre>
 * {
 *   "entities": {
 *     "authors": {
 *       "columns": [{"name": "id", "type": "integer", "nullable": false}, ...],
 *       "primaryKey": ["id"],
 *       "foreignKeys": [{"columns": ["author_id"], "references": "authors", "referencedColumns": ["id"]}]
 *     }
 *   },
 *   "relations": [
 *     {"entity": "authors", "name": "favourite", "kind": "one", "target": "books",
 *      "sourceKey": ["favourite_book_id"], "targetKey": ["id"]}
 *   ]
 * }
 * </pre>
 * 
 * Relations listed explicitly take precedence; the rest are derived from the
 * foreign keys.
 */
public final class SchemaLoader {

    private SchemaLoader() {
    }

    public static RelationGraph load(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the document is malformed or inconsistent
     */
    public static RelationGraph parse(String json) {
        Map<String, Object> root = StitchJson.parseObject(json);
        Map<String, Object> entities = object(root, "entities", "schema");
        if (entities == null) {
            throw new IllegalArgumentException("Schema has no 'entities' object");
        }

        RelationGraph.Builder builder = RelationGraph.builder();
        for (Map.Entry<String, Object> entry : entities.entrySet()) {
            builder.addEntity(entity(entry.getKey(), asObject(entry.getValue(), "entity " + entry.getKey())));
        }
        List<Object> relations = list(root, "relations", "schema");
        if (relations != null) {
            for (Object relation : relations) {
                builder.addRelation(relation(asObject(relation, "relation")));
            }
        }
        return builder.deriveFromForeignKeys().build();
    }

    private static EntityDefinition entity(String name, Map<String, Object> def) {
        String where = "entity " + name;
        List<Column> columns = new ArrayList<>();
        List<Object> rawColumns = list(def, "columns", where);
        if (rawColumns == null) {
            throw new IllegalArgumentException(where + " has no columns");
        }
        for (Object raw : rawColumns) {
            Map<String, Object> column = asObject(raw, where + " column");
            String columnName = string(column, "name", where);
            String type = string(column, "type", where + "." + columnName);
            boolean nullable = !Boolean.FALSE.equals(column.get("nullable"));
            columns.add(new Column(columnName, SqlDataType.fromTypeName(type), nullable));
        }

        List<String> primaryKey = def.containsKey("primaryKey") ? strings(def, "primaryKey", where) : List.of();
        List<ForeignKey> foreignKeys = new ArrayList<>();
        List<Object> rawForeignKeys = list(def, "foreignKeys", where);
        if (rawForeignKeys != null) {
            for (Object raw : rawForeignKeys) {
                Map<String, Object> fk = asObject(raw, where + " foreign key");
                foreignKeys.add(new ForeignKey(
                        strings(fk, "columns", where),
                        string(fk, "references", where),
                        strings(fk, "referencedColumns", where)));
            }
        }
        return new EntityDefinition(name, columns, primaryKey, foreignKeys);
    }

    private static RelationDescriptor relation(Map<String, Object> def) {
        String entity = string(def, "entity", "relation");
        String name = string(def, "name", "relation on " + entity);
        String where = "relation " + entity + "." + name;
        String kindName = string(def, "kind", where);
        RelationKind kind = RelationKind.fromWireName(kindName)
                .orElseThrow(() -> new IllegalArgumentException(where + " has unknown kind: " + kindName));

        Optional<JoinDescriptor> via = Optional.empty();
        Map<String, Object> rawVia = object(def, "via", where);
        if (rawVia != null) {
            via = Optional.of(new JoinDescriptor(
                    string(rawVia, "entity", where),
                    strings(rawVia, "sourceColumns", where),
                    strings(rawVia, "targetColumns", where),
                    Boolean.TRUE.equals(rawVia.get("unique"))));
        }
        return new RelationDescriptor(entity, name, kind, string(def, "target", where),
                strings(def, "sourceKey", where), strings(def, "targetKey", where), via);
    }

    // ========== FIELD ACCESS ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value, String where) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(where + " must be an object");
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> object(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        return value == null ? null : asObject(value, where + "." + key);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(where + "." + key + " must be an array");
        }
        return (List<Object>) value;
    }

    private static String string(Map<String, Object> map, String key, String where) {
        if (!(map.get(key) instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException(where + " requires string '" + key + "'");
        }
        return s;
    }

    private static List<String> strings(Map<String, Object> map, String key, String where) {
        List<Object> values = list(map, key, where);
        if (values == null) {
            throw new IllegalArgumentException(where + " requires array '" + key + "'");
        }
        List<String> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof String s)) {
                throw new IllegalArgumentException(where + "." + key + " must contain strings");
            }
            result.add(s);
        }
        return result;
    }
}
