package org.finos.stitch.engine.store;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of entities and the named relations declared on them.
 * 
 * Built once (typically at process start) through {@link Builder}; never mutated
 * afterwards, so it can be shared freely between threads and requests.
 * 
 * <pre>
 * RelationGraph graph = RelationGraph.builder()
 *         .addEntity(authors)
 *         .addEntity(books)
 *         .addRelation(RelationDescriptor.many("authors", "books", "books", List.of("id"), List.of("author_id")))
 *         .build();
 * 
 * graph.lookup("authors", "books"); // Optional[authors.books (many -> books)]
 * </pre>
 */
public final class RelationGraph {

    private final Map<String, EntityDefinition> entities;
    private final Map<String, Map<String, RelationDescriptor>> relations;

    private RelationGraph(Map<String, EntityDefinition> entities,
            Map<String, Map<String, RelationDescriptor>> relations) {
        this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        Map<String, Map<String, RelationDescriptor>> copy = new LinkedHashMap<>();
        relations.forEach((entity, byName) -> copy.put(entity,
                Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
        this.relations = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a relation declared on an entity.
     * 
     * @param entity       The source entity name
     * @param relationName The relation name
     * @return The descriptor, or empty if the entity or relation is unknown
     */
    public Optional<RelationDescriptor> lookup(String entity, String relationName) {
        Map<String, RelationDescriptor> byName = relations.get(entity);
        return byName == null ? Optional.empty() : Optional.ofNullable(byName.get(relationName));
    }

    public Optional<EntityDefinition> entity(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    /**
     * @throws IllegalArgumentException if the entity is not registered
     */
    public EntityDefinition getEntity(String name) {
        return entity(name).orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + name));
    }

    /**
     * @return Relations declared on the entity, keyed by name (empty if none)
     */
    public Map<String, RelationDescriptor> relations(String entity) {
        return relations.getOrDefault(entity, Map.of());
    }

    public Collection<EntityDefinition> entities() {
        return entities.values();
    }

    @Override
    public String toString() {
        return "RelationGraph" + relations;
    }

    /**
     * Collects entities and relations, validates them against each other and
     * freezes them into a {@link RelationGraph}.
     */
    public static final class Builder {
        private final Map<String, EntityDefinition> entities = new LinkedHashMap<>();
        private final Map<String, Map<String, RelationDescriptor>> relations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder addEntity(EntityDefinition entity) {
            if (entities.putIfAbsent(entity.name(), entity) != null) {
                throw new IllegalArgumentException("Duplicate entity: " + entity.name());
            }
            return this;
        }

        public Builder addEntities(Collection<EntityDefinition> defs) {
            defs.forEach(this::addEntity);
            return this;
        }

        /**
         * @throws IllegalArgumentException if a relation with the same name already exists
         */
        public Builder addRelation(RelationDescriptor relation) {
            Map<String, RelationDescriptor> byName = relations.computeIfAbsent(
                    relation.sourceEntity(), k -> new LinkedHashMap<>());
            if (byName.putIfAbsent(relation.name(), relation) != null) {
                throw new IllegalArgumentException("Duplicate relation: " + relation.qualifiedName());
            }
            return this;
        }

        /**
         * Adds the relation unless the name is already taken on its source entity.
         * 
         * @return true if added
         */
        boolean addRelationIfAbsent(RelationDescriptor relation) {
            Map<String, RelationDescriptor> byName = relations.computeIfAbsent(
                    relation.sourceEntity(), k -> new LinkedHashMap<>());
            return byName.putIfAbsent(relation.name(), relation) == null;
        }

        /**
         * Derives one/many/many_via_join relations from the foreign keys of every
         * entity registered so far.
         * 
         * @see ForeignKeyClassifier
         */
        public Builder deriveFromForeignKeys() {
            new ForeignKeyClassifier(this).classify(List.copyOf(entities.values()));
            return this;
        }

        public RelationGraph build() {
            for (Map<String, RelationDescriptor> byName : relations.values()) {
                for (RelationDescriptor rel : byName.values()) {
                    validate(rel);
                }
            }
            return new RelationGraph(entities, relations);
        }

        private void validate(RelationDescriptor rel) {
            EntityDefinition source = require(rel.sourceEntity(), rel);
            EntityDefinition target = require(rel.targetEntity(), rel);
            requireColumns(source, rel.sourceKey(), rel);
            requireColumns(target, rel.targetKey(), rel);
            rel.via().ifPresent(join -> {
                EntityDefinition joinEntity = require(join.joinEntity(), rel);
                requireColumns(joinEntity, join.sourceColumns(), rel);
                requireColumns(joinEntity, join.targetColumns(), rel);
            });
        }

        private EntityDefinition require(String entity, RelationDescriptor rel) {
            EntityDefinition def = entities.get(entity);
            if (def == null) {
                throw new IllegalArgumentException(
                        "Relation " + rel.qualifiedName() + " references unknown entity: " + entity);
            }
            return def;
        }

        private static void requireColumns(EntityDefinition entity, List<String> columns, RelationDescriptor rel) {
            for (String column : columns) {
                if (!entity.hasColumn(column)) {
                    throw new IllegalArgumentException("Relation " + rel.qualifiedName()
                            + " references unknown column " + entity.name() + "." + column);
                }
            }
        }
    }
}
