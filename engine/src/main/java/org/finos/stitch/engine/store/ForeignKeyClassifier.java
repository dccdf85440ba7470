package org.finos.stitch.engine.store;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies foreign keys into relations.
 * 
 * For a foreign key {@code books(author_id) -> authors(id)}:
 * <ul>
 * <li>{@code books.author} - one, books.author_id matches authors.id</li>
 * <li>{@code authors.books} - many, authors.id matches books.author_id</li>
 * </ul>
 * An entity with exactly two foreign keys to two distinct entities is treated as
 * a join entity: {@code book_tags(book_id -> books, tag_id -> tags)} yields
 * {@code books.tags} and {@code tags.books}, both many_via_join.
 * 
 * Names that are already taken keep their first definition.
 */
final class ForeignKeyClassifier {

    private final RelationGraph.Builder builder;

    ForeignKeyClassifier(RelationGraph.Builder builder) {
        this.builder = builder;
    }

    void classify(List<EntityDefinition> entities) {
        Set<String> names = new HashSet<>();
        entities.forEach(e -> names.add(e.name()));

        // 1) one / many from each foreign key
        for (EntityDefinition child : entities) {
            for (ForeignKey fk : child.foreignKeys()) {
                if (!names.contains(fk.referencedEntity())) {
                    continue;
                }
                builder.addRelationIfAbsent(RelationDescriptor.one(
                        child.name(), singular(fk.referencedEntity()), fk.referencedEntity(),
                        fk.columns(), fk.referencedColumns()));
                builder.addRelationIfAbsent(RelationDescriptor.many(
                        fk.referencedEntity(), plural(child.name()), child.name(),
                        fk.referencedColumns(), fk.columns()));
            }
        }

        // 2) many_via_join through entities holding exactly two foreign keys
        for (EntityDefinition join : entities) {
            if (join.foreignKeys().size() != 2) {
                continue;
            }
            ForeignKey fkA = join.foreignKeys().get(0);
            ForeignKey fkB = join.foreignKeys().get(1);
            String a = fkA.referencedEntity();
            String b = fkB.referencedEntity();
            if (a.equals(b) || !names.contains(a) || !names.contains(b)) {
                continue;
            }
            boolean unique = isUniquePair(join, fkA, fkB);
            builder.addRelationIfAbsent(RelationDescriptor.manyViaJoin(
                    a, plural(b), b, fkA.referencedColumns(), fkB.referencedColumns(),
                    new JoinDescriptor(join.name(), fkA.columns(), fkB.columns(), unique)));
            builder.addRelationIfAbsent(RelationDescriptor.manyViaJoin(
                    b, plural(a), a, fkB.referencedColumns(), fkA.referencedColumns(),
                    new JoinDescriptor(join.name(), fkB.columns(), fkA.columns(), unique)));
        }
    }

    // PK made of exactly both FK column sets
    private static boolean isUniquePair(EntityDefinition join, ForeignKey fkA, ForeignKey fkB) {
        Set<String> pair = new HashSet<>(fkA.columns());
        pair.addAll(fkB.columns());
        return !join.primaryKey().isEmpty() && new HashSet<>(join.primaryKey()).equals(pair);
    }

    static String singular(String name) {
        return name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
    }

    static String plural(String name) {
        return name.endsWith("s") ? name : name + "s";
    }
}
