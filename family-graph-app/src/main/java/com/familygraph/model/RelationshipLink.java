package com.familygraph.model;

/**
 * A neighbouring person on a lineage path and the relationship that links them.
 */
public record RelationshipLink(Long personId, RelationshipKind relationship, String label) {

    public static RelationshipLink of(Long personId, RelationshipKind kind) {
        return new RelationshipLink(personId, kind, kind != null ? kind.label() : null);
    }
}
