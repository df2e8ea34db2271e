package com.familygraph.model;

/**
 * One stored relationship row. {@code relationshipType} says who the target is to the source:
 * (A, B, "Father") means B is A's father. The raw code is kept as stored; it is resolved
 * to a {@link RelationshipKind} when the adjacency view is built.
 */
public record RelationshipEdge(
    Long sourcePersonId,
    Long targetPersonId,
    String relationshipType
) {}
