package com.familygraph.graph;

import com.familygraph.model.RelationshipKind;

import java.util.Comparator;

/**
 * One neighbour of a person. {@code kind} says who the neighbour is to that person.
 */
public record AdjacencyEntry(Long neighborId, RelationshipKind kind, Direction direction) {

    static final Comparator<AdjacencyEntry> ORDER = Comparator
            .comparing(AdjacencyEntry::neighborId)
            .thenComparing(AdjacencyEntry::kind)
            .thenComparing(AdjacencyEntry::direction);
}
