package com.familygraph.graph;

import com.familygraph.model.RelationshipEdge;

/**
 * A stored edge could not be turned into an adjacency entry. Indicates corrupt upstream data.
 */
public class MalformedEdgeException extends GraphQueryException {

    private final RelationshipEdge edge;

    public MalformedEdgeException(RelationshipEdge edge, String reason) {
        super("Malformed relationship edge " + edge + ": " + reason);
        this.edge = edge;
    }

    public RelationshipEdge getEdge() {
        return edge;
    }
}
