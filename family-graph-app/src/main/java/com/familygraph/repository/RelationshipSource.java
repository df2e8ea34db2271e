package com.familygraph.repository;

import com.familygraph.model.RelationshipEdge;

import java.util.List;

/**
 * Supplies the active relationship rows a query needs before traversal starts.
 */
public interface RelationshipSource {

    /**
     * Every active edge on some walk of at most {@code hops} edges starting at {@code personId},
     * in either stored direction.
     */
    List<RelationshipEdge> loadEdgesNear(Long personId, int hops);

    List<RelationshipEdge> loadAllEdges();
}
