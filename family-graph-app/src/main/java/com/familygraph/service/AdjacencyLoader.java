package com.familygraph.service;

import com.familygraph.config.GraphProperties;
import com.familygraph.config.GraphProperties.EdgeScope;
import com.familygraph.graph.AdjacencyView;
import com.familygraph.graph.EdgeNormalizer;
import com.familygraph.model.Gender;
import com.familygraph.model.RelationshipEdge;
import com.familygraph.repository.PersonDirectory;
import com.familygraph.repository.RelationshipSource;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the edges a query needs, up front and in batches, and builds its adjacency view.
 * Nothing is read from the store once traversal starts.
 */
@Component
public class AdjacencyLoader {

    private final RelationshipSource relationshipSource;
    private final PersonDirectory personDirectory;
    private final EdgeNormalizer edgeNormalizer;
    private final GraphProperties properties;

    public AdjacencyLoader(RelationshipSource relationshipSource,
                           PersonDirectory personDirectory,
                           EdgeNormalizer edgeNormalizer,
                           GraphProperties properties) {
        this.relationshipSource = relationshipSource;
        this.personDirectory = personDirectory;
        this.edgeNormalizer = edgeNormalizer;
        this.properties = properties;
    }

    /**
     * @param startId the person the query expands from
     * @param hops    how far from {@code startId} the query can reach
     * @param anchors persons that must be present in the view even without edges
     */
    public AdjacencyView load(Long startId, int hops, List<Long> anchors) {
        List<RelationshipEdge> edges = properties.getEdgeScope() == EdgeScope.ALL
                ? relationshipSource.loadAllEdges()
                : relationshipSource.loadEdgesNear(startId, hops);

        Set<Long> endpoints = new HashSet<>();
        for (RelationshipEdge edge : edges) {
            endpoints.add(edge.sourcePersonId());
            endpoints.add(edge.targetPersonId());
        }
        Map<Long, Gender> genders = endpoints.isEmpty() ? Map.of() : personDirectory.lookupGenders(endpoints);

        return edgeNormalizer.normalize(edges, genders, anchors);
    }
}
