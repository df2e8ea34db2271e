package com.familygraph.graph;

public record DiscoveryQuery(Long rootId, int maxDepth, DepthMode depthMode, DiscoveryFilters filters) {

    public DiscoveryQuery {
        if (depthMode == null) {
            throw new InvalidDepthModeException(null);
        }
        if (maxDepth < 1) {
            throw new InvalidFilterException("Depth must be at least 1, got " + maxDepth);
        }
        if (filters == null) {
            filters = DiscoveryFilters.none();
        }
    }
}
