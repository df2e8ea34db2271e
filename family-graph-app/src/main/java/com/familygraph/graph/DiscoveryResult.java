package com.familygraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Persons that survived depth and attribute filtering, each with the minimum hop count from the root.
 * Iteration order is BFS discovery order; the root is never present.
 */
public record DiscoveryResult(
    Long rootId,
    int effectiveDepth,
    DepthMode depthMode,
    Map<Long, Integer> depths,
    int reachedCount
) {
    public DiscoveryResult {
        depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
    }

    public Set<Long> personIds() {
        return depths.keySet();
    }

    public Integer depthOf(Long personId) {
        return depths.get(personId);
    }

    public int size() {
        return depths.size();
    }
}
