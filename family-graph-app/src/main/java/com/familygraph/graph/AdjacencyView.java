package com.familygraph.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symmetric, per-query neighbour map built by {@link EdgeNormalizer}. Every list is sorted by
 * neighbour id, then kind, then direction, so traversals over an unchanged edge set always
 * visit neighbours in the same order. Immutable once built.
 */
public final class AdjacencyView {

    private final Map<Long, List<AdjacencyEntry>> adjacency;
    private final int entryCount;

    AdjacencyView(Map<Long, List<AdjacencyEntry>> adjacency) {
        this.adjacency = Collections.unmodifiableMap(adjacency);
        this.entryCount = adjacency.values().stream().mapToInt(List::size).sum();
    }

    public boolean contains(Long personId) {
        return adjacency.containsKey(personId);
    }

    public List<AdjacencyEntry> neighbors(Long personId) {
        return adjacency.getOrDefault(personId, List.of());
    }

    /**
     * The first entry from {@code fromId} to {@code toId} under the view's ordering,
     * i.e. the one a traversal from {@code fromId} discovers {@code toId} through.
     */
    public Optional<AdjacencyEntry> firstEntry(Long fromId, Long toId) {
        for (AdjacencyEntry entry : neighbors(fromId)) {
            if (entry.neighborId().equals(toId)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Set<Long> personIds() {
        return adjacency.keySet();
    }

    public int personCount() {
        return adjacency.size();
    }

    public int entryCount() {
        return entryCount;
    }
}
