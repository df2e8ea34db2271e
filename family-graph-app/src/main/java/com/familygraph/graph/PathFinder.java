package com.familygraph.graph;

import com.familygraph.model.RelationshipKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shortest labelled path between two persons by bidirectional breadth-first search.
 *
 * Each round expands one whole layer of the smaller frontier. Before a round no person is in both
 * visited sets, so the shortest path is longer than the two frontier depths combined; the first
 * round that produces an overlap therefore contains a shortest meeting point. Among overlapping
 * persons from that round the one with the smallest combined depth wins, earliest discovered
 * first, which makes ties reproducible under the adjacency ordering.
 */
@Component
public class PathFinder {

    private static final Logger log = LoggerFactory.getLogger(PathFinder.class);

    /**
     * @param maxPathLength paths with more hops than this are reported as no connection
     * @throws PersonNotFoundException if either person is not part of the view
     */
    public PathResult findPath(AdjacencyView view, Long personAId, Long personBId, int maxPathLength) {
        if (!view.contains(personAId)) {
            throw new PersonNotFoundException(personAId);
        }
        if (!view.contains(personBId)) {
            throw new PersonNotFoundException(personBId);
        }
        if (personAId.equals(personBId)) {
            return PathResult.samePerson(personAId, maxPathLength);
        }

        Frontier fromA = new Frontier(personAId);
        Frontier fromB = new Frontier(personBId);

        while (!fromA.isExhausted() && !fromB.isExhausted()) {
            if (fromA.layerDepth + fromB.layerDepth >= maxPathLength) {
                log.debug("Path search between {} and {} stopped at length limit {}", personAId, personBId, maxPathLength);
                break;
            }

            Frontier expanding = fromA.layer.size() <= fromB.layer.size() ? fromA : fromB;
            Frontier other = expanding == fromA ? fromB : fromA;

            List<Long> discovered = expanding.expand(view);
            Long meeting = null;
            int best = Integer.MAX_VALUE;
            for (Long personId : discovered) {
                Integer otherDepth = other.depth.get(personId);
                if (otherDepth != null && expanding.depth.get(personId) + otherDepth < best) {
                    best = expanding.depth.get(personId) + otherDepth;
                    meeting = personId;
                }
            }

            log.debug("Path search layer: A depth={} visited={}, B depth={} visited={}",
                    fromA.layerDepth, fromA.depth.size(), fromB.layerDepth, fromB.depth.size());

            if (meeting != null) {
                List<PathStep> steps = reconstruct(view, meeting, fromA, fromB);
                return PathResult.found(personAId, personBId, meeting, steps, maxPathLength);
            }
        }

        return PathResult.noConnection(personAId, personBId, maxPathLength);
    }

    private List<PathStep> reconstruct(AdjacencyView view, Long meeting, Frontier fromA, Frontier fromB) {
        List<PathStep> steps = new ArrayList<>();

        // meeting back to A, incoming labels as recorded on the way out from A
        Long current = meeting;
        while (current != null) {
            Predecessor predecessor = fromA.predecessors.get(current);
            if (predecessor == null) {
                steps.add(new PathStep(current, null, null));
                current = null;
            } else {
                steps.add(new PathStep(current, predecessor.kind(),
                        labelBetween(view, current, predecessor.personId())));
                current = predecessor.personId();
            }
        }
        Collections.reverse(steps);

        // meeting forward to B; B's records point the other way, so the incoming label is looked up
        Long previous = meeting;
        Predecessor next = fromB.predecessors.get(meeting);
        while (next != null) {
            Long personId = next.personId();
            steps.add(new PathStep(personId, labelBetween(view, previous, personId), next.kind()));
            previous = personId;
            next = fromB.predecessors.get(personId);
        }
        return steps;
    }

    private RelationshipKind labelBetween(AdjacencyView view, Long fromId, Long toId) {
        return view.firstEntry(fromId, toId)
                .map(AdjacencyEntry::kind)
                .orElseThrow(() -> new IllegalStateException(
                        "Adjacency view is not symmetric between " + fromId + " and " + toId));
    }

    private record Predecessor(Long personId, RelationshipKind kind) {}

    private static final class Frontier {

        private final Map<Long, Integer> depth = new HashMap<>();
        private final Map<Long, Predecessor> predecessors = new HashMap<>();
        private List<Long> layer;
        private int layerDepth;

        Frontier(Long origin) {
            depth.put(origin, 0);
            layer = List.of(origin);
        }

        boolean isExhausted() {
            return layer.isEmpty();
        }

        List<Long> expand(AdjacencyView view) {
            List<Long> next = new ArrayList<>();
            for (Long current : layer) {
                for (AdjacencyEntry entry : view.neighbors(current)) {
                    if (!depth.containsKey(entry.neighborId())) {
                        depth.put(entry.neighborId(), layerDepth + 1);
                        predecessors.put(entry.neighborId(), new Predecessor(current, entry.kind()));
                        next.add(entry.neighborId());
                    }
                }
            }
            layer = next;
            layerDepth++;
            return next;
        }
    }
}
