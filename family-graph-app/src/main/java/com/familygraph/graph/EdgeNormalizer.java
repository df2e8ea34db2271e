package com.familygraph.graph;

import com.familygraph.model.Gender;
import com.familygraph.model.RelationshipEdge;
import com.familygraph.model.RelationshipKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns stored, possibly one-directional relationship rows into a symmetric {@link AdjacencyView}.
 *
 * For each edge (u, v, kind) the view gets (v, kind, FORWARD) under u and (u, inverse, BACKWARD)
 * under v, whether or not the store also holds the inverse row. Two entries for the same ordered
 * pair with the same kind collapse into one, preferring FORWARD; different kinds between the same
 * pair are all kept.
 */
@Component
public class EdgeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EdgeNormalizer.class);

    /**
     * @param edges   stored edges for the query's scope
     * @param genders gender per person id, used to label inverse parent/child entries; missing ids are UNKNOWN
     * @param anchors person ids that must appear in the view even when they have no edges
     * @throws MalformedEdgeException if any edge has a missing endpoint, points at itself or carries an unknown kind
     */
    public AdjacencyView normalize(Collection<RelationshipEdge> edges,
                                   Map<Long, Gender> genders,
                                   Collection<Long> anchors) {
        Map<Long, Map<EntryKey, AdjacencyEntry>> building = new HashMap<>();

        for (Long anchor : anchors) {
            building.computeIfAbsent(anchor, id -> new LinkedHashMap<>());
        }

        for (RelationshipEdge edge : edges) {
            RelationshipKind kind = resolve(edge);
            Long source = edge.sourcePersonId();
            Long target = edge.targetPersonId();
            Gender sourceGender = genders.getOrDefault(source, Gender.UNKNOWN);

            put(building, source, new AdjacencyEntry(target, kind, Direction.FORWARD));
            put(building, target, new AdjacencyEntry(source, kind.inverse(sourceGender), Direction.BACKWARD));
        }

        Map<Long, List<AdjacencyEntry>> sorted = new HashMap<>();
        building.forEach((personId, entries) -> {
            List<AdjacencyEntry> list = new ArrayList<>(entries.values());
            list.sort(AdjacencyEntry.ORDER);
            sorted.put(personId, List.copyOf(list));
        });

        AdjacencyView view = new AdjacencyView(sorted);
        log.debug("Normalized {} edges into {} persons / {} adjacency entries",
                edges.size(), view.personCount(), view.entryCount());
        return view;
    }

    private RelationshipKind resolve(RelationshipEdge edge) {
        if (edge.sourcePersonId() == null || edge.targetPersonId() == null) {
            throw new MalformedEdgeException(edge, "missing person id");
        }
        if (edge.sourcePersonId().equals(edge.targetPersonId())) {
            throw new MalformedEdgeException(edge, "person related to themself");
        }
        return RelationshipKind.fromCode(edge.relationshipType())
                .orElseThrow(() -> new MalformedEdgeException(edge,
                        "unknown relationship type '" + edge.relationshipType() + "'"));
    }

    private void put(Map<Long, Map<EntryKey, AdjacencyEntry>> building, Long personId, AdjacencyEntry entry) {
        Map<EntryKey, AdjacencyEntry> entries = building.computeIfAbsent(personId, id -> new LinkedHashMap<>());
        EntryKey key = new EntryKey(entry.neighborId(), entry.kind());
        AdjacencyEntry existing = entries.get(key);
        if (existing == null || (existing.direction() == Direction.BACKWARD && entry.direction() == Direction.FORWARD)) {
            entries.put(key, entry);
        }
    }

    private record EntryKey(Long neighborId, RelationshipKind kind) {}
}
