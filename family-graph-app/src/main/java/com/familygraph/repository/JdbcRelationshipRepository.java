package com.familygraph.repository;

import com.familygraph.model.RelationshipEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class JdbcRelationshipRepository implements RelationshipSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcRelationshipRepository.class);
    private static final int IN_CLAUSE_CHUNK = 500;

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<EdgeRow> EDGE_MAPPER = (rs, rowNum) -> new EdgeRow(
        rs.getLong("id"),
        new RelationshipEdge(
            rs.getLong("person_id"),
            rs.getLong("related_person_id"),
            rs.getString("relationship_type")
        )
    );

    public JdbcRelationshipRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.namedJdbc = new NamedParameterJdbcTemplate(jdbc);
    }

    /**
     * Expands outward one level per query: each round fetches the active rows touching the current
     * frontier, in either column, and the unseen endpoints become the next frontier.
     */
    @Override
    public List<RelationshipEdge> loadEdgesNear(Long personId, int hops) {
        Map<Long, RelationshipEdge> edges = new LinkedHashMap<>();
        Set<Long> seen = new HashSet<>();
        List<Long> frontier = new ArrayList<>();
        seen.add(personId);
        frontier.add(personId);

        for (int level = 0; level < hops && !frontier.isEmpty(); level++) {
            List<Long> next = new ArrayList<>();
            for (EdgeRow row : findTouching(frontier)) {
                edges.putIfAbsent(row.id(), row.edge());
                for (Long endpoint : List.of(row.edge().sourcePersonId(), row.edge().targetPersonId())) {
                    if (seen.add(endpoint)) {
                        next.add(endpoint);
                    }
                }
            }
            frontier = next;
        }

        log.debug("Loaded {} edges within {} hops of person {}", edges.size(), hops, personId);
        return new ArrayList<>(edges.values());
    }

    @Override
    public List<RelationshipEdge> loadAllEdges() {
        return jdbc.query(
            "SELECT id, person_id, related_person_id, relationship_type FROM person_relationship " +
            "WHERE is_active = TRUE ORDER BY id",
            EDGE_MAPPER
        ).stream().map(EdgeRow::edge).toList();
    }

    private List<EdgeRow> findTouching(List<Long> personIds) {
        List<EdgeRow> rows = new ArrayList<>();
        for (int from = 0; from < personIds.size(); from += IN_CLAUSE_CHUNK) {
            List<Long> chunk = personIds.subList(from, Math.min(from + IN_CLAUSE_CHUNK, personIds.size()));
            rows.addAll(namedJdbc.query(
                "SELECT id, person_id, related_person_id, relationship_type FROM person_relationship " +
                "WHERE is_active = TRUE AND (person_id IN (:ids) OR related_person_id IN (:ids)) ORDER BY id",
                new MapSqlParameterSource("ids", chunk),
                EDGE_MAPPER
            ));
        }
        return rows;
    }

    private record EdgeRow(Long id, RelationshipEdge edge) {}
}
