package com.familygraph.graph;

import com.familygraph.model.Person;
import com.familygraph.model.PersonAddress;
import com.familygraph.repository.PersonDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Breadth-first relatives search from a single root, bounded by depth.
 *
 * The visited map is both the cycle guard and the depth record: a person is marked on first
 * discovery and never revisited, so every recorded depth is the shortest hop count. Depth mode
 * and attribute filters run afterwards on the visited set and never prune traversal, so a person
 * who fails a filter still leads to relatives beyond them.
 */
@Component
public class BoundedDiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(BoundedDiscoveryEngine.class);

    /**
     * @param depthCeiling requests deeper than this are clamped to it, not rejected
     * @param directory    consulted after traversal, only when the query carries attribute filters
     * @throws PersonNotFoundException if the root is not part of the view
     */
    public DiscoveryResult discover(AdjacencyView view, DiscoveryQuery query, int depthCeiling,
                                    PersonDirectory directory) {
        Long rootId = query.rootId();
        if (!view.contains(rootId)) {
            throw new PersonNotFoundException(rootId);
        }

        int effectiveDepth = Math.min(query.maxDepth(), depthCeiling);
        if (query.maxDepth() > depthCeiling) {
            log.warn("Requested depth {} exceeds limit {}, using {}", query.maxDepth(), depthCeiling, effectiveDepth);
        }

        Map<Long, Integer> visited = traverse(view, rootId, effectiveDepth);

        Map<Long, Integer> depths = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> entry : visited.entrySet()) {
            if (entry.getKey().equals(rootId)) {
                continue;
            }
            if (query.depthMode().accepts(entry.getValue(), effectiveDepth)) {
                depths.put(entry.getKey(), entry.getValue());
            }
        }

        if (!query.filters().isEmpty()) {
            depths = applyFilters(depths, query.filters(), directory);
        }

        return new DiscoveryResult(rootId, effectiveDepth, query.depthMode(), depths, visited.size() - 1);
    }

    Map<Long, Integer> traverse(AdjacencyView view, Long rootId, int maxDepth) {
        Map<Long, Integer> visited = new LinkedHashMap<>();
        Deque<Long> queue = new ArrayDeque<>();
        visited.put(rootId, 0);
        queue.add(rootId);

        while (!queue.isEmpty()) {
            Long current = queue.poll();
            int nextDepth = visited.get(current) + 1;
            if (nextDepth > maxDepth) {
                continue;
            }
            for (AdjacencyEntry entry : view.neighbors(current)) {
                if (!visited.containsKey(entry.neighborId())) {
                    visited.put(entry.neighborId(), nextDepth);
                    queue.add(entry.neighborId());
                }
            }
        }

        log.debug("BFS from {} visited {} persons up to depth {}", rootId, visited.size(), maxDepth);
        return visited;
    }

    private Map<Long, Integer> applyFilters(Map<Long, Integer> depths, DiscoveryFilters filters,
                                            PersonDirectory directory) {
        Map<Long, Person> persons = loadPersons(depths.keySet(), directory);
        Map<Long, PersonAddress> addresses = filters.hasAddressFilter()
                ? loadAddresses(persons.keySet(), directory)
                : Map.of();

        Map<Long, Integer> kept = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> entry : depths.entrySet()) {
            Person person = persons.get(entry.getKey());
            if (person == null) {
                log.warn("No person record loaded for {}, excluding from filtered results", entry.getKey());
                continue;
            }
            if (filters.matches(person, addresses.get(entry.getKey()))) {
                kept.put(entry.getKey(), entry.getValue());
            }
        }
        return kept;
    }

    /**
     * One batch query; if it fails, each person is retried alone and those that still fail are left out.
     */
    private Map<Long, Person> loadPersons(Collection<Long> personIds, PersonDirectory directory) {
        try {
            return directory.lookupPersons(personIds);
        } catch (DataAccessException e) {
            log.warn("Batch person lookup for {} persons failed, retrying one by one: {}",
                    personIds.size(), e.getMessage());
        }
        Map<Long, Person> persons = new HashMap<>();
        for (Long personId : personIds) {
            try {
                directory.lookupPerson(personId).ifPresent(person -> persons.put(personId, person));
            } catch (DataAccessException e) {
                log.warn("Could not load person {}: {}", personId, e.getMessage());
            }
        }
        return persons;
    }

    private Map<Long, PersonAddress> loadAddresses(Collection<Long> personIds, PersonDirectory directory) {
        try {
            return directory.lookupCurrentAddresses(personIds);
        } catch (DataAccessException e) {
            log.warn("Batch address lookup for {} persons failed, retrying one by one: {}",
                    personIds.size(), e.getMessage());
        }
        Map<Long, PersonAddress> addresses = new HashMap<>();
        for (Long personId : personIds) {
            try {
                directory.lookupCurrentAddress(personId).ifPresent(address -> addresses.put(personId, address));
            } catch (DataAccessException e) {
                log.warn("Could not load address for person {}: {}", personId, e.getMessage());
            }
        }
        return addresses;
    }
}
