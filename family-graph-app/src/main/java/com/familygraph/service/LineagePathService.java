package com.familygraph.service;

import com.familygraph.config.GraphProperties;
import com.familygraph.graph.AdjacencyView;
import com.familygraph.graph.PathFinder;
import com.familygraph.graph.PathResult;
import com.familygraph.graph.PersonNotFoundException;
import com.familygraph.model.LineagePathResponse;
import com.familygraph.repository.PersonDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class LineagePathService {

    private static final Logger log = LoggerFactory.getLogger(LineagePathService.class);

    private final PersonDirectory personDirectory;
    private final AdjacencyLoader adjacencyLoader;
    private final PathFinder pathFinder;
    private final ResultAssembler resultAssembler;
    private final GraphProperties properties;

    public LineagePathService(PersonDirectory personDirectory,
                              AdjacencyLoader adjacencyLoader,
                              PathFinder pathFinder,
                              ResultAssembler resultAssembler,
                              GraphProperties properties) {
        this.personDirectory = personDirectory;
        this.adjacencyLoader = adjacencyLoader;
        this.pathFinder = pathFinder;
        this.resultAssembler = resultAssembler;
        this.properties = properties;
    }

    /**
     * Find the shortest chain of relationships from person A to person B.
     * Passing the same person twice yields a one-node path that is not a connection.
     *
     * @throws PersonNotFoundException if either person does not exist
     */
    public LineagePathResponse findPath(Long personAId, Long personBId) {
        log.info("Finding lineage path between person_a={} and person_b={}", personAId, personBId);

        for (Long personId : List.of(personAId, personBId)) {
            if (personDirectory.lookupPerson(personId).isEmpty()) {
                log.warn("Person not found: {}", personId);
                throw new PersonNotFoundException(personId);
            }
        }

        int maxPathLength = properties.getLineagePath().getMaxDepth();
        int hops = personAId.equals(personBId) ? 0 : maxPathLength;
        AdjacencyView view = adjacencyLoader.load(personAId, hops, List.of(personAId, personBId));
        PathResult result = pathFinder.findPath(view, personAId, personBId, maxPathLength);

        if (result.connectionFound()) {
            log.info("Connection found via {}, path length={}", result.meetingPersonId(), result.personCount());
        } else if (!result.samePerson()) {
            log.info("No connection found between {} and {} within {} hops", personAId, personBId, maxPathLength);
        }
        return resultAssembler.assemblePath(result, personDirectory);
    }
}
