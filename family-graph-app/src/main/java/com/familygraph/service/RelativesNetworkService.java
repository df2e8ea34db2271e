package com.familygraph.service;

import com.familygraph.config.GraphProperties;
import com.familygraph.graph.AdjacencyView;
import com.familygraph.graph.BoundedDiscoveryEngine;
import com.familygraph.graph.DepthMode;
import com.familygraph.graph.DiscoveryFilters;
import com.familygraph.graph.DiscoveryQuery;
import com.familygraph.graph.DiscoveryResult;
import com.familygraph.graph.InvalidFilterException;
import com.familygraph.graph.PersonNotFoundException;
import com.familygraph.model.DiscoveryRequest;
import com.familygraph.model.RelativesNetworkResponse;
import com.familygraph.repository.PersonDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RelativesNetworkService {

    private static final Logger log = LoggerFactory.getLogger(RelativesNetworkService.class);

    private final PersonDirectory personDirectory;
    private final AdjacencyLoader adjacencyLoader;
    private final BoundedDiscoveryEngine discoveryEngine;
    private final ResultAssembler resultAssembler;
    private final GraphProperties properties;

    public RelativesNetworkService(PersonDirectory personDirectory,
                                   AdjacencyLoader adjacencyLoader,
                                   BoundedDiscoveryEngine discoveryEngine,
                                   ResultAssembler resultAssembler,
                                   GraphProperties properties) {
        this.personDirectory = personDirectory;
        this.adjacencyLoader = adjacencyLoader;
        this.discoveryEngine = discoveryEngine;
        this.resultAssembler = resultAssembler;
        this.properties = properties;
    }

    /**
     * Find relatives of a person up to, or exactly at, a number of relationship hops.
     *
     * @param request the search; unset values fall back to the configured default depth, "up_to" and living only
     * @return relatives ordered closest first, capped at the configured maximum
     * @throws PersonNotFoundException if the person does not exist
     * @throws com.familygraph.graph.InvalidDepthModeException if the depth mode is not "up_to" or "only_at"
     * @throws InvalidFilterException if the depth or a filter value is invalid
     */
    public RelativesNetworkResponse findRelatives(DiscoveryRequest request) {
        if (request.personId() == null) {
            throw new InvalidFilterException("personId is required");
        }
        GraphProperties.Relatives limits = properties.getRelatives();
        int depth = request.depth() != null ? request.depth() : limits.getDefaultDepth();
        DepthMode depthMode = DepthMode.fromValue(request.depthMode() != null ? request.depthMode() : "up_to");

        log.info("Finding relatives for person={}, depth={}, depthMode={}",
                request.personId(), depth, depthMode.value());

        DiscoveryFilters filters = new DiscoveryFilters(
                request.livingOnly() == null || request.livingOnly(),
                DiscoveryFilters.parseGender(request.gender()),
                request.countryId(),
                request.stateId(),
                request.districtId(),
                request.subDistrictId(),
                request.localityId()
        );
        DiscoveryQuery query = new DiscoveryQuery(request.personId(), depth, depthMode, filters);

        if (personDirectory.lookupPerson(request.personId()).isEmpty()) {
            log.warn("Person not found: {}", request.personId());
            throw new PersonNotFoundException(request.personId());
        }

        int loadDepth = Math.min(depth, limits.getMaxDepth());
        AdjacencyView view = adjacencyLoader.load(request.personId(), loadDepth, List.of(request.personId()));
        DiscoveryResult result = discoveryEngine.discover(view, query, limits.getMaxDepth(), personDirectory);
        RelativesNetworkResponse response = resultAssembler.assembleRelatives(result, personDirectory, limits.getMaxResults());

        log.info("Found {} relatives for person {} ({} reached before filters)",
                response.totalCount(), request.personId(), result.reachedCount());
        return response;
    }
}
