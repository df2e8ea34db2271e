package com.familygraph.controller;

import com.familygraph.graph.InvalidDepthModeException;
import com.familygraph.graph.InvalidFilterException;
import com.familygraph.graph.MalformedEdgeException;
import com.familygraph.graph.PersonNotFoundException;
import com.familygraph.model.DiscoveryRequest;
import com.familygraph.service.RelativesNetworkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/relatives-network")
public class RelativesNetworkController {

    private static final Logger log = LoggerFactory.getLogger(RelativesNetworkController.class);

    private final RelativesNetworkService relativesNetworkService;

    public RelativesNetworkController(RelativesNetworkService relativesNetworkService) {
        this.relativesNetworkService = relativesNetworkService;
    }

    /**
     * Find relatives of a person within a number of relationship hops, filtered by
     * living status, gender and address.
     */
    @PostMapping("/find")
    public ResponseEntity<?> findRelatives(@RequestBody DiscoveryRequest request) {
        try {
            return ResponseEntity.ok(relativesNetworkService.findRelatives(request));
        } catch (PersonNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidDepthModeException | InvalidFilterException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MalformedEdgeException e) {
            log.error("Relationship data is corrupt", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "An error occurred while finding relatives"));
        }
    }
}
