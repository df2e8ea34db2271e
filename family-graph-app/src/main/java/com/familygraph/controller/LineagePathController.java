package com.familygraph.controller;

import com.familygraph.graph.MalformedEdgeException;
import com.familygraph.graph.PersonNotFoundException;
import com.familygraph.service.LineagePathService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/lineage-path")
public class LineagePathController {

    private static final Logger log = LoggerFactory.getLogger(LineagePathController.class);

    private final LineagePathService lineagePathService;

    public LineagePathController(LineagePathService lineagePathService) {
        this.lineagePathService = lineagePathService;
    }

    /**
     * Find the shortest chain of relationships connecting two people.
     */
    @GetMapping
    public ResponseEntity<?> findPath(
            @RequestParam Long personA,
            @RequestParam Long personB) {
        try {
            return ResponseEntity.ok(lineagePathService.findPath(personA, personB));
        } catch (PersonNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (MalformedEdgeException e) {
            log.error("Relationship data is corrupt", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "An error occurred while finding the lineage path"));
        }
    }
}
