package com.familygraph.graph;

import java.util.List;

/**
 * Outcome of a path query. A same-person query yields a single step flagged {@code samePerson}
 * and is not a connection; "no connection" has no steps.
 */
public record PathResult(
    Long personAId,
    Long personBId,
    boolean connectionFound,
    boolean samePerson,
    Long meetingPersonId,
    List<PathStep> steps,
    int maxPathLength
) {
    public PathResult {
        steps = List.copyOf(steps);
    }

    static PathResult found(Long personAId, Long personBId, Long meetingPersonId, List<PathStep> steps,
                            int maxPathLength) {
        return new PathResult(personAId, personBId, true, false, meetingPersonId, steps, maxPathLength);
    }

    static PathResult samePerson(Long personId, int maxPathLength) {
        return new PathResult(personId, personId, false, true, null,
                List.of(new PathStep(personId, null, null)), maxPathLength);
    }

    static PathResult noConnection(Long personAId, Long personBId, int maxPathLength) {
        return new PathResult(personAId, personBId, false, false, null, List.of(), maxPathLength);
    }

    public int personCount() {
        return steps.size();
    }

    public int hopCount() {
        return steps.isEmpty() ? 0 : steps.size() - 1;
    }
}
