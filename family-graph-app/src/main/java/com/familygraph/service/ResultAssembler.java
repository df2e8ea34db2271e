package com.familygraph.service;

import com.familygraph.graph.DiscoveryResult;
import com.familygraph.graph.PathResult;
import com.familygraph.graph.PathStep;
import com.familygraph.model.LineagePathResponse;
import com.familygraph.model.PathNode;
import com.familygraph.model.Person;
import com.familygraph.model.PersonAddress;
import com.familygraph.model.RelationshipLink;
import com.familygraph.model.RelativeInfo;
import com.familygraph.model.RelativesNetworkResponse;
import com.familygraph.repository.PersonDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw engine output into client responses: orders and caps relatives, and attaches display
 * fields from the {@link PersonDirectory}.
 *
 * A lookup that fails for one person never fails the query. That person stays in the result with
 * the affected fields left null.
 */
@Component
public class ResultAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResultAssembler.class);

    private static final Comparator<Candidate> CLOSEST_FIRST = Comparator
            .comparingInt(Candidate::depth)
            .thenComparing(Candidate::sortName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(Candidate::personId);

    private final Clock clock;

    public ResultAssembler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Sort by depth, then full name, then id, and keep the first {@code maxResults}.
     * Sorting happens before the cap so the closest relatives are the ones kept.
     */
    public RelativesNetworkResponse assembleRelatives(DiscoveryResult result, PersonDirectory directory,
                                                      int maxResults) {
        Map<Long, Person> persons = lookupPersons(directory, result.personIds());
        List<Candidate> candidates = new ArrayList<>(result.size());
        for (Map.Entry<Long, Integer> entry : result.depths().entrySet()) {
            candidates.add(new Candidate(entry.getKey(), entry.getValue(), persons.get(entry.getKey())));
        }
        candidates.sort(CLOSEST_FIRST);

        int matched = candidates.size();
        if (matched > maxResults) {
            log.info("Limiting results from {} to {}", matched, maxResults);
            candidates = candidates.subList(0, maxResults);
        }

        LocalDate today = LocalDate.now(clock);
        List<RelativeInfo> relatives = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            relatives.add(toRelativeInfo(candidate, safeLookupAddress(directory, candidate.personId()), today));
        }

        return new RelativesNetworkResponse(
                result.rootId(),
                result.effectiveDepth(),
                result.depthMode().value(),
                relatives.size(),
                matched,
                matched > relatives.size(),
                relatives
        );
    }

    public LineagePathResponse assemblePath(PathResult result, PersonDirectory directory) {
        List<PathStep> steps = result.steps();
        List<PathNode> path = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            PathStep step = steps.get(i);
            RelationshipLink incoming = i > 0
                    ? RelationshipLink.of(steps.get(i - 1).personId(), step.previousKind())
                    : null;
            RelationshipLink outgoing = i < steps.size() - 1
                    ? RelationshipLink.of(steps.get(i + 1).personId(), steps.get(i + 1).incomingKind())
                    : null;
            path.add(toPathNode(step.personId(), directory, incoming, outgoing));
        }

        return new LineagePathResponse(
                result.connectionFound(),
                result.samePerson(),
                messageFor(result),
                result.meetingPersonId(),
                path.size(),
                path
        );
    }

    private String messageFor(PathResult result) {
        if (result.samePerson()) {
            return "Same person provided for both inputs";
        }
        if (result.connectionFound()) {
            return "Connection found";
        }
        return "No relation found up to " + result.maxPathLength() + " connections";
    }

    private RelativeInfo toRelativeInfo(Candidate candidate, PersonAddress address, LocalDate today) {
        Person person = candidate.person();
        return new RelativeInfo(
                candidate.personId(),
                candidate.depth(),
                person != null ? person.firstName() : null,
                person != null ? person.lastName() : null,
                person != null ? person.fullName() : null,
                person != null ? person.gender().code() : null,
                person != null ? person.birthYear() : null,
                person != null ? person.deathYear() : null,
                person != null ? person.isLiving() : null,
                person != null ? person.ageOn(today) : null,
                address != null ? address.districtName() : null,
                address != null ? address.localityName() : null,
                address != null ? address.summary() : null
        );
    }

    private PathNode toPathNode(Long personId, PersonDirectory directory,
                                RelationshipLink incoming, RelationshipLink outgoing) {
        Person person = safeLookupPerson(directory, personId);
        PersonAddress address = safeLookupAddress(directory, personId);
        String religion = null;
        try {
            religion = directory.lookupReligionSummary(personId).orElse("");
        } catch (DataAccessException e) {
            log.warn("Could not load religion for person {}: {}", personId, e.getMessage());
        }
        return new PathNode(
                personId,
                person != null ? person.firstName() : null,
                person != null ? person.lastName() : null,
                person != null ? person.birthYear() : null,
                person != null ? person.deathYear() : null,
                address != null ? address.summary() : "",
                religion,
                incoming,
                outgoing
        );
    }

    /**
     * Batch lookup for the whole result set. If the batch fails, falls back to one lookup per
     * person so a single bad row only blanks that relative.
     */
    private Map<Long, Person> lookupPersons(PersonDirectory directory, Collection<Long> personIds) {
        if (personIds.isEmpty()) {
            return Map.of();
        }
        try {
            Map<Long, Person> persons = directory.lookupPersons(personIds);
            if (persons.size() < personIds.size()) {
                log.warn("{} persons are linked in the graph but have no record", personIds.size() - persons.size());
            }
            return persons;
        } catch (DataAccessException e) {
            log.warn("Batch person lookup for {} persons failed, retrying one by one: {}",
                    personIds.size(), e.getMessage());
        }
        Map<Long, Person> persons = new HashMap<>();
        for (Long personId : personIds) {
            Person person = safeLookupPerson(directory, personId);
            if (person != null) {
                persons.put(personId, person);
            }
        }
        return persons;
    }

    private Person safeLookupPerson(PersonDirectory directory, Long personId) {
        try {
            Optional<Person> person = directory.lookupPerson(personId);
            if (person.isEmpty()) {
                log.warn("Person {} is linked in the graph but has no record", personId);
            }
            return person.orElse(null);
        } catch (DataAccessException e) {
            log.warn("Could not load person {}: {}", personId, e.getMessage());
            return null;
        }
    }

    private PersonAddress safeLookupAddress(PersonDirectory directory, Long personId) {
        try {
            return directory.lookupCurrentAddress(personId).orElse(null);
        } catch (DataAccessException e) {
            log.warn("Could not load address for person {}: {}", personId, e.getMessage());
            return null;
        }
    }

    private record Candidate(Long personId, int depth, Person person) {
        String sortName() {
            return person != null ? person.fullName() : null;
        }
    }
}
