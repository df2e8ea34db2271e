package com.familygraph.service;

import com.familygraph.graph.DepthMode;
import com.familygraph.graph.DiscoveryResult;
import com.familygraph.graph.InMemoryPersonDirectory;
import com.familygraph.graph.PathResult;
import com.familygraph.graph.PathStep;
import com.familygraph.model.Gender;
import com.familygraph.model.LineagePathResponse;
import com.familygraph.model.PathNode;
import com.familygraph.model.Person;
import com.familygraph.model.PersonAddress;
import com.familygraph.model.RelationshipKind;
import com.familygraph.model.RelationshipLink;
import com.familygraph.model.RelativeInfo;
import com.familygraph.model.RelativesNetworkResponse;
import com.familygraph.repository.PersonDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataRetrievalFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResultAssemblerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-06-01T00:00:00Z"), ZoneOffset.UTC);

    private ResultAssembler assembler;
    private InMemoryPersonDirectory directory;

    @BeforeEach
    void setUp() {
        assembler = new ResultAssembler(FIXED);
        directory = new InMemoryPersonDirectory();
    }

    private static Person person(long id, String firstName, String lastName, Gender gender,
                                 LocalDate birthDate, LocalDate deathDate) {
        return new Person(id, firstName, null, lastName, gender, birthDate, deathDate);
    }

    private static DiscoveryResult result(Map<Long, Integer> depths) {
        return new DiscoveryResult(1L, 3, DepthMode.UP_TO, depths, depths.size());
    }

    @Nested
    @DisplayName("assembleRelatives")
    class AssembleRelatives {

        @Test
        void sortsByDepthThenNameThenId() {
            directory.add(person(5, "zoya", "Khan", Gender.FEMALE, null, null));
            directory.add(person(6, "Aman", "Khan", Gender.MALE, null, null));
            directory.add(person(7, "Aman", "Khan", Gender.MALE, null, null));
            directory.add(person(8, "Bina", "Khan", Gender.FEMALE, null, null));
            Map<Long, Integer> depths = new LinkedHashMap<>();
            depths.put(8L, 2);
            depths.put(7L, 1);
            depths.put(5L, 1);
            depths.put(6L, 1);

            RelativesNetworkResponse response = assembler.assembleRelatives(result(depths), directory, 100);

            assertThat(response.relatives()).extracting(RelativeInfo::personId).containsExactly(6L, 7L, 5L, 8L);
            assertThat(response.totalCount()).isEqualTo(4);
            assertThat(response.matchedCount()).isEqualTo(4);
            assertThat(response.truncated()).isFalse();
            assertThat(response.depthMode()).isEqualTo("up_to");
        }

        @Test
        void capsAfterSortingSoClosestAreKept() {
            Map<Long, Integer> depths = new LinkedHashMap<>();
            for (long id = 1; id <= 100; id++) {
                depths.put(id, 2);
                directory.add(person(id, String.format("P%03d", 1000 - id), "Far", Gender.MALE, null, null));
            }
            for (long id = 101; id <= 150; id++) {
                depths.put(id, 1);
                directory.add(person(id, String.format("P%03d", 1000 - id), "Near", Gender.MALE, null, null));
            }

            RelativesNetworkResponse response = assembler.assembleRelatives(result(depths), directory, 100);

            assertThat(response.relatives()).hasSize(100);
            assertThat(response.totalCount()).isEqualTo(100);
            assertThat(response.matchedCount()).isEqualTo(150);
            assertThat(response.truncated()).isTrue();
            assertThat(response.relatives().subList(0, 50))
                    .allSatisfy(relative -> assertThat(relative.depth()).isEqualTo(1));
            assertThat(response.relatives().subList(50, 100))
                    .extracting(RelativeInfo::personId)
                    .containsExactlyInAnyOrderElementsOf(
                            LongStream.rangeClosed(51, 100).boxed().toList());
            assertThat(response.relatives().get(50).personId()).isEqualTo(100L);
        }

        @Test
        void fillsDisplayFields() {
            directory.add(person(2, "Kamla", "Sharma", Gender.FEMALE, LocalDate.of(1950, 8, 15), null));
            directory.add(person(3, "Ramesh", "Sharma", Gender.MALE, LocalDate.of(1940, 3, 1), LocalDate.of(2010, 1, 20)));
            directory.addAddress(new PersonAddress(2L, 1L, 2L, 3L, 4L, 5L,
                    "India", "Uttar Pradesh", "Agra", "Sadar", "Civil Lines"));

            RelativesNetworkResponse response = assembler.assembleRelatives(
                    result(Map.of(2L, 1, 3L, 1)), directory, 100);

            RelativeInfo kamla = response.relatives().get(0);
            assertThat(kamla.fullName()).isEqualTo("Kamla Sharma");
            assertThat(kamla.gender()).isEqualTo("F");
            assertThat(kamla.living()).isTrue();
            assertThat(kamla.age()).isEqualTo(75);
            assertThat(kamla.districtName()).isEqualTo("Agra");
            assertThat(kamla.localityName()).isEqualTo("Civil Lines");
            assertThat(kamla.location()).isEqualTo("Civil Lines, Sadar, Agra, Uttar Pradesh, India");

            RelativeInfo ramesh = response.relatives().get(1);
            assertThat(ramesh.living()).isFalse();
            assertThat(ramesh.deathYear()).isEqualTo(2010);
            assertThat(ramesh.age()).isEqualTo(69);
            assertThat(ramesh.location()).isNull();
        }

        @Test
        void keepsRelativeWhenLookupsFail() {
            PersonDirectory failing = mock(PersonDirectory.class);
            when(failing.lookupPersons(anyCollection())).thenThrow(new DataRetrievalFailureException("bad row"));
            when(failing.lookupPerson(4L)).thenReturn(Optional.of(person(4, "Asha", "Rao", Gender.FEMALE, null, null)));
            when(failing.lookupPerson(5L)).thenThrow(new DataRetrievalFailureException("connection reset"));
            when(failing.lookupCurrentAddress(4L)).thenThrow(new DataRetrievalFailureException("connection reset"));
            when(failing.lookupCurrentAddress(5L)).thenReturn(Optional.empty());

            RelativesNetworkResponse response = assembler.assembleRelatives(
                    result(Map.of(4L, 1, 5L, 1)), failing, 100);

            assertThat(response.relatives()).extracting(RelativeInfo::personId).containsExactly(4L, 5L);
            assertThat(response.relatives().get(0).fullName()).isEqualTo("Asha Rao");
            assertThat(response.relatives().get(0).location()).isNull();
            assertThat(response.relatives().get(1).fullName()).isNull();
            assertThat(response.relatives().get(1).living()).isNull();
            assertThat(response.relatives().get(1).depth()).isEqualTo(1);
        }

        @Test
        void loadsPersonsInOneBatchAndAddressesOnlyForKeptRelatives() {
            PersonDirectory counting = mock(PersonDirectory.class);
            Map<Long, Integer> depths = new LinkedHashMap<>();
            Map<Long, Person> persons = new HashMap<>();
            for (long id = 1; id <= 150; id++) {
                depths.put(id, id <= 100 ? 1 : 2);
                persons.put(id, person(id, String.format("P%03d", id), "Test", Gender.MALE, null, null));
            }
            when(counting.lookupPersons(anyCollection())).thenReturn(persons);
            when(counting.lookupCurrentAddress(anyLong())).thenReturn(Optional.empty());

            RelativesNetworkResponse response = assembler.assembleRelatives(result(depths), counting, 100);

            assertThat(response.relatives()).extracting(RelativeInfo::personId)
                    .containsExactlyElementsOf(LongStream.rangeClosed(1, 100).boxed().toList());
            verify(counting, times(1)).lookupPersons(anyCollection());
            verify(counting, never()).lookupPerson(anyLong());
            verify(counting, times(100)).lookupCurrentAddress(anyLong());
            verify(counting, never()).lookupCurrentAddress(101L);
        }

        @Test
        void emptyResult() {
            RelativesNetworkResponse response = assembler.assembleRelatives(result(Map.of()), directory, 100);

            assertThat(response.relatives()).isEmpty();
            assertThat(response.totalCount()).isZero();
            assertThat(response.truncated()).isFalse();
        }
    }

    @Nested
    @DisplayName("assemblePath")
    class AssemblePath {

        @Test
        void linksEachNodeToItsNeighbours() {
            directory.add(person(1, "Root", "Test", Gender.MALE, LocalDate.of(1930, 1, 1), LocalDate.of(1990, 1, 1)));
            directory.add(person(2, "Cone", "Test", Gender.MALE, null, null));
            directory.add(person(4, "Gcone", "Test", Gender.MALE, null, null));
            directory.addReligion(1L, "Hindu, Vaishnav");
            PathResult path = new PathResult(1L, 4L, true, false, 2L, List.of(
                    new PathStep(1L, null, null),
                    new PathStep(2L, RelationshipKind.SON, RelationshipKind.FATHER),
                    new PathStep(4L, RelationshipKind.SON, RelationshipKind.FATHER)), 20);

            LineagePathResponse response = assembler.assemblePath(path, directory);

            assertThat(response.connectionFound()).isTrue();
            assertThat(response.message()).isEqualTo("Connection found");
            assertThat(response.commonPersonId()).isEqualTo(2L);
            assertThat(response.personCount()).isEqualTo(3);

            PathNode first = response.path().get(0);
            assertThat(first.incoming()).isNull();
            assertThat(first.outgoing()).isEqualTo(new RelationshipLink(2L, RelationshipKind.SON, "Son"));
            assertThat(first.religion()).isEqualTo("Hindu, Vaishnav");
            assertThat(first.deathYear()).isEqualTo(1990);

            PathNode middle = response.path().get(1);
            // Root is Cone's father, Gcone is Cone's son
            assertThat(middle.incoming()).isEqualTo(new RelationshipLink(1L, RelationshipKind.FATHER, "Father"));
            assertThat(middle.outgoing()).isEqualTo(new RelationshipLink(4L, RelationshipKind.SON, "Son"));
            assertThat(middle.religion()).isEmpty();
            assertThat(middle.address()).isEmpty();

            PathNode last = response.path().get(2);
            assertThat(last.outgoing()).isNull();
            assertThat(last.firstName()).isEqualTo("Gcone");
        }

        @Test
        void describesSamePerson() {
            directory.add(person(1, "Root", "Test", Gender.MALE, null, null));
            PathResult path = new PathResult(1L, 1L, false, true, null, List.of(new PathStep(1L, null, null)), 20);

            LineagePathResponse response = assembler.assemblePath(path, directory);

            assertThat(response.samePerson()).isTrue();
            assertThat(response.connectionFound()).isFalse();
            assertThat(response.message()).isEqualTo("Same person provided for both inputs");
            assertThat(response.path()).singleElement()
                    .satisfies(node -> {
                        assertThat(node.incoming()).isNull();
                        assertThat(node.outgoing()).isNull();
                    });
        }

        @Test
        void describesMissingConnectionWithLimit() {
            PathResult path = new PathResult(1L, 9L, false, false, null, List.of(), 20);

            LineagePathResponse response = assembler.assemblePath(path, directory);

            assertThat(response.message()).isEqualTo("No relation found up to 20 connections");
            assertThat(response.path()).isEmpty();
            assertThat(response.personCount()).isZero();
        }

        @Test
        void leavesReligionNullWhenLookupFails() {
            PersonDirectory failing = mock(PersonDirectory.class);
            when(failing.lookupPerson(1L)).thenReturn(Optional.of(person(1, "Root", "Test", Gender.MALE, null, null)));
            when(failing.lookupCurrentAddress(1L)).thenReturn(Optional.empty());
            when(failing.lookupReligionSummary(1L)).thenThrow(new DataRetrievalFailureException("timeout"));
            PathResult path = new PathResult(1L, 1L, false, true, null, List.of(new PathStep(1L, null, null)), 20);

            PathNode node = assembler.assemblePath(path, failing).path().get(0);

            assertThat(node.firstName()).isEqualTo("Root");
            assertThat(node.religion()).isNull();
        }
    }
}
