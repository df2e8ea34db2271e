package com.familygraph.repository;

import com.familygraph.model.Gender;
import com.familygraph.model.Person;
import com.familygraph.model.PersonAddress;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only person data consumed by the graph queries for labelling, filtering and display.
 */
public interface PersonDirectory {

    Optional<Person> lookupPerson(Long personId);

    /**
     * Persons for the given ids in as few queries as possible. Ids without a person are left out.
     */
    Map<Long, Person> lookupPersons(Collection<Long> personIds);

    /**
     * Genders for the given ids in one call. Ids without a person are left out.
     */
    Map<Long, Gender> lookupGenders(Collection<Long> personIds);

    Optional<PersonAddress> lookupCurrentAddress(Long personId);

    /**
     * Current addresses for the given ids. Persons without a current address are left out.
     */
    Map<Long, PersonAddress> lookupCurrentAddresses(Collection<Long> personIds);

    /**
     * "Religion, Category, Sub-category", or empty when the person has no religion record.
     */
    Optional<String> lookupReligionSummary(Long personId);
}
