package com.familygraph.graph;

public class PersonNotFoundException extends GraphQueryException {

    private final Long personId;

    public PersonNotFoundException(Long personId) {
        super("Person not found: " + personId);
        this.personId = personId;
    }

    public Long getPersonId() {
        return personId;
    }
}
