package com.familygraph.model;

/**
 * A person on a lineage path.
 *
 * @param incoming the previous person, with who they are to this person; null on the first node
 * @param outgoing the next person, with who they are to this person; null on the last node
 */
public record PathNode(
    Long personId,
    String firstName,
    String lastName,
    Integer birthYear,
    Integer deathYear,
    String address,
    String religion,
    RelationshipLink incoming,
    RelationshipLink outgoing
) {}
