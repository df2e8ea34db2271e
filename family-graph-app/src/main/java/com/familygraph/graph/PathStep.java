package com.familygraph.graph;

import com.familygraph.model.RelationshipKind;

/**
 * A person on a connecting path. {@code incomingKind} says who this person is to the previous
 * one on the path; {@code previousKind} says who the previous person is to this one. Both are
 * null for the first person.
 */
public record PathStep(Long personId, RelationshipKind incomingKind, RelationshipKind previousKind) {}
