package com.familygraph.model;

/**
 * One relative in a discovery response. Display fields are null when the person's
 * record or address could not be loaded.
 */
public record RelativeInfo(
    Long personId,
    int depth,
    String firstName,
    String lastName,
    String fullName,
    String gender,
    Integer birthYear,
    Integer deathYear,
    Boolean living,
    Integer age,
    String districtName,
    String localityName,
    String location
) {}
