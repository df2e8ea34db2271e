package com.familygraph.model;

/**
 * Relatives search request as received from clients. Missing values take the service defaults:
 * configured default depth, "up_to", living only.
 */
public record DiscoveryRequest(
    Long personId,
    Integer depth,
    String depthMode,
    Boolean livingOnly,
    String gender,
    Long countryId,
    Long stateId,
    Long districtId,
    Long subDistrictId,
    Long localityId
) {}
