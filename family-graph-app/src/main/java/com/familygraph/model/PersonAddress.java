package com.familygraph.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A person's current address: the ids of each administrative level plus their display names.
 * Any level below country may be missing.
 */
public record PersonAddress(
    Long personId,
    Long countryId,
    Long stateId,
    Long districtId,
    Long subDistrictId,
    Long localityId,
    String countryName,
    String stateName,
    String districtName,
    String subDistrictName,
    String localityName
) {
    /**
     * Comma separated names from locality up to country, e.g. "Rampur, Sadar, Agra, Uttar Pradesh, India".
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        for (String name : new String[] {localityName, subDistrictName, districtName, stateName, countryName}) {
            if (name != null && !name.isBlank()) {
                parts.add(name);
            }
        }
        return String.join(", ", parts);
    }
}
