package com.familygraph.graph;

import com.familygraph.model.Gender;
import com.familygraph.model.Person;
import com.familygraph.model.PersonAddress;

import java.util.Locale;
import java.util.Objects;

/**
 * Attribute filters applied to the depth-filtered result set. They never influence traversal.
 *
 * Address levels match exactly and only when given: setting {@code districtId} alone ignores
 * sub-district and locality. A person without a current address fails any address filter.
 */
public record DiscoveryFilters(
    boolean livingOnly,
    Gender gender,
    Long countryId,
    Long stateId,
    Long districtId,
    Long subDistrictId,
    Long localityId
) {
    public DiscoveryFilters {
        requirePositive("countryId", countryId);
        requirePositive("stateId", stateId);
        requirePositive("districtId", districtId);
        requirePositive("subDistrictId", subDistrictId);
        requirePositive("localityId", localityId);
    }

    public static DiscoveryFilters none() {
        return new DiscoveryFilters(false, null, null, null, null, null, null);
    }

    /**
     * Strict gender parse for request input: M, F, U, MALE, FEMALE or UNKNOWN. Null or blank means no filter.
     */
    public static Gender parseGender(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "M", "MALE" -> Gender.MALE;
            case "F", "FEMALE" -> Gender.FEMALE;
            case "U", "UNKNOWN" -> Gender.UNKNOWN;
            default -> throw new InvalidFilterException("Unknown gender filter '" + code + "'");
        };
    }

    public boolean hasAddressFilter() {
        return countryId != null || stateId != null || districtId != null
                || subDistrictId != null || localityId != null;
    }

    public boolean isEmpty() {
        return !livingOnly && gender == null && !hasAddressFilter();
    }

    public boolean matches(Person person, PersonAddress address) {
        if (livingOnly && !person.isLiving()) {
            return false;
        }
        if (gender != null && person.gender() != gender) {
            return false;
        }
        return matchesAddress(address);
    }

    private boolean matchesAddress(PersonAddress address) {
        if (!hasAddressFilter()) {
            return true;
        }
        if (address == null) {
            return false;
        }
        return levelMatches(countryId, address.countryId())
                && levelMatches(stateId, address.stateId())
                && levelMatches(districtId, address.districtId())
                && levelMatches(subDistrictId, address.subDistrictId())
                && levelMatches(localityId, address.localityId());
    }

    private static boolean levelMatches(Long wanted, Long actual) {
        return wanted == null || Objects.equals(wanted, actual);
    }

    private static void requirePositive(String name, Long id) {
        if (id != null && id <= 0) {
            throw new InvalidFilterException(name + " must be a positive id, got " + id);
        }
    }
}
