package com.familygraph.model;

import java.time.LocalDate;
import java.time.Period;

public record Person(
    Long id,
    String firstName,
    String middleNames,
    String lastName,
    Gender gender,
    LocalDate birthDate,
    LocalDate deathDate
) {
    public String fullName() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            sb.append(firstName);
        }
        if (middleNames != null && !middleNames.isBlank()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(middleNames);
        }
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(lastName);
        }
        return sb.length() == 0 ? "Unknown" : sb.toString();
    }

    public boolean isLiving() {
        return deathDate == null;
    }

    public Integer birthYear() {
        return birthDate != null ? birthDate.getYear() : null;
    }

    public Integer deathYear() {
        return deathDate != null ? deathDate.getYear() : null;
    }

    /**
     * Age in whole years: on {@code today} for the living, at death for the deceased.
     * Null when the birth date is unknown.
     */
    public Integer ageOn(LocalDate today) {
        if (birthDate == null) {
            return null;
        }
        LocalDate end = deathDate != null ? deathDate : today;
        if (end.isBefore(birthDate)) {
            return null;
        }
        return Period.between(birthDate, end).getYears();
    }
}
