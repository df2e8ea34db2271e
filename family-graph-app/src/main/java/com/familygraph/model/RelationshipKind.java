package com.familygraph.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Relationship labels. The first seven are the kinds that may be stored on an edge;
 * PARENT and CHILD only appear as derived inverse labels when a gender is unknown.
 * Declaration order is the tie-break order inside an adjacency list, so specific labels
 * sort ahead of the generic ones.
 */
public enum RelationshipKind {
    FATHER("rel-6a0ede824d101", "Father", true),
    MOTHER("rel-6a0ede824d102", "Mother", true),
    DAUGHTER("rel-6a0ede824d103", "Daughter", true),
    SON("rel-6a0ede824d104", "Son", true),
    WIFE("rel-6a0ede824d105", "Wife", true),
    HUSBAND("rel-6a0ede824d106", "Husband", true),
    SPOUSE("rel-6a0ede824d107", "Spouse", true),
    PARENT(null, "Parent", false),
    CHILD(null, "Child", false);

    private final String storedId;
    private final String label;
    private final boolean storable;

    RelationshipKind(String storedId, String label, boolean storable) {
        this.storedId = storedId;
        this.label = label;
        this.storable = storable;
    }

    public String storedId() {
        return storedId;
    }

    public String label() {
        return label;
    }

    public boolean isStorable() {
        return storable;
    }

    /**
     * Resolve a stored code: the "rel-..." identifier, the enum name or the label, case-insensitive.
     * Derived-only labels never resolve.
     */
    public static Optional<RelationshipKind> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (RelationshipKind kind : values()) {
            if (!kind.storable) {
                continue;
            }
            if (normalized.equals(kind.storedId) || normalized.equals(kind.label.toLowerCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Label for the reverse direction of an edge: given "B is A's {this}", who A is to B.
     * Parent/child inverses take A's own gender; spouse kinds all invert to SPOUSE.
     */
    public RelationshipKind inverse(Gender sourceGender) {
        return switch (this) {
            case FATHER, MOTHER -> switch (sourceGender) {
                case MALE -> SON;
                case FEMALE -> DAUGHTER;
                default -> CHILD;
            };
            case SON, DAUGHTER -> switch (sourceGender) {
                case MALE -> FATHER;
                case FEMALE -> MOTHER;
                default -> PARENT;
            };
            case WIFE, HUSBAND, SPOUSE -> SPOUSE;
            case PARENT -> CHILD;
            case CHILD -> PARENT;
        };
    }
}
