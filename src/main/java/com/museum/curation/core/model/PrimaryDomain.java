package com.museum.curation.core.model;

import java.util.Optional;

/**
 * Domain classification of a museum.
 */
public enum PrimaryDomain {
    ART("Art"),
    HISTORY("History"),
    SCIENCE("Science"),
    CULTURE("Culture"),
    SPECIALTY("Specialty"),
    MIXED("Mixed");

    private final String label;

    PrimaryDomain(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a stored value (label or enum name, case-insensitive).
     */
    public static Optional<PrimaryDomain> fromValue(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof PrimaryDomain domain) {
            return Optional.of(domain);
        }
        String text = value.toString().trim();
        for (PrimaryDomain domain : values()) {
            if (domain.label.equalsIgnoreCase(text) || domain.name().equalsIgnoreCase(text)) {
                return Optional.of(domain);
            }
        }
        return Optional.empty();
    }
}
