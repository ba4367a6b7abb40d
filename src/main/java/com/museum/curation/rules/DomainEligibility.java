package com.museum.curation.rules;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.PrimaryDomain;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of domain-conditional fields and the domain that makes them valid.
 * A conditional field is eligible only when the record's domain equals
 * {@link #requiredDomain()}; every other field is always eligible.
 *
 * @param conditionalFields fields restricted to the required domain
 * @param requiredDomain    the only domain for which those fields are valid
 */
public record DomainEligibility(Set<String> conditionalFields, PrimaryDomain requiredDomain) {

    public static final String INELIGIBLE_DOMAIN = "ineligible_domain";

    public DomainEligibility {
        Objects.requireNonNull(requiredDomain, "requiredDomain is required");
        conditionalFields = conditionalFields != null ? Set.copyOf(conditionalFields) : Set.of();
    }

    /**
     * Scoring fields are valid only for art museums.
     */
    public static DomainEligibility defaults() {
        return new DomainEligibility(MuseumFields.SCORING_FIELDS, PrimaryDomain.ART);
    }

    public boolean isConditional(String fieldName) {
        return conditionalFields.contains(fieldName);
    }

    /**
     * Evaluates eligibility of a field for a record whose domain may be unknown.
     */
    public boolean isEligible(String fieldName, Optional<PrimaryDomain> domain) {
        if (!isConditional(fieldName)) {
            return true;
        }
        return domain.map(d -> d == requiredDomain).orElse(false);
    }

    public boolean isEligibleDomain(Optional<PrimaryDomain> domain) {
        return domain.map(d -> d == requiredDomain).orElse(false);
    }
}
