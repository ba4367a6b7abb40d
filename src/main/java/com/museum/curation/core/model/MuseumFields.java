package com.museum.curation.core.model;

import java.util.Set;

/**
 * Field names of the museum record schema.
 * {@link #CANDIDATE_FIELDS} is the closed set of fields that sources may propose;
 * {@link #DERIVED_FIELDS} are computed by deterministic stages and carry no provenance.
 */
public final class MuseumFields {

    public static final String MUSEUM_ID = "museum_id";
    public static final String MUSEUM_NAME = "museum_name";
    public static final String CITY = "city";
    public static final String STATE_PROVINCE = "state_province";
    public static final String STREET_ADDRESS = "street_address";
    public static final String POSTAL_CODE = "postal_code";
    public static final String WEBSITE = "website";
    public static final String PHONE = "phone";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String PRIMARY_DOMAIN = "primary_domain";
    public static final String MUSEUM_TYPE = "museum_type";
    public static final String AUDIENCE_FOCUS = "audience_focus";
    public static final String CITY_TIER = "city_tier";
    public static final String REPUTATION = "reputation";
    public static final String COLLECTION_TIER = "collection_tier";
    public static final String TIME_NEEDED = "time_needed";
    public static final String IMPRESSIONIST_STRENGTH = "impressionist_strength";
    public static final String MODERN_CONTEMPORARY_STRENGTH = "modern_contemporary_strength";
    public static final String HISTORICAL_CONTEXT_SCORE = "historical_context_score";
    public static final String NOTES = "notes";

    public static final String NEARBY_MUSEUM_COUNT = "nearby_museum_count";
    public static final String PRIORITY_SCORE = "priority_score";
    public static final String OVERALL_QUALITY_SCORE = "overall_quality_score";
    public static final String PRIMARY_ART = "primary_art";
    public static final String SCORING_VERSION = "scoring_version";

    public static final Set<String> SCORING_FIELDS = Set.of(
            IMPRESSIONIST_STRENGTH,
            MODERN_CONTEMPORARY_STRENGTH,
            HISTORICAL_CONTEXT_SCORE
    );

    public static final Set<String> HIGH_CHURN_FIELDS = Set.of(
            REPUTATION,
            COLLECTION_TIER,
            TIME_NEEDED,
            CITY_TIER,
            IMPRESSIONIST_STRENGTH,
            MODERN_CONTEMPORARY_STRENGTH,
            HISTORICAL_CONTEXT_SCORE
    );

    public static final Set<String> CANDIDATE_FIELDS = Set.of(
            MUSEUM_NAME, CITY, STATE_PROVINCE, STREET_ADDRESS, POSTAL_CODE, WEBSITE, PHONE,
            LATITUDE, LONGITUDE, PRIMARY_DOMAIN, MUSEUM_TYPE, AUDIENCE_FOCUS,
            CITY_TIER, REPUTATION, COLLECTION_TIER, TIME_NEEDED,
            IMPRESSIONIST_STRENGTH, MODERN_CONTEMPORARY_STRENGTH, HISTORICAL_CONTEXT_SCORE,
            NOTES
    );

    public static final Set<String> DERIVED_FIELDS = Set.of(
            NEARBY_MUSEUM_COUNT, PRIORITY_SCORE, OVERALL_QUALITY_SCORE, PRIMARY_ART, SCORING_VERSION
    );

    private MuseumFields() {
    }
}
