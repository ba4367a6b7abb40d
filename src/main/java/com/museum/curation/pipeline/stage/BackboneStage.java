package com.museum.curation.pipeline.stage;

import com.museum.curation.core.model.FieldCandidate;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.ProvenanceEntry;
import com.museum.curation.core.model.TrustLevel;
import com.museum.curation.merge.Placeholders;
import com.museum.curation.pipeline.PipelineStage;
import com.museum.curation.pipeline.StageContext;
import com.museum.curation.pipeline.StageName;
import com.museum.curation.pipeline.StageOutput;
import com.museum.curation.rules.DefaultNormalizationRules;
import com.museum.curation.rules.FieldNormalizer;
import com.museum.curation.rules.NormalizationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic backbone fields computed without any external call.
 *
 * <ul>
 *   <li>{@code city_tier} from curated city lists (1 major hub, 2 regional center, 3 otherwise)</li>
 *   <li>{@code time_needed} from keywords in the museum type and name</li>
 *   <li>{@code museum_type} restated in its canonical spelling</li>
 *   <li>{@code nearby_museum_count}: other records of the partition in the same city</li>
 * </ul>
 *
 * Tier and visit time are proposed only while the field is empty, as candidates,
 * so better sources and manual locks always win.
 */
public class BackboneStage implements PipelineStage {

    public static final String SOURCE = "backbone";

    static final int LISTED_CITY_CONFIDENCE = 5;
    static final int DEFAULT_TIER_CONFIDENCE = 4;
    static final int KEYWORD_TIME_CONFIDENCE = 3;
    static final int DEFAULT_TIME_CONFIDENCE = 2;

    private static final Set<String> TIER_1_CITIES = lowerCase(Set.of(
            "New York", "Los Angeles", "Chicago", "Houston", "Phoenix", "Philadelphia",
            "San Antonio", "San Diego", "Dallas", "San Jose", "Austin", "Jacksonville",
            "Fort Worth", "Columbus", "Charlotte", "San Francisco", "Indianapolis",
            "Seattle", "Denver", "Washington", "Boston", "Detroit", "Nashville",
            "Portland", "Las Vegas", "Memphis", "Louisville", "Baltimore", "Milwaukee",
            "Albuquerque", "Tucson", "Fresno", "Sacramento", "Kansas City", "Atlanta",
            "Miami", "Minneapolis", "Cleveland", "New Orleans", "Oakland", "Tampa",
            "Honolulu", "Omaha", "Wichita", "Arlington", "Raleigh", "Virginia Beach",
            "Long Beach", "Colorado Springs", "Tulsa", "Oklahoma City",
            "Santa Fe", "Williamsburg", "Cambridge", "Berkeley", "Ann Arbor",
            "Sarasota", "Palm Beach", "Pasadena", "Santa Barbara", "Savannah",
            "Charleston", "Newport", "Providence", "New Haven", "Pittsburgh",
            "St. Louis", "Cincinnati", "Buffalo", "Richmond", "Hartford"));

    private static final Set<String> TIER_2_CITIES = lowerCase(Set.of(
            "Boise", "Salt Lake City", "Des Moines", "Madison", "Little Rock",
            "Jackson", "Montgomery", "Tallahassee", "Springfield", "Lansing",
            "Harrisburg", "Trenton", "Albany", "Concord", "Montpelier", "Augusta",
            "Olympia", "Salem", "Carson City", "Helena", "Bismarck", "Pierre",
            "Cheyenne", "Topeka", "Lincoln", "Jefferson City", "Frankfort",
            "Ithaca", "Chapel Hill", "Charlottesville", "Princeton", "Amherst",
            "Hanover", "Oberlin", "Bloomington", "Eugene", "Boulder", "Durham",
            "Bentonville", "Marfa", "Taos", "Sedona", "Asheville", "Woodstock",
            "Ogunquit", "Provincetown", "Carmel", "Laguna Beach", "St. Petersburg"));

    // Checked in insertion order; the first bucket with a matching keyword wins.
    private static final Map<String, List<String>> TIME_KEYWORDS = new LinkedHashMap<>();

    static {
        TIME_KEYWORDS.put(DefaultNormalizationRules.FULL_DAY, List.of(
                "encyclopedic", "natural history", "science center", "large complex",
                "museum campus", "smithsonian", "metropolitan", "national gallery"));
        TIME_KEYWORDS.put(DefaultNormalizationRules.QUICK_STOP, List.of(
                "historic house", "historic site", "house museum", "small gallery",
                "local history", "heritage center", "memorial", "monument"));
        TIME_KEYWORDS.put(DefaultNormalizationRules.HALF_DAY, List.of(
                "art museum", "art center", "contemporary art", "modern art",
                "history museum", "science museum", "children's museum",
                "university museum", "gallery", "cultural center"));
    }

    private final FieldNormalizer museumTypeNormalizer;

    public BackboneStage() {
        this(DefaultNormalizationRules.museumTypeNormalizer());
    }

    public BackboneStage(FieldNormalizer museumTypeNormalizer) {
        this.museumTypeNormalizer = Objects.requireNonNull(museumTypeNormalizer, "museumTypeNormalizer is required");
    }

    @Override
    public StageName name() {
        return StageName.BACKBONE_NORMALIZATION;
    }

    @Override
    public StageOutput process(MuseumRecord record, StageContext context) {
        List<FieldCandidate> candidates = new ArrayList<>();
        String city = record.getString(MuseumFields.CITY).orElse(null);

        if (Placeholders.isPlaceholder(record.get(MuseumFields.CITY_TIER))) {
            int tier = cityTier(city);
            int confidence = tier == 3 ? DEFAULT_TIER_CONFIDENCE : LISTED_CITY_CONFIDENCE;
            candidates.add(FieldCandidate.of(MuseumFields.CITY_TIER, tier, SOURCE + ":city_tier",
                    TrustLevel.KNOWLEDGE_BASE, confidence));
        }

        if (Placeholders.isPlaceholder(record.get(MuseumFields.TIME_NEEDED))) {
            String type = record.getString(MuseumFields.MUSEUM_TYPE).orElse(null);
            String name = record.getString(MuseumFields.MUSEUM_NAME).orElse(null);
            String keywordMatch = timeNeededByKeyword(type, name);
            String duration = keywordMatch != null ? keywordMatch : DefaultNormalizationRules.HALF_DAY;
            int confidence = keywordMatch != null ? KEYWORD_TIME_CONFIDENCE : DEFAULT_TIME_CONFIDENCE;
            candidates.add(FieldCandidate.of(MuseumFields.TIME_NEEDED, duration, SOURCE + ":time_needed",
                    TrustLevel.MODEL_GUESS, confidence));
        }

        FieldCandidate canonicalType = canonicalMuseumType(record, context);
        if (canonicalType != null) {
            candidates.add(canonicalType);
        }

        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put(MuseumFields.NEARBY_MUSEUM_COUNT, nearbyCount(record, city, context.getPartitionRecords()));
        return new StageOutput(candidates, derived, List.of());
    }

    @Override
    public boolean hasOutput(MuseumRecord record) {
        return record.has(MuseumFields.CITY_TIER) && record.get(MuseumFields.NEARBY_MUSEUM_COUNT) != null;
    }

    /**
     * Tier of a city by its curated list; unknown or missing cities are tier 3.
     */
    public static int cityTier(String city) {
        if (city == null || city.isBlank()) {
            return 3;
        }
        String key = city.trim().toLowerCase(Locale.ROOT);
        if (TIER_1_CITIES.contains(key)) {
            return 1;
        }
        if (TIER_2_CITIES.contains(key)) {
            return 2;
        }
        return 3;
    }

    /**
     * Visit duration suggested by keywords in the type and name, or null when nothing matches.
     */
    public static String timeNeededByKeyword(String museumType, String museumName) {
        StringBuilder text = new StringBuilder();
        if (museumType != null) {
            text.append(museumType.toLowerCase(Locale.ROOT)).append(' ');
        }
        if (museumName != null) {
            text.append(museumName.toLowerCase(Locale.ROOT));
        }
        String haystack = text.toString().trim();
        if (haystack.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, List<String>> bucket : TIME_KEYWORDS.entrySet()) {
            if (bucket.getValue().stream().anyMatch(haystack::contains)) {
                return bucket.getKey();
            }
        }
        return null;
    }

    /**
     * Other records of the partition in the same city, compared case-insensitively.
     */
    public static int nearbyCount(MuseumRecord record, String city, List<MuseumRecord> partitionRecords) {
        if (city == null || city.isBlank()) {
            return 0;
        }
        String key = city.trim().toLowerCase(Locale.ROOT);
        int count = 0;
        for (MuseumRecord other : partitionRecords) {
            if (other.getRecordId().equals(record.getRecordId())) {
                continue;
            }
            String otherCity = other.getString(MuseumFields.CITY).orElse(null);
            if (otherCity != null && otherCity.trim().toLowerCase(Locale.ROOT).equals(key)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Restates a non-canonical museum type under the provenance of the stored value,
     * so the merge accepts it as the same source's newer statement. Human-set and
     * locked values are left alone.
     */
    private FieldCandidate canonicalMuseumType(MuseumRecord record, StageContext context) {
        Object current = record.get(MuseumFields.MUSEUM_TYPE);
        if (!Placeholders.isMeaningful(current) || record.isLocked(MuseumFields.MUSEUM_TYPE)) {
            return null;
        }
        NormalizationResult normalized = museumTypeNormalizer.normalize(current);
        if (!normalized.isValid() || Objects.equals(normalized.value(), current)) {
            return null;
        }
        ProvenanceEntry provenance = context.getProvenance(record.getRecordId(), MuseumFields.MUSEUM_TYPE);
        if (provenance == null || provenance.source() == null) {
            return FieldCandidate.of(MuseumFields.MUSEUM_TYPE, normalized.value(), SOURCE + ":museum_type",
                    TrustLevel.MODEL_EXTRACTED, 3);
        }
        if (provenance.trustLevel() == TrustLevel.MANUAL_OVERRIDE) {
            return null;
        }
        int confidence = provenance.confidence() != null ? provenance.confidence() : 3;
        return FieldCandidate.of(MuseumFields.MUSEUM_TYPE, normalized.value(), provenance.source(),
                provenance.trustLevel(), confidence);
    }

    private static Set<String> lowerCase(Set<String> cities) {
        return cities.stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
