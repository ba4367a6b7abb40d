package com.museum.curation.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in normalization rules for the museum schema.
 */
public final class DefaultNormalizationRules {

    public static final String QUICK_STOP = "Quick stop (<1 hr)";
    public static final String HALF_DAY = "Half day";
    public static final String FULL_DAY = "Full day";

    public static final String INVALID_TIME_NEEDED = "invalid_time_needed";

    private static final Map<String, String> MUSEUM_TYPES = new LinkedHashMap<>();

    static {
        MUSEUM_TYPES.put("art museum", "Art Museum");
        MUSEUM_TYPES.put("fine art", "Fine Art");
        MUSEUM_TYPES.put("contemporary art", "Contemporary Art");
        MUSEUM_TYPES.put("modern art", "Modern Art");
        MUSEUM_TYPES.put("art center", "Art Center");
        MUSEUM_TYPES.put("art gallery", "Art Gallery");
        MUSEUM_TYPES.put("university art museum", "University Art Museum");
        MUSEUM_TYPES.put("university museum", "University Art Museum");
        MUSEUM_TYPES.put("college art museum", "University Art Museum");
        MUSEUM_TYPES.put("art (encyclopedic)", "Encyclopedic Art Museum");
        MUSEUM_TYPES.put("art (modern/contemporary)", "Contemporary Art");
        MUSEUM_TYPES.put("encyclopedic art museum", "Encyclopedic Art Museum");
        MUSEUM_TYPES.put("art", "Art Museum");
        MUSEUM_TYPES.put("natural history museum", "Natural History Museum");
        MUSEUM_TYPES.put("natural history", "Natural History Museum");
        MUSEUM_TYPES.put("history museum", "History Museum");
        MUSEUM_TYPES.put("historic house", "Historic House");
        MUSEUM_TYPES.put("historic site", "Historic Site");
        MUSEUM_TYPES.put("historic preservation", "Historic Preservation");
        MUSEUM_TYPES.put("heritage museum", "Heritage Museum");
        MUSEUM_TYPES.put("heritage center", "Heritage Center");
        MUSEUM_TYPES.put("history", "History Museum");
        MUSEUM_TYPES.put("science & technology museum or planetarium", "Science Museum");
        MUSEUM_TYPES.put("science museum", "Science Museum");
        MUSEUM_TYPES.put("science center", "Science Center");
        MUSEUM_TYPES.put("children's museum", "Children's Museum");
        MUSEUM_TYPES.put("childrens museum", "Children's Museum");
        MUSEUM_TYPES.put("kids museum", "Children's Museum");
        MUSEUM_TYPES.put("arboretum, botanical garden, or nature center", "Botanical Garden");
        MUSEUM_TYPES.put("botanical garden", "Botanical Garden");
        MUSEUM_TYPES.put("nature center", "Nature Center");
        MUSEUM_TYPES.put("zoo, aquarium, or wildlife conservation", "Zoo/Aquarium");
        MUSEUM_TYPES.put("zoo", "Zoo/Aquarium");
        MUSEUM_TYPES.put("aquarium", "Zoo/Aquarium");
        MUSEUM_TYPES.put("cultural center", "Cultural Center");
        MUSEUM_TYPES.put("cultural museum", "Cultural Center");
        MUSEUM_TYPES.put("ethnic museum", "Cultural Center");
        MUSEUM_TYPES.put("general museum", "General Museum");
        MUSEUM_TYPES.put("general", "General Museum");
        MUSEUM_TYPES.put("specialty museum", "Specialty Museum");
        MUSEUM_TYPES.put("specialty", "Specialty Museum");
        MUSEUM_TYPES.put("memorial", "Memorial");
        MUSEUM_TYPES.put("hall of fame", "Hall of Fame");
    }

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Visit-duration buckets and their accepted spellings.
     */
    public static List<NormalizationRule> getTimeNeededRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("time-quick-stop")
                        .pattern("quick[- ]stop(\\s*\\((<\\s*1\\s*hr|1-2 hours)\\))?|<\\s*1\\s*hr|1-2 hours")
                        .canonical(QUICK_STOP)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("time-half-day")
                        .pattern("half[- ]day(\\s*\\(2-4 hours\\))?|2-4 hours")
                        .canonical(HALF_DAY)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("time-full-day")
                        .pattern("full[- ]day(\\s*\\(4\\+ hours\\))?|4\\+ hours")
                        .canonical(FULL_DAY)
                        .priority(10)
                        .build()
        );
    }

    /**
     * Museum type rules: exact spellings first, then whole-word containment matches in table order.
     */
    public static List<NormalizationRule> getMuseumTypeRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, String> entry : MUSEUM_TYPES.entrySet()) {
            String quoted = Pattern.quote(entry.getKey());
            rules.add(NormalizationRule.builder()
                    .name("type-exact-" + entry.getKey())
                    .pattern(quoted)
                    .canonical(entry.getValue())
                    .priority(10)
                    .build());
            rules.add(NormalizationRule.builder()
                    .name("type-contains-" + entry.getKey())
                    .pattern(".*\\b" + quoted + "\\b.*")
                    .canonical(entry.getValue())
                    .priority(100 + index)
                    .build());
            index++;
        }
        return rules;
    }

    public static FieldNormalizer timeNeededNormalizer() {
        return RuleBasedNormalizer.strict(getTimeNeededRules(), INVALID_TIME_NEEDED);
    }

    public static FieldNormalizer museumTypeNormalizer() {
        return RuleBasedNormalizer.lenient(getMuseumTypeRules());
    }
}
