package com.museum.curation.scoring;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic visit-priority score for art museums. Lower is better.
 *
 * <pre>
 * primary  = max(impressionist, modern_contemporary)
 * dual     = 2 if both strengths &gt;= 4 else 0
 * cluster  = 1 if nearby_museum_count &gt;= 3 else 0
 * score    = (6 - primary) * 3 + (6 - historical_context) * 2
 *            + reputation + collection_tier - dual - cluster
 * </pre>
 *
 * All five scored inputs are required. A missing input yields an unscored breakdown
 * rather than a default; the nearby count is optional. Stateless and side-effect free.
 */
public class PriorityScorer {

    public static final String SCORING_VERSION = "priority_v2";
    public static final String IMPRESSIONIST = "Impressionist";
    public static final String MODERN_CONTEMPORARY = "Modern/Contemporary";

    static final int CLUSTER_THRESHOLD = 3;
    static final int DUAL_STRENGTH_THRESHOLD = 4;

    private static final Map<String, Integer> REPUTATION_LABELS = Map.of(
            "international", 0, "national", 1, "regional", 2, "local", 3);
    private static final Map<String, Integer> COLLECTION_LABELS = Map.of(
            "flagship", 0, "strong", 1, "moderate", 2, "small", 3);

    /**
     * Scores raw inputs. Returns null when any required input is null.
     *
     * @throws IllegalArgumentException if an input is outside its range
     */
    public Integer score(Integer strengthA, Integer strengthB, Integer historicalContext,
                         Integer reputation, Integer collectionTier, Integer nearbyCount) {
        if (strengthA == null || strengthB == null || historicalContext == null
                || reputation == null || collectionTier == null) {
            return null;
        }
        return compute("", strengthA, strengthB, historicalContext, reputation, collectionTier, nearbyCount)
                .priorityScore();
    }

    /**
     * Scores a record, reading numeric values or the tier labels used by curators.
     */
    public ScoreBreakdown score(MuseumRecord record) {
        Integer a = scaled(record, MuseumFields.IMPRESSIONIST_STRENGTH, null);
        Integer b = scaled(record, MuseumFields.MODERN_CONTEMPORARY_STRENGTH, null);
        Integer history = scaled(record, MuseumFields.HISTORICAL_CONTEXT_SCORE, null);
        Integer reputation = scaled(record, MuseumFields.REPUTATION, REPUTATION_LABELS);
        Integer collection = scaled(record, MuseumFields.COLLECTION_TIER, COLLECTION_LABELS);
        Integer nearby = record.getInt(MuseumFields.NEARBY_MUSEUM_COUNT).orElse(null);

        List<String> missing = new ArrayList<>();
        if (a == null) missing.add(MuseumFields.IMPRESSIONIST_STRENGTH);
        if (b == null) missing.add(MuseumFields.MODERN_CONTEMPORARY_STRENGTH);
        if (history == null) missing.add(MuseumFields.HISTORICAL_CONTEXT_SCORE);
        if (reputation == null) missing.add(MuseumFields.REPUTATION);
        if (collection == null) missing.add(MuseumFields.COLLECTION_TIER);
        if (!missing.isEmpty()) {
            return ScoreBreakdown.unscorable(record.getRecordId(), missing);
        }
        return compute(record.getRecordId(), a, b, history, reputation, collection, nearby);
    }

    private ScoreBreakdown compute(String recordId, int strengthA, int strengthB, int history,
                                   int reputation, int collection, Integer nearbyCount) {
        requireRange("strength_a", strengthA, 0, 5);
        requireRange("strength_b", strengthB, 0, 5);
        requireRange("historical_context", history, 0, 5);
        requireRange("reputation", reputation, 0, 3);
        requireRange("collection_tier", collection, 0, 3);

        int primary = Math.max(strengthA, strengthB);
        int dual = strengthA >= DUAL_STRENGTH_THRESHOLD && strengthB >= DUAL_STRENGTH_THRESHOLD ? 2 : 0;
        int cluster = nearbyCount != null && nearbyCount >= CLUSTER_THRESHOLD ? 1 : 0;
        int art = (6 - primary) * 3;
        int historyComponent = (6 - history) * 2;
        int priority = art + historyComponent + reputation + collection - dual - cluster;
        int quality = primary * 3 + (3 - reputation) + (3 - collection) + dual;

        return new ScoreBreakdown(recordId, primary, art, historyComponent, reputation, collection,
                dual, cluster, priority, quality, primaryArt(strengthA, strengthB), List.of());
    }

    /**
     * Ties go to Modern/Contemporary; two zero strengths have no focus.
     */
    static String primaryArt(int impressionist, int modern) {
        if (impressionist > modern) {
            return IMPRESSIONIST;
        }
        if (modern > 0) {
            return MODERN_CONTEMPORARY;
        }
        return null;
    }

    private static Integer scaled(MuseumRecord record, String field, Map<String, Integer> labels) {
        Object raw = record.get(field);
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            String key = text.trim().toLowerCase(Locale.ROOT);
            if (labels != null && labels.containsKey(key)) {
                return labels.get(key);
            }
            return record.getInt(field).orElse(null);
        }
        return null;
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", was " + value);
        }
    }
}
