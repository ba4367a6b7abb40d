package com.museum.curation.rules;

import com.museum.curation.core.model.MuseumFields;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry of per-field normalizers. Fields without a normalizer pass through unchanged.
 */
public class NormalizationEngine {

    private final Map<String, FieldNormalizer> normalizers;

    public NormalizationEngine() {
        this.normalizers = new LinkedHashMap<>();
    }

    public NormalizationEngine(Map<String, FieldNormalizer> normalizers) {
        this.normalizers = new LinkedHashMap<>(normalizers);
    }

    /**
     * Creates an engine with the website, visit-duration and museum type normalizers.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.register(MuseumFields.WEBSITE, new UrlNormalizer());
        engine.register(MuseumFields.TIME_NEEDED, DefaultNormalizationRules.timeNeededNormalizer());
        engine.register(MuseumFields.MUSEUM_TYPE, DefaultNormalizationRules.museumTypeNormalizer());
        return engine;
    }

    public NormalizationEngine register(String fieldName, FieldNormalizer normalizer) {
        normalizers.put(fieldName, normalizer);
        return this;
    }

    public boolean removeNormalizer(String fieldName) {
        return normalizers.remove(fieldName) != null;
    }

    public Set<String> getNormalizedFields() {
        return Collections.unmodifiableSet(normalizers.keySet());
    }

    /**
     * Normalizes a value for the given field.
     */
    public NormalizationResult normalize(String fieldName, Object value) {
        FieldNormalizer normalizer = normalizers.get(fieldName);
        if (normalizer == null) {
            return NormalizationResult.ok(value);
        }
        return normalizer.normalize(value);
    }
}
