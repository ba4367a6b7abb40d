package com.museum.curation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Normalizer backed by an ordered list of {@link NormalizationRule}s.
 * The first matching rule supplies the canonical value. When nothing matches,
 * a strict normalizer fails with its reason code while a lenient one keeps the
 * trimmed input.
 */
public class RuleBasedNormalizer implements FieldNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedNormalizer.class);

    private final List<NormalizationRule> rules;
    private final boolean strict;
    private final String failureReason;

    private RuleBasedNormalizer(List<NormalizationRule> rules, boolean strict, String failureReason) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.strict = strict;
        this.failureReason = failureReason;
    }

    /**
     * Creates a normalizer that rejects values no rule recognizes.
     */
    public static RuleBasedNormalizer strict(List<NormalizationRule> rules, String failureReason) {
        return new RuleBasedNormalizer(rules, true, failureReason);
    }

    /**
     * Creates a normalizer that passes unrecognized values through, trimmed.
     */
    public static RuleBasedNormalizer lenient(List<NormalizationRule> rules) {
        return new RuleBasedNormalizer(rules, false, null);
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    @Override
    public NormalizationResult normalize(Object value) {
        if (value == null) {
            return strict ? NormalizationResult.failed(null, failureReason) : NormalizationResult.ok(null);
        }
        String input = value.toString().trim();
        for (NormalizationRule rule : rules) {
            if (rule.matches(input)) {
                if (!rule.getCanonical().equals(input)) {
                    log.debug("Rule '{}' normalized '{}' -> '{}'", rule.getName(), input, rule.getCanonical());
                }
                return NormalizationResult.ok(rule.getCanonical());
            }
        }
        if (strict) {
            return NormalizationResult.failed(value, failureReason);
        }
        return NormalizationResult.ok(input);
    }
}
