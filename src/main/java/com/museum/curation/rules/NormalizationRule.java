package com.museum.curation.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps raw values matching a regex onto one canonical value.
 * Rules have priority ordering; the lowest priority number is tried first.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String canonical;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.canonical = builder.canonical;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getCanonical() {
        return canonical;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Checks whether the whole trimmed input matches this rule.
     */
    public boolean matches(String input) {
        return input != null && pattern.matcher(input.trim()).matches();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", canonical='" + canonical + '\'' +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String canonical;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder canonical(String canonical) {
            this.canonical = canonical;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(canonical, "canonical is required");
            return new NormalizationRule(this);
        }
    }
}
