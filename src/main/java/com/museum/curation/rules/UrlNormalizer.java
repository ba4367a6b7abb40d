package com.museum.curation.rules;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonicalizes website URLs: trims, adds {@code https://} when no scheme is
 * given, and strips trailing slashes. Values without a usable host fail.
 */
public class UrlNormalizer implements FieldNormalizer {

    public static final String INVALID_WEBSITE = "invalid_website";

    @Override
    public NormalizationResult normalize(Object value) {
        if (value == null) {
            return NormalizationResult.failed(null, INVALID_WEBSITE);
        }
        String url = value.toString().trim();
        if (url.isEmpty() || url.chars().anyMatch(Character::isWhitespace)) {
            return NormalizationResult.failed(value, INVALID_WEBSITE);
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            if (lower.contains("://")) {
                return NormalizationResult.failed(value, INVALID_WEBSITE);
            }
            url = "https://" + url;
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        try {
            String host = new URI(url).getHost();
            if (host == null || !host.contains(".")) {
                return NormalizationResult.failed(value, INVALID_WEBSITE);
            }
        } catch (URISyntaxException e) {
            return NormalizationResult.failed(value, INVALID_WEBSITE);
        }
        return NormalizationResult.ok(url);
    }
}
