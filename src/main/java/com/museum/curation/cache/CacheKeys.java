package com.museum.curation.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.museum.curation.adapter.SourceRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

final class CacheKeys {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeys() {
    }

    static String keyFor(String adapterName, SourceRequest request) {
        try {
            String canonical = CANONICAL.writeValueAsString(request.parameters());
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(adapterName.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parameters are not serializable: " + request, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
