package com.museum.curation.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.store.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a gold set from JSON. Accepted shapes:
 * <pre>
 * {"museums": [{"museum_id": "...", "expected": {"city": "Denver"}}]}
 * [{"museum_id": "...", "city": "Denver"}]
 * </pre>
 */
public class GoldSetLoader {
    private static final Logger log = LoggerFactory.getLogger(GoldSetLoader.class);

    private final ObjectMapper objectMapper;

    public GoldSetLoader() {
        this(JsonMappers.create());
    }

    public GoldSetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws GoldSetException if the file is missing, unreadable or malformed
     */
    public GoldSet load(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new GoldSetException("Gold set not found: " + path);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new GoldSetException("Failed to read gold set " + path, e);
        }
        JsonNode entries = root.isArray() ? root : root.path("museums");
        if (!entries.isArray()) {
            throw new GoldSetException("Gold set must be an array or contain a 'museums' array: " + path);
        }

        Map<String, Map<String, Object>> expected = new LinkedHashMap<>();
        for (JsonNode entry : entries) {
            JsonNode id = entry.get(MuseumFields.MUSEUM_ID);
            if (id == null || id.asText().isBlank()) {
                throw new GoldSetException("Gold set entry without " + MuseumFields.MUSEUM_ID + ": " + entry);
            }
            JsonNode fields = entry.has("expected") ? entry.get("expected") : entry;
            Map<String, Object> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                if (!MuseumFields.MUSEUM_ID.equals(field.getKey())) {
                    values.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            }
            expected.put(id.asText(), values);
        }
        log.info("goldset.loaded records={} path={}", expected.size(), path);
        return new GoldSet(expected);
    }
}
