package com.museum.curation.drift;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares live records against a gold set by exact equality. Numbers compare by
 * numeric value, so {@code 4} and {@code 4.0} are equal. Runs after writes: it
 * flags drift, it never rolls back.
 */
public class DriftGate {
    private static final Logger log = LoggerFactory.getLogger(DriftGate.class);

    public DriftReport evaluate(GoldSet goldSet, Collection<MuseumRecord> records) {
        Map<String, MuseumRecord> byId = records.stream()
                .collect(Collectors.toMap(MuseumRecord::getRecordId, Function.identity(), (a, b) -> b));
        return evaluate(goldSet, id -> Optional.ofNullable(byId.get(id)));
    }

    public DriftReport evaluate(GoldSet goldSet, Function<String, Optional<MuseumRecord>> lookup) {
        List<String> skipped = new ArrayList<>();
        List<DriftDiff> diffs = new ArrayList<>();
        int recordsChecked = 0;
        int fieldsChecked = 0;

        for (String recordId : goldSet.recordIds()) {
            Optional<MuseumRecord> record = lookup.apply(recordId);
            if (record.isEmpty()) {
                skipped.add(recordId);
                continue;
            }
            recordsChecked++;
            for (Map.Entry<String, Object> expected : goldSet.expectedFor(recordId).entrySet()) {
                if (MuseumFields.MUSEUM_ID.equals(expected.getKey())) {
                    continue;
                }
                fieldsChecked++;
                Object actual = record.get().get(expected.getKey());
                if (!valuesEqual(expected.getValue(), actual)) {
                    diffs.add(new DriftDiff(recordId, expected.getKey(), expected.getValue(), actual));
                }
            }
        }

        double rate = fieldsChecked == 0 ? 0.0 : (double) diffs.size() / fieldsChecked;
        log.info("drift.evaluated records={} skipped={} fields={} drifted={} rate={}",
                recordsChecked, skipped.size(), fieldsChecked, diffs.size(), rate);
        return new DriftReport(recordsChecked, skipped, fieldsChecked, diffs.size(), rate, diffs);
    }

    static boolean valuesEqual(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            return toDecimal(e).compareTo(toDecimal(a)) == 0;
        }
        return Objects.equals(expected, actual);
    }

    private static BigDecimal toDecimal(Number number) {
        return new BigDecimal(number.toString());
    }
}
