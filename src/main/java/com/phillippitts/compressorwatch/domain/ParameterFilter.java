package com.phillippitts.compressorwatch.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Validate-and-filter step shared by adaptation and integration parameter updates.
 *
 * <p>Unknown keys, null values and values outside their documented range are dropped without
 * error. The returned map preserves the order of {@code ranges}.
 */
final class ParameterFilter {

    private ParameterFilter() {}

    static Map<String, Double> accept(Map<String, Double> partial, Map<String, DoublePredicate> ranges) {
        if (partial == null || partial.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> applied = new LinkedHashMap<>();
        for (Map.Entry<String, DoublePredicate> range : ranges.entrySet()) {
            Double value = partial.get(range.getKey());
            if (value != null && range.getValue().test(value)) {
                applied.put(range.getKey(), value);
            }
        }
        return Collections.unmodifiableMap(applied);
    }

    static double pick(Map<String, Double> applied, String key, double current) {
        Double value = applied.get(key);
        return value != null ? value : current;
    }
}
