package io.mersel.services.testcase.application.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Record compact constructor'larında kullanılan null normalizasyonu.
 * <p>
 * Modeller JSON veya XML kaynağından hangi şekilde gelirse gelsin
 * koleksiyonlar hiçbir zaman {@code null} olmaz.
 */
final class ModelDefaults {

    private ModelDefaults() {
    }

    static <T> List<T> list(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return source.stream().filter(Objects::nonNull).toList();
    }

    static <K, V> Map<K, V> orderedMap(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static String text(String value) {
        return value != null ? value : "";
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
