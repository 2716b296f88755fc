package io.mersel.services.testcase.application.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Aktif profil filtresinin birleştirme modu.
 * <ul>
 *   <li>{@link #OR}: TestCase profillerinden en az biri aktifse dahil edilir</li>
 *   <li>{@link #AND}: TestCase profillerinin tümü aktifse dahil edilir</li>
 * </ul>
 * Aynı enum, {@code DependsOn} bloklarının {@code logic} attribute'u için de kullanılır.
 */
public enum FilterMode {

    OR,
    AND;

    /**
     * @return Eşleşen mod, boş veya tanınmayan değerlerde {@link #OR}
     */
    @JsonCreator
    public static FilterMode fromValue(String value) {
        if (value != null && AND.name().equalsIgnoreCase(value.strip())) {
            return AND;
        }
        return OR;
    }
}
