package io.mersel.services.testcase.application.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * TestCase, TestStep ve ExpectedResult üzerinde tutulan yürütme durumu.
 * <p>
 * Durum bilgisinin hiç olmaması ({@code null}) "açık" (henüz yürütülmedi) anlamına gelir;
 * bu nedenle ayrı bir {@code OPEN} değeri tanımlanmaz.
 */
public enum TestStatus {

    PASSED,
    FAILED,
    SKIPPED;

    /**
     * XML attribute/element değerinden durum çözümler.
     *
     * @param value Ham değer (örn: "PASSED"); büyük/küçük harf duyarsız
     * @return Eşleşen durum, boş veya tanınmayan değerlerde {@code null}
     */
    @JsonCreator
    public static TestStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (var status : values()) {
            if (status.name().equalsIgnoreCase(value.strip())) {
                return status;
            }
        }
        return null;
    }
}
