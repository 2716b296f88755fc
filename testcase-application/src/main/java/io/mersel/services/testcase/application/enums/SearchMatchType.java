package io.mersel.services.testcase.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Arama sonucunun hangi alan üzerinden eşleştiği (arayüzde vurgulama için).
 * Birden fazla alan eşleşirse tanım sırasındaki ilk tür seçilir.
 */
public enum SearchMatchType {

    ID("id"),
    TITLE("title"),
    REF_FUNCTION("refFunction"),
    REF_USER("refUser"),
    PURPOSE("purpose");

    private final String wireValue;

    SearchMatchType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
