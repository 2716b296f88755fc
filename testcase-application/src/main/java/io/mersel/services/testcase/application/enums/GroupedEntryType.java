package io.mersel.services.testcase.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rapor sıralamasındaki girdi türleri.
 */
public enum GroupedEntryType {

    TESTCASE("testcase"),
    GROUP_START("group-start"),
    GROUP_END("group-end"),
    BASE_GAP("base-gap"),
    VARIANT_GAP("variant-gap");

    private final String wireValue;

    GroupedEntryType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
