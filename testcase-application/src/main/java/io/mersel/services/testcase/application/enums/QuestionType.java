package io.mersel.services.testcase.application.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kontrol listesi sorusunun cevap tipi.
 */
public enum QuestionType {

    BOOLEAN("boolean"),
    CHOICE("choice"),
    MULTI_CHOICE("multi-choice"),

    /** Tanınmayan tip; profil eşlemelerinin hiçbirini sağlamaz. */
    UNKNOWN("unknown");

    private final String wireValue;

    QuestionType(String wireValue) {
        this.wireValue = wireValue;
    }

    /** XML ve JSON üzerinde kullanılan değer (örn: "multi-choice"). */
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Ham tip değerini çözümler. Tip verilmemişse {@link #BOOLEAN}, tanınmıyorsa {@link #UNKNOWN}.
     */
    @JsonCreator
    public static QuestionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BOOLEAN;
        }
        for (var type : values()) {
            if (type.wireValue.equalsIgnoreCase(value.strip()) || type.name().equalsIgnoreCase(value.strip())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
