package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Soru cevabı. Boolean sorularda ilk değer "true"/"false" taşır,
 * seçimli sorularda seçilen değerlerin listesidir.
 */
public record Answer(boolean answered, List<String> values) {

    public Answer {
        values = ModelDefaults.list(values);
    }

    public static Answer unanswered() {
        return new Answer(false, List.of());
    }

    public String firstValue() {
        return values.isEmpty() ? null : values.get(0);
    }
}
