package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.TestStatus;

import java.util.Map;

/**
 * Test adımının beklenen sonucu.
 * <p>
 * {@code id} kalıcı değildir; okuma sırasında pozisyondan üretilir
 * ({@code er-<adım>-<sonuç>}, 1 tabanlı). {@code variables} XML üzerinde
 * tek bir {@code k1=v1,k2=v2} attribute'u olarak taşınır.
 */
public record ExpectedResult(
        String id,
        String text,
        TestStatus status,
        String actualResult,
        Map<String, String> variables
) {

    public ExpectedResult {
        text = ModelDefaults.text(text);
        actualResult = ModelDefaults.text(actualResult);
        variables = ModelDefaults.orderedMap(variables);
    }

    public static String syntheticId(int stepNumber, int resultNumber) {
        return "er-" + stepNumber + "-" + resultNumber;
    }
}
