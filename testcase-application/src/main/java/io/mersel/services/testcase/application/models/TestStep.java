package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.TestStatus;

import java.util.List;

/**
 * TestCase'e ait sıralı test adımı.
 * <p>
 * {@code refFunctions}/{@code refUsers} adım kapsamlıdır ve TestCase seviyesindeki
 * listelerden bağımsız tutulur; toplama sırasında ikisi birleştirilir.
 */
public record TestStep(
        String id,
        String command,
        List<ExpectedResult> expectedResults,
        TestStatus status,
        String errorMessage,
        List<String> refFunctions,
        List<String> refUsers
) {

    public TestStep {
        id = ModelDefaults.text(id);
        command = ModelDefaults.text(command);
        expectedResults = ModelDefaults.list(expectedResults);
        errorMessage = ModelDefaults.text(errorMessage);
        refFunctions = ModelDefaults.list(refFunctions);
        refUsers = ModelDefaults.list(refUsers);
    }
}
