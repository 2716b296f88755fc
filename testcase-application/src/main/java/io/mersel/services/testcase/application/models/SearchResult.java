package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.SearchMatchType;
import io.mersel.services.testcase.application.enums.TestStatus;

import java.util.List;

/**
 * Arama sonucu.
 *
 * @param matchType Vurgulama için eşleşen alan
 */
public record SearchResult(
        String id,
        String filename,
        String title,
        String purpose,
        TestStatus status,
        List<String> profiles,
        List<String> refFunctions,
        List<String> refUsers,
        String module,
        String category,
        SearchMatchType matchType
) {

    public SearchResult {
        profiles = ModelDefaults.list(profiles);
        refFunctions = ModelDefaults.list(refFunctions);
        refUsers = ModelDefaults.list(refUsers);
    }
}
