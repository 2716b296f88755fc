package io.mersel.services.testcase.application.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.mersel.services.testcase.application.enums.TestStatus;

/**
 * TestCase sonuç bloğu. Tüm alanlar isteğe bağlıdır; boş metinler {@code null} olarak tutulur.
 */
public record TestResult(
        TestStatus status,
        String summary,
        String testedBy,
        String testedDate,
        String comments
) {

    public TestResult {
        summary = ModelDefaults.blankToNull(summary);
        testedBy = ModelDefaults.blankToNull(testedBy);
        testedDate = ModelDefaults.blankToNull(testedDate);
        comments = ModelDefaults.blankToNull(comments);
    }

    public static TestResult empty() {
        return new TestResult(null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return status == null && summary == null && testedBy == null
                && testedDate == null && comments == null;
    }
}
