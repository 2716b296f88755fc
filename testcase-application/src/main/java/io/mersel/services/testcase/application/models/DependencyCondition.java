package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Bağımlılık koşulu: {@code questionId} sorusunun cevabı {@code values} içinde olmalı.
 */
public record DependencyCondition(String questionId, List<String> values) {

    public DependencyCondition {
        questionId = ModelDefaults.text(questionId);
        values = ModelDefaults.list(values);
    }
}
