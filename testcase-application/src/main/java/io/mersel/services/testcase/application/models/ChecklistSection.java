package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Checklist bölümü.
 */
public record ChecklistSection(
        String id,
        String title,
        String description,
        List<ChecklistQuestion> questions
) {

    public ChecklistSection {
        id = ModelDefaults.text(id);
        title = ModelDefaults.text(title);
        description = ModelDefaults.text(description);
        questions = ModelDefaults.list(questions);
    }
}
