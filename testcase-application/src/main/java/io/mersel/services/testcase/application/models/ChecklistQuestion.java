package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.QuestionType;

import java.util.List;

/**
 * Checklist sorusu.
 * <p>
 * {@code dependsOn} modelde saklanır ve yazılır, ancak profil türetmesinde
 * değerlendirilmez; bağımlı soruların gizlenmesi arayüz tarafının işidir.
 *
 * @param id              Soru kimliği
 * @param text            Soru metni
 * @param type            Soru tipi (varsayılan boolean)
 * @param required        Zorunlu mu
 * @param helpText        Yardım metni
 * @param answer          Cevap, {@code null} olmaz
 * @param profileMappings Koşullu profil eşlemeleri
 * @param dependsOn       Diğer sorulara bağımlılık, yoksa {@code null}
 */
public record ChecklistQuestion(
        String id,
        String text,
        QuestionType type,
        boolean required,
        String helpText,
        Answer answer,
        List<ProfileMapping> profileMappings,
        DependsOn dependsOn
) {

    public ChecklistQuestion {
        id = ModelDefaults.text(id);
        text = ModelDefaults.text(text);
        type = type != null ? type : QuestionType.BOOLEAN;
        helpText = ModelDefaults.text(helpText);
        answer = answer != null ? answer : Answer.unanswered();
        profileMappings = ModelDefaults.list(profileMappings);
        if (dependsOn != null && dependsOn.conditions().isEmpty()) {
            dependsOn = null;
        }
    }
}
