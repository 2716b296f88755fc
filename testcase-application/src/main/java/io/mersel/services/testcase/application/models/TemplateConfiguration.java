package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.FilterMode;

/**
 * Şablon seviyesindeki ayarlar.
 *
 * @param profileFilterMode Raporlarda profil filtresinin birleştirme modu (varsayılan OR)
 */
public record TemplateConfiguration(FilterMode profileFilterMode) {

    public TemplateConfiguration {
        profileFilterMode = profileFilterMode != null ? profileFilterMode : FilterMode.OR;
    }

    public static TemplateConfiguration defaults() {
        return new TemplateConfiguration(FilterMode.OR);
    }
}
