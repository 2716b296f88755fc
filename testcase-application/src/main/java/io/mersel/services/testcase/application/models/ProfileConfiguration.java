package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Instance başına tek olan profil yapılandırması (checklist + profil kataloğu).
 * <p>
 * Checklist cevapları {@code ProfileDerivationEngine} tarafından aktif profil kümesine
 * dönüştürülür. {@code profileDefinitions} yalnızca arayüz etiketlemesi içindir,
 * türetmede kullanılmaz.
 *
 * @param completed             Checklist tamamlandı mı
 * @param metadata              Ürün meta verileri
 * @param templateConfiguration Şablon ayarları (profil filtre modu)
 * @param sections              Sıralı checklist bölümleri
 * @param profileDefinitions    Profil kataloğu
 */
public record ProfileConfiguration(
        boolean completed,
        ProfileMetadata metadata,
        TemplateConfiguration templateConfiguration,
        List<ChecklistSection> sections,
        List<ProfileDefinition> profileDefinitions
) {

    public ProfileConfiguration {
        metadata = metadata != null ? metadata : ProfileMetadata.empty();
        templateConfiguration = templateConfiguration != null
                ? templateConfiguration : TemplateConfiguration.defaults();
        sections = ModelDefaults.list(sections);
        profileDefinitions = ModelDefaults.list(profileDefinitions);
    }
}
