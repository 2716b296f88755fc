package io.mersel.services.testcase.application.models;

/**
 * Profil kataloğu girdisi (yalnızca etiketleme amaçlı).
 *
 * @param id          Profil kimliği
 * @param name        Görünen ad, boşsa {@code id}
 * @param description Açıklama
 * @param category    Kategori etiketi, boşsa {@value #DEFAULT_CATEGORY}
 */
public record ProfileDefinition(String id, String name, String description, String category) {

    public static final String DEFAULT_CATEGORY = "Sonstige";

    public ProfileDefinition {
        id = ModelDefaults.text(id);
        name = name == null || name.isEmpty() ? id : name;
        description = ModelDefaults.text(description);
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }
}
