package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Cevap koşulu sağlandığında aktifleşen profiller.
 *
 * @param condition Boolean sorularda "true"/"false", seçimli sorularda seçenek değeri
 * @param profiles  Aktifleşecek profil adları
 */
public record ProfileMapping(String condition, List<String> profiles) {

    public static final String ALWAYS = "true";

    public ProfileMapping {
        condition = condition == null || condition.isEmpty() ? ALWAYS : condition;
        profiles = ModelDefaults.list(profiles);
    }
}
