package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.ProfileConfiguration;

import java.util.List;

/**
 * Checklist cevaplarından aktif profil kümesini türeten servis.
 */
public interface IProfileDerivationService {

    /**
     * Cevaplanmış soruların profil eşlemelerini değerlendirir.
     * <p>
     * Hata fırlatmaz; eksik veya bozuk bölümler sonuca katkı yapmaz.
     * {@code DependsOn} değerlendirilmez.
     *
     * @param configuration profil yapılandırması, {@code null} olabilir
     * @return tekil, sözlük sırasına göre sıralı profil adları
     */
    List<String> deriveActiveProfiles(ProfileConfiguration configuration);
}
