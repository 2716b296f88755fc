package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Raporlarda kullanılan TestCase özeti.
 *
 * @param id      TestCase kimliği
 * @param title   Başlık
 * @param purpose Amaç
 * @param profiles Profil etiketleri
 * @param status  Rapor durumu: PASSED, FAILED, SKIPPED veya OPEN
 */
public record ReportTestcase(
        String id,
        String title,
        String purpose,
        List<String> profiles,
        String status
) {

    public static final String OPEN = "OPEN";

    public ReportTestcase {
        profiles = ModelDefaults.list(profiles);
        status = status != null ? status : OPEN;
    }
}
