package io.mersel.services.testcase.application.models;

/**
 * TestCase eki meta verisi.
 * <p>
 * Dosyanın kendisi {@code <instance>/_attachments/<testcaseId>/<filename>} altında tutulur;
 * belge yalnızca meta veriyi taşır.
 *
 * @param filename     Disk üzerindeki güvenli, zaman önekli dosya adı
 * @param originalName Yüklenen orijinal dosya adı
 * @param timestamp    ISO-8601 yükleme zamanı
 * @param description  Açıklama
 * @param mimeType     MIME tipi
 * @param size         Bayt cinsinden boyut
 */
public record Attachment(
        String filename,
        String originalName,
        String timestamp,
        String description,
        String mimeType,
        long size
) {

    public Attachment {
        filename = ModelDefaults.text(filename);
        originalName = originalName == null || originalName.isEmpty() ? filename : originalName;
        timestamp = ModelDefaults.blankToNull(timestamp);
        description = ModelDefaults.text(description);
        mimeType = ModelDefaults.text(mimeType);
    }
}
