package io.mersel.services.testcase.application.models;

/**
 * Yüklenen ek dosyası.
 *
 * @param originalName İstemcinin gönderdiği dosya adı
 * @param mimeType     İstemcinin bildirdiği MIME tipi
 * @param description  Açıklama (isteğe bağlı)
 * @param content      Dosya içeriği
 */
public record AttachmentUpload(
        String originalName,
        String mimeType,
        String description,
        byte[] content
) {

    public long size() {
        return content != null ? content.length : 0;
    }
}
