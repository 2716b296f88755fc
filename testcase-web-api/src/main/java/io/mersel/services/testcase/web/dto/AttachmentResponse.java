package io.mersel.services.testcase.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.testcase.application.models.Attachment;

import java.util.List;

/**
 * Ek yükleme/silme yanıtı. {@code attachment} yalnızca yüklemede doldurulur.
 *
 * @param success     İşlem başarılı mı
 * @param attachment  Eklenen ek
 * @param attachments İşlem sonrası tüm ekler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttachmentResponse(boolean success, Attachment attachment, List<Attachment> attachments) {
}
