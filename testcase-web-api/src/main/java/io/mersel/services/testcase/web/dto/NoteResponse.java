package io.mersel.services.testcase.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.testcase.application.models.Note;

import java.util.List;

/**
 * Not ekleme/silme yanıtı. {@code note} yalnızca eklemede doldurulur.
 *
 * @param success İşlem başarılı mı
 * @param note    Eklenen not
 * @param notes   İşlem sonrası tüm notlar
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NoteResponse(boolean success, Note note, List<Note> notes) {
}
