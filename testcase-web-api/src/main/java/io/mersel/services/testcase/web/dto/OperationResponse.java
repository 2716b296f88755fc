package io.mersel.services.testcase.web.dto;

/**
 * Gövdesiz yazma işlemleri için basit başarı yanıtı.
 *
 * @param success İşlem başarılı mı
 * @param message Kullanıcıya gösterilecek mesaj
 */
public record OperationResponse(boolean success, String message) {
}
