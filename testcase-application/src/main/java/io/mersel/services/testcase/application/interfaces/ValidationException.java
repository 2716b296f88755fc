package io.mersel.services.testcase.application.interfaces;

/**
 * İstek geçersiz olduğunda fırlatılan istisna (boş not metni, aralık dışı not indeksi,
 * izin verilmeyen dosya tipi gibi).
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }
}
