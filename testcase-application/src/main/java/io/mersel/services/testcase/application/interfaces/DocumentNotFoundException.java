package io.mersel.services.testcase.application.interfaces;

/**
 * Başvurulan dosya (TestCase, ek veya instance dizini) bulunamadığında fırlatılan istisna.
 */
public class DocumentNotFoundException extends Exception {

    public DocumentNotFoundException(String message) {
        super(message);
    }

    public DocumentNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
