package io.mersel.services.testcase.application.interfaces;

/**
 * XML belgesi bozuk olduğunda veya beklenen kök elemanı taşımadığında fırlatılan istisna.
 * <p>
 * Kaynak (dosya yolu veya kimlik) her zaman taşınır. Tekil belge işlemleri bu istisnayı
 * çağırana iletir; ağaç taramaları dosyayı loglayıp atlar.
 */
public class DocumentParseException extends Exception {

    private final String source;

    public DocumentParseException(String source, String message) {
        super(message);
        this.source = source;
    }

    public DocumentParseException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * @return hatalı belgenin dosya yolu veya kimliği
     */
    public String getSource() {
        return source;
    }
}
