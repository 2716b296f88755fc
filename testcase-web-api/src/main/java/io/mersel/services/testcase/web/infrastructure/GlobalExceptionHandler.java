package io.mersel.services.testcase.web.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Global hata yöneticisi: RFC 7807 Problem Details.
 * <p>
 * Tüm controller'lardan çıkan istisnaları tutarlı bir JSON formatta döner:
 * <pre>
 * {
 *   "type": "https://mersel.io/testcase/errors/not-found",
 *   "title": "Belge Bulunamadı",
 *   "status": 404,
 *   "detail": "TestCase bulunamadı: MOD_A/CAT_1/TC_01.xml"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://mersel.io/testcase/errors/";

    /**
     * İş kuralı doğrulama hatası (boş not, geçersiz not indeksi, izin verilmeyen MIME tipi) → 400.
     */
    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleValidationException(ValidationException ex) {
        log.warn("Doğrulama hatası: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "validation-error", "Doğrulama Hatası");
    }

    /**
     * Instance, TestCase veya ek bulunamadı → 404 Not Found.
     */
    @ExceptionHandler(DocumentNotFoundException.class)
    public ProblemDetail handleNotFound(DocumentNotFoundException ex) {
        log.warn("Bulunamadı: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Belge Bulunamadı");
    }

    /**
     * Okunamayan XML belgesi → 500. Ayrıştırma mesajı istemciye iletilir.
     */
    @ExceptionHandler(DocumentParseException.class)
    public ProblemDetail handleParseException(DocumentParseException ex) {
        log.error("Belge ayrıştırılamadı [{}]: {}", ex.getSource(), ex.getMessage());
        var problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(),
                "document-parse-failed", "Belge Okunamadı");
        problem.setProperty("source", ex.getSource());
        return problem;
    }

    /**
     * Dosya boyutu aşımı → 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Dosya boyutu aşımı: {}", ex.getMessage());
        return problem(HttpStatus.PAYLOAD_TOO_LARGE,
                "Yüklenen dosya boyutu izin verilen sınırı aşıyor",
                "payload-too-large", "Dosya Boyutu Aşımı");
    }

    /**
     * Genel istek hatası (örn: geçersiz instance adı) → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Geçersiz İstek");
    }

    /**
     * Kök dizin dışına çıkan yol → 400 Bad Request.
     */
    @ExceptionHandler(SecurityException.class)
    public ProblemDetail handleSecurityException(SecurityException ex) {
        log.warn("Geçersiz yol: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid-path", "Geçersiz Yol");
    }

    /**
     * Eksik parametre/parça, okunamayan gövde veya tip uyuşmazlığı → 400 Bad Request.
     */
    @ExceptionHandler({
            MissingServletRequestPartException.class,
            ServletRequestBindingException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleMalformedRequest(Exception ex) {
        log.warn("Hatalı istek: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "İstek eksik veya hatalı biçimlendirilmiş",
                "bad-request", "Geçersiz İstek");
    }

    /**
     * Bean Validation hatası → 400 Bad Request.
     * Jakarta @Valid / @NotBlank / @Size gibi annotation hataları.
     */
    @ExceptionHandler(BindException.class)
    public ProblemDetail handleBindException(BindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Doğrulama hatası: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, detail, "validation-error", "Doğrulama Hatası");
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.",
                "internal-error", "Sunucu Hatası");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        var problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_BASE_URI + type));
        problem.setTitle(title);
        return problem;
    }
}
