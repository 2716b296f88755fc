package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.ValidationException;
import io.mersel.services.testcase.application.models.Attachment;
import io.mersel.services.testcase.application.models.AttachmentUpload;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.infrastructure.config.TestcaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Ek dosyalarının disk üzerindeki yönetimi.
 * <p>
 * Dosyalar {@code <instance>/_attachments/<testcaseId>/<epochMillis>-<güvenliAd>} olarak saklanır;
 * güvenli ad, {@code [a-zA-Z0-9._-]} dışındaki karakterlerin {@code _} ile değiştirilmesiyle elde edilir.
 */
@Component
public class AttachmentStorage {

    private static final Logger log = LoggerFactory.getLogger(AttachmentStorage.class);

    private final TestcaseProperties properties;
    private final Clock clock;

    public AttachmentStorage(TestcaseProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Yüklenen dosyayı doğrular ve diske yazar.
     *
     * @return diske yazılan ekin meta verisi
     * @throws ValidationException dosya boşsa veya MIME tipi izin listesinde değilse
     */
    public Attachment store(InstancePaths paths, String testcaseId, AttachmentUpload upload)
            throws ValidationException, IOException {
        if (upload == null || upload.content() == null || upload.content().length == 0) {
            throw new ValidationException("Yüklenecek dosya bulunamadı");
        }
        String mimeType = upload.mimeType() != null ? upload.mimeType() : "";
        if (!properties.getAttachments().getAllowedMimeTypes().contains(mimeType)) {
            throw new ValidationException("Dosya tipine izin verilmiyor: " + mimeType);
        }

        String originalName = upload.originalName() != null && !upload.originalName().isBlank()
                ? upload.originalName() : "attachment";
        String filename = clock.millis() + "-" + safeName(originalName);

        Path dir = attachmentsDir(paths, testcaseId);
        Files.createDirectories(dir);
        Path target = InstancePathResolver.resolveWithin(dir, filename);
        Files.write(target, upload.content());

        log.info("Ek kaydedildi: {} ({} bayt, {})", target, upload.size(), mimeType);
        return new Attachment(filename, originalName, IsoTimestamps.now(clock),
                upload.description(), mimeType, upload.size());
    }

    /**
     * İndirme için ek dosyasını bulur.
     *
     * @throws DocumentNotFoundException dosya yoksa
     */
    public Path locate(InstancePaths paths, String testcaseId, String filename) throws DocumentNotFoundException {
        Path file = InstancePathResolver.resolveWithin(attachmentsDir(paths, testcaseId), filename);
        if (!Files.isRegularFile(file)) {
            throw new DocumentNotFoundException("Ek dosyası bulunamadı: " + filename);
        }
        return file;
    }

    /**
     * Ek dosyasını siler. Silme başarısız olursa yalnızca loglanır; belge zaten güncellenmiştir.
     */
    public void delete(InstancePaths paths, String testcaseId, String filename) {
        try {
            Path file = InstancePathResolver.resolveWithin(attachmentsDir(paths, testcaseId), filename);
            if (Files.deleteIfExists(file)) {
                log.info("Ek dosyası silindi: {}", file);
            }
        } catch (IOException | SecurityException e) {
            log.warn("Ek dosyası silinemedi: {} ({})", filename, e.getMessage());
        }
    }

    static String safeName(String originalName) {
        return originalName.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static Path attachmentsDir(InstancePaths paths, String testcaseId) {
        String cleanId = InstancePaths.cleanTestcaseId(testcaseId);
        return InstancePathResolver.resolveWithin(paths.instancePath(), InstancePaths.ATTACHMENTS_DIR, cleanId);
    }
}
