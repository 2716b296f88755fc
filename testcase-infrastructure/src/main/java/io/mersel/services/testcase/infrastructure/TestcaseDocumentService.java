package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.ITestcaseCodec;
import io.mersel.services.testcase.application.interfaces.ITestcaseDocumentService;
import io.mersel.services.testcase.application.interfaces.ValidationException;
import io.mersel.services.testcase.application.models.Attachment;
import io.mersel.services.testcase.application.models.AttachmentUpload;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.Note;
import io.mersel.services.testcase.application.models.TestCase;
import io.mersel.services.testcase.infrastructure.diagnostics.TestcaseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Tek TestCase belgesi üzerinde oku-değiştir-yaz işlemleri.
 * <p>
 * Her işlem dosyayı baştan okur, modeli değiştirir ve kanonik XML olarak geri yazar.
 * Kilitleme yoktur: aynı dosyaya eşzamanlı yazımlarda son yazan kazanır.
 */
@Service
public class TestcaseDocumentService implements ITestcaseDocumentService {

    private static final Logger log = LoggerFactory.getLogger(TestcaseDocumentService.class);

    private final ITestcaseCodec codec;
    private final AttachmentStorage attachmentStorage;
    private final TestcaseMetrics metrics;
    private final Clock clock;

    public TestcaseDocumentService(ITestcaseCodec codec, AttachmentStorage attachmentStorage,
                                   TestcaseMetrics metrics, Clock clock) {
        this.codec = codec;
        this.attachmentStorage = attachmentStorage;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public TestCase getTestcase(InstancePaths paths, String module, String category, String filename)
            throws DocumentNotFoundException, DocumentParseException, IOException {
        return read(testcaseFile(paths, module, category, filename));
    }

    @Override
    public void saveTestcase(InstancePaths paths, String module, String category, String filename,
                             TestCase testCase) throws IOException {
        Path file = testcaseFile(paths, module, category, filename);
        TestCase toWrite = testCase.id().isEmpty()
                ? testCase.withId(InstancePaths.cleanTestcaseId(filename))
                : testCase;
        write(file, toWrite);
        metrics.recordWrite("save");
        log.info("TestCase kaydedildi: {}/{}/{}", module, category, filename);
    }

    // ── Notlar ──

    @Override
    public List<Note> addNote(InstancePaths paths, String module, String category, String filename,
                              String text, String author)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Not metni boş olamaz");
        }

        Path file = testcaseFile(paths, module, category, filename);
        TestCase testCase = read(file);

        var notes = new ArrayList<>(testCase.notes());
        notes.add(new Note(text.strip(), IsoTimestamps.now(clock), author));
        TestCase updated = testCase.withNotes(notes);
        write(file, updated);

        metrics.recordWrite("note_add");
        log.info("Not eklendi: {}/{}/{} (toplam {})", module, category, filename, notes.size());
        return updated.notes();
    }

    @Override
    public List<Note> deleteNote(InstancePaths paths, String module, String category, String filename, int index)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException {
        Path file = testcaseFile(paths, module, category, filename);
        TestCase testCase = read(file);

        if (index < 0 || index >= testCase.notes().size()) {
            throw new ValidationException("Not bulunamadı: indeks " + index
                    + " (toplam " + testCase.notes().size() + ")");
        }

        var notes = new ArrayList<>(testCase.notes());
        notes.remove(index);
        TestCase updated = testCase.withNotes(notes);
        write(file, updated);

        metrics.recordWrite("note_delete");
        log.info("Not silindi: {}/{}/{} indeks={}", module, category, filename, index);
        return updated.notes();
    }

    // ── Ekler ──

    @Override
    public Attachment addAttachment(InstancePaths paths, String module, String category, String testcaseId,
                                    AttachmentUpload upload)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException {
        Path file = testcaseFile(paths, module, category, xmlFilename(testcaseId));
        TestCase testCase = read(file);

        Attachment attachment = attachmentStorage.store(paths, testcaseId, upload);
        try {
            var attachments = new ArrayList<>(testCase.attachments());
            attachments.add(attachment);
            write(file, testCase.withAttachments(attachments));
        } catch (IOException | RuntimeException e) {
            log.warn("TestCase güncellenemedi, yüklenen ek geri alınıyor: {}", attachment.filename());
            attachmentStorage.delete(paths, testcaseId, attachment.filename());
            throw e;
        }

        metrics.recordWrite("attachment_add");
        log.info("Ek eklendi: {}/{}/{} -> {}", module, category, testcaseId, attachment.filename());
        return attachment;
    }

    @Override
    public List<Attachment> deleteAttachment(InstancePaths paths, String module, String category, String testcaseId,
                                             String attachmentFilename)
            throws DocumentNotFoundException, DocumentParseException, IOException {
        Path file = testcaseFile(paths, module, category, xmlFilename(testcaseId));
        TestCase testCase = read(file);

        var attachments = new ArrayList<>(testCase.attachments());
        boolean removed = attachments.removeIf(a -> a.filename().equals(attachmentFilename));
        if (!removed) {
            throw new DocumentNotFoundException("Ek TestCase içinde bulunamadı: " + attachmentFilename);
        }

        TestCase updated = testCase.withAttachments(attachments);
        write(file, updated);
        attachmentStorage.delete(paths, testcaseId, attachmentFilename);

        metrics.recordWrite("attachment_delete");
        log.info("Ek silindi: {}/{}/{} -> {}", module, category, testcaseId, attachmentFilename);
        return updated.attachments();
    }

    @Override
    public Path resolveAttachment(InstancePaths paths, String testcaseId, String attachmentFilename)
            throws DocumentNotFoundException {
        return attachmentStorage.locate(paths, testcaseId, attachmentFilename);
    }

    // ── Yardımcılar ──

    private TestCase read(Path file) throws DocumentNotFoundException, DocumentParseException, IOException {
        if (!Files.isRegularFile(file)) {
            throw new DocumentNotFoundException("TestCase bulunamadı: " + file.getFileName());
        }
        return codec.parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    private void write(Path file, TestCase testCase) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, codec.write(testCase), StandardCharsets.UTF_8);
        log.debug("TestCase yazıldı: {}", file);
    }

    private static Path testcaseFile(InstancePaths paths, String module, String category, String filename) {
        return InstancePathResolver.resolveWithin(paths.testcasesPath(), module, category, filename);
    }

    /**
     * Hem {@code II_EXF_01} hem {@code II_EXF_01.xml} kabul edilir.
     */
    static String xmlFilename(String testcaseId) {
        return testcaseId.endsWith(".xml") ? testcaseId : testcaseId + ".xml";
    }
}
