package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.Attachment;
import io.mersel.services.testcase.application.models.AttachmentUpload;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.Note;
import io.mersel.services.testcase.application.models.TestCase;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Tek bir TestCase belgesi üzerinde oku-değiştir-yaz işlemleri.
 * <p>
 * İşlemler transactional değildir; aynı dosyaya eşzamanlı yazımlarda son yazan kazanır.
 * Hatalar çağırana olduğu gibi iletilir.
 */
public interface ITestcaseDocumentService {

    TestCase getTestcase(InstancePaths paths, String module, String category, String filename)
            throws DocumentNotFoundException, DocumentParseException, IOException;

    void saveTestcase(InstancePaths paths, String module, String category, String filename, TestCase testCase)
            throws IOException;

    /**
     * @return güncel not listesi
     * @throws ValidationException not metni boşsa
     */
    List<Note> addNote(InstancePaths paths, String module, String category, String filename,
                       String text, String author)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException;

    /**
     * @return güncel not listesi
     * @throws ValidationException indeks aralık dışındaysa
     */
    List<Note> deleteNote(InstancePaths paths, String module, String category, String filename, int index)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException;

    /**
     * Eki diske yazar ve meta verisini belgeye ekler. Belge güncellenemezse
     * yazılan dosya geri silinir.
     *
     * @return eklenen ek meta verisi
     * @throws ValidationException MIME tipi izin listesinde değilse veya dosya boşsa
     */
    Attachment addAttachment(InstancePaths paths, String module, String category, String testcaseId,
                             AttachmentUpload upload)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException;

    /**
     * @return güncel ek listesi
     * @throws DocumentNotFoundException ek belgede yoksa
     */
    List<Attachment> deleteAttachment(InstancePaths paths, String module, String category, String testcaseId,
                                      String attachmentFilename)
            throws DocumentNotFoundException, DocumentParseException, IOException;

    /**
     * @return indirilecek ek dosyasının yolu
     * @throws DocumentNotFoundException dosya yoksa
     */
    Path resolveAttachment(InstancePaths paths, String testcaseId, String attachmentFilename)
            throws DocumentNotFoundException;
}
