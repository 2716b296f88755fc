package io.mersel.services.testcase.web.controllers;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IInstancePathResolver;
import io.mersel.services.testcase.application.interfaces.ITestcaseDocumentService;
import io.mersel.services.testcase.application.interfaces.ValidationException;
import io.mersel.services.testcase.application.models.AttachmentUpload;
import io.mersel.services.testcase.web.dto.AttachmentResponse;
import io.mersel.services.testcase.web.dto.NoteRequestDto;
import io.mersel.services.testcase.web.dto.NoteResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * TestCase notları ve dosya ekleri.
 * <p>
 * Notlar ve ek kayıtları TestCase XML belgesinin içinde tutulur; ek dosyaları ise
 * instance kökündeki {@code _attachments/<testcaseId>/} dizinine yazılır.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Notes & Attachments", description = "TestCase notları ve dosya ekleri")
public class NotesAttachmentsController {

    private final IInstancePathResolver pathResolver;
    private final ITestcaseDocumentService documentService;

    public NotesAttachmentsController(IInstancePathResolver pathResolver,
                                      ITestcaseDocumentService documentService) {
        this.pathResolver = pathResolver;
        this.documentService = documentService;
    }

    // ── Notlar ──────────────────────────────────────────────────────

    @Operation(summary = "Not ekle", description = "Zaman damgası sunucu saatinden atanır.")
    @PostMapping("/{instance}/testcase/{module}/{category}/{filename}/notes")
    public ResponseEntity<NoteResponse> addNote(@PathVariable String instance,
                                                @PathVariable String module,
                                                @PathVariable String category,
                                                @PathVariable String filename,
                                                @RequestBody @Valid NoteRequestDto request)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException {
        var paths = pathResolver.resolve(instance);
        var notes = documentService.addNote(paths, module, category, filename,
                request.getText(), request.getAuthor());
        return ResponseEntity.ok(new NoteResponse(true, notes.get(notes.size() - 1), notes));
    }

    @Operation(summary = "Not sil", description = "Not, listedeki 0 tabanlı sırasına göre silinir.")
    @DeleteMapping("/{instance}/testcase/{module}/{category}/{filename}/notes/{index}")
    public ResponseEntity<NoteResponse> deleteNote(@PathVariable String instance,
                                                   @PathVariable String module,
                                                   @PathVariable String category,
                                                   @PathVariable String filename,
                                                   @PathVariable int index)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException {
        var paths = pathResolver.resolve(instance);
        var notes = documentService.deleteNote(paths, module, category, filename, index);
        return ResponseEntity.ok(new NoteResponse(true, null, notes));
    }

    // ── Ekler ───────────────────────────────────────────────────────

    @Operation(summary = "Ek yükle",
            description = "`testcaseId` hem `TC_01` hem `TC_01.xml` biçiminde verilebilir. "
                    + "MIME tipi yapılandırılmış izin listesinde olmalıdır.")
    @PostMapping(value = "/{instance}/testcase/{module}/{category}/{testcaseId}/attachments",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AttachmentResponse> addAttachment(@PathVariable String instance,
                                                            @PathVariable String module,
                                                            @PathVariable String category,
                                                            @PathVariable String testcaseId,
                                                            @RequestParam("file") MultipartFile file,
                                                            @RequestParam(name = "description", required = false)
                                                            String description)
            throws ValidationException, DocumentNotFoundException, DocumentParseException, IOException {
        var paths = pathResolver.resolve(instance);
        var upload = new AttachmentUpload(file.getOriginalFilename(), file.getContentType(),
                description, file.getBytes());
        var attachment = documentService.addAttachment(paths, module, category, testcaseId, upload);
        var testcase = documentService.getTestcase(paths, module, category, xmlFilename(testcaseId));
        return ResponseEntity.ok(new AttachmentResponse(true, attachment, testcase.attachments()));
    }

    @Operation(summary = "Ek sil", description = "Ek kaydı belgeden, dosyası diskten silinir.")
    @DeleteMapping("/{instance}/testcase/{module}/{category}/{testcaseId}/attachments/{filename}")
    public ResponseEntity<AttachmentResponse> deleteAttachment(@PathVariable String instance,
                                                               @PathVariable String module,
                                                               @PathVariable String category,
                                                               @PathVariable String testcaseId,
                                                               @PathVariable String filename)
            throws DocumentNotFoundException, DocumentParseException, IOException {
        var paths = pathResolver.resolve(instance);
        var attachments = documentService.deleteAttachment(paths, module, category, testcaseId, filename);
        return ResponseEntity.ok(new AttachmentResponse(true, null, attachments));
    }

    @Operation(summary = "Ek indir")
    @GetMapping("/{instance}/attachments/{testcaseId}/{filename}")
    public ResponseEntity<Resource> downloadAttachment(@PathVariable String instance,
                                                       @PathVariable String testcaseId,
                                                       @PathVariable String filename)
            throws DocumentNotFoundException {
        var paths = pathResolver.resolve(instance);
        var file = documentService.resolveAttachment(paths, testcaseId, filename);
        var resource = new FileSystemResource(file);
        var contentType = MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);
        var disposition = ContentDisposition.inline()
                .filename(file.getFileName().toString(), StandardCharsets.UTF_8)
                .build();

        return ResponseEntity.ok()
                .contentType(contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(resource);
    }

    private static String xmlFilename(String testcaseId) {
        return testcaseId.endsWith(".xml") ? testcaseId : testcaseId + ".xml";
    }
}
