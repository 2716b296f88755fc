package io.mersel.services.testcase.web.controllers;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IInstancePathResolver;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationService;
import io.mersel.services.testcase.application.interfaces.ITestcaseAggregationService;
import io.mersel.services.testcase.application.interfaces.ITestcaseDocumentService;
import io.mersel.services.testcase.application.models.DashboardData;
import io.mersel.services.testcase.application.models.FolderStructure;
import io.mersel.services.testcase.application.models.InstanceInfo;
import io.mersel.services.testcase.application.models.TestCase;
import io.mersel.services.testcase.web.dto.OperationResponse;
import io.mersel.services.testcase.web.dto.SearchResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

/**
 * Instance bilgisi, ağaç görünümü, arama, dashboard ve tekil TestCase okuma/yazma endpoint'leri.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "TestCases", description = "TestCase ağacı ve belge işlemleri")
public class TestcaseController {

    private static final Logger log = LoggerFactory.getLogger(TestcaseController.class);

    private final IInstancePathResolver pathResolver;
    private final ITestcaseAggregationService aggregationService;
    private final ITestcaseDocumentService documentService;
    private final IProfileConfigurationService profileConfigurationService;

    public TestcaseController(IInstancePathResolver pathResolver,
                              ITestcaseAggregationService aggregationService,
                              ITestcaseDocumentService documentService,
                              IProfileConfigurationService profileConfigurationService) {
        this.pathResolver = pathResolver;
        this.aggregationService = aggregationService;
        this.documentService = documentService;
        this.profileConfigurationService = profileConfigurationService;
    }

    @Operation(summary = "Instance bilgisi",
            description = "Instance adı ve yolu; profil meta verisinden ürün adı, üretici ve sürüm.")
    @GetMapping("/{instance}/info")
    public ResponseEntity<InstanceInfo> info(@PathVariable String instance) throws DocumentNotFoundException {
        var paths = pathResolver.resolve(instance);
        return ResponseEntity.ok(profileConfigurationService.getInstanceInfo(paths));
    }

    @Operation(summary = "Modül / kategori / TestCase ağacı",
            description = "Okunamayan dosyalar `error=true` ile işaretlenmiş yer tutucu olarak listelenir.")
    @GetMapping("/{instance}/structure")
    public ResponseEntity<FolderStructure> structure(@PathVariable String instance)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        return ResponseEntity.ok(aggregationService.readFolderStructure(paths.testcasesPath()));
    }

    @Operation(summary = "TestCase arama",
            description = "ID, başlık, amaç ve RefFunction/RefUser etiketlerinde büyük/küçük harf duyarsız arama.")
    @GetMapping("/{instance}/search")
    public ResponseEntity<SearchResponse> search(@PathVariable String instance,
                                                 @RequestParam(name = "q", required = false) String query)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        if (query == null || query.isBlank()) {
            return ResponseEntity.ok(new SearchResponse(List.of()));
        }
        return ResponseEntity.ok(new SearchResponse(aggregationService.search(paths.testcasesPath(), query)));
    }

    @Operation(summary = "Dashboard istatistikleri")
    @GetMapping("/{instance}/dashboard")
    public ResponseEntity<DashboardData> dashboard(@PathVariable String instance)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        return ResponseEntity.ok(aggregationService.getDashboard(paths.testcasesPath()));
    }

    @Operation(summary = "TestCase oku",
            description = "Eski biçimli belgeler güncel modele normalize edilerek döner.")
    @GetMapping("/{instance}/testcase/{module}/{category}/{filename}")
    public ResponseEntity<TestCase> getTestcase(@PathVariable String instance,
                                                @PathVariable String module,
                                                @PathVariable String category,
                                                @PathVariable String filename)
            throws DocumentNotFoundException, DocumentParseException, IOException {
        var paths = pathResolver.resolve(instance);
        return ResponseEntity.ok(documentService.getTestcase(paths, module, category, filename));
    }

    @Operation(summary = "TestCase kaydet",
            description = "Belge her zaman güncel biçimde yazılır; mevcut dosyanın üzerine yazılır.")
    @PutMapping("/{instance}/testcase/{module}/{category}/{filename}")
    public ResponseEntity<OperationResponse> saveTestcase(@PathVariable String instance,
                                                          @PathVariable String module,
                                                          @PathVariable String category,
                                                          @PathVariable String filename,
                                                          @RequestBody TestCase testCase)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        log.debug("TestCase kaydetme isteği: {}/{}/{}/{}", instance, module, category, filename);
        documentService.saveTestcase(paths, module, category, filename, testCase);
        return ResponseEntity.ok(new OperationResponse(true, "TestCase kaydedildi"));
    }
}
