package io.mersel.services.testcase.web.controllers;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.IInstancePathResolver;
import io.mersel.services.testcase.application.interfaces.IReportService;
import io.mersel.services.testcase.application.models.ReportDocument;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Rapor verisi dışa aktarımı.
 * <p>
 * Profil filtreli, varyant gruplamalı ve boşluk tespitli rapor verisini JSON olarak döner.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Export", description = "Rapor verisi dışa aktarımı")
public class ExportController {

    private final IInstancePathResolver pathResolver;
    private final IReportService reportService;

    public ExportController(IInstancePathResolver pathResolver, IReportService reportService) {
        this.pathResolver = pathResolver;
        this.reportService = reportService;
    }

    @Operation(summary = "Rapor verisi",
            description = """
                    Aktif profillere göre filtrelenmiş modül/kategori ağacını döner. Her kategori,
                    varyant grupları (`group-start`/`group-end`) ve numara boşlukları (`base-gap`,
                    `variant-gap`) ile sıralanmış girdi dizisini taşır.

                    `filterMode` verilmezse instance'ın şablon ayarı, o da yoksa `OR` kullanılır.
                    """)
    @GetMapping("/{instance}/export/report")
    public ResponseEntity<ReportDocument> report(
            @PathVariable String instance,
            @Parameter(description = "Virgülle ayrılmış aktif profiller", example = "BASIC,EXPORT")
            @RequestParam(name = "profiles", required = false) String profiles,
            @Parameter(description = "OR veya AND", example = "OR")
            @RequestParam(name = "filterMode", required = false) String filterMode)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        FilterMode mode = filterMode == null || filterMode.isBlank() ? null : FilterMode.fromValue(filterMode);
        return ResponseEntity.ok(reportService.buildReport(paths, parseProfiles(profiles), mode));
    }

    static List<String> parseProfiles(String profiles) {
        if (profiles == null || profiles.isBlank()) {
            return null;
        }
        return Arrays.stream(profiles.split(","))
                .map(String::strip)
                .filter(p -> !p.isEmpty())
                .toList();
    }
}
