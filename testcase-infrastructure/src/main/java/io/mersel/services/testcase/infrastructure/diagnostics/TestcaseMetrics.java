package io.mersel.services.testcase.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * TestCase servisi özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılır.
 */
@Component
public class TestcaseMetrics {

    private final MeterRegistry registry;

    public TestcaseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Ağaç taraması sırasında atlanan (okunamayan veya ayrıştırılamayan) dosyayı kaydet.
     *
     * @param documentType "testcase" veya "profiles"
     */
    public void recordParseFailure(String documentType) {
        Counter.builder("testcase_document_parse_failures_total")
                .tag("document_type", documentType)
                .description("Ayrıştırılamayan belge sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Ağaç taraması sırasında listelenemediği için atlanan modül veya kategori dizinini kaydet.
     */
    public void recordSkippedDirectory() {
        Counter.builder("testcase_directory_skips_total")
                .description("Listelenemeyen dizin sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Belge yazma işlemini kaydet.
     *
     * @param operation "save", "note_add", "note_delete", "attachment_add", "attachment_delete",
     *                  "profiles_save" veya "profiles_reset"
     */
    public void recordWrite(String operation) {
        Counter.builder("testcase_document_writes_total")
                .tag("operation", operation)
                .description("Belge yazma sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Rapor verisi oluşturma metrikleri kaydet.
     *
     * @param testcaseCount Rapora giren TestCase sayısı
     * @param durationMs    Oluşturma süresi (milisaniye)
     */
    public void recordReportBuild(int testcaseCount, long durationMs) {
        Counter.builder("testcase_report_builds_total")
                .description("Rapor oluşturma sayısı")
                .register(registry)
                .increment();

        Timer.builder("testcase_report_build_duration")
                .description("Rapor oluşturma süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));

        registry.summary("testcase_report_testcases").record(testcaseCount);
    }
}
