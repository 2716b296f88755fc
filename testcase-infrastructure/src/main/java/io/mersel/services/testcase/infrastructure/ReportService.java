package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationService;
import io.mersel.services.testcase.application.interfaces.IReportService;
import io.mersel.services.testcase.application.interfaces.ITestcaseAggregationService;
import io.mersel.services.testcase.application.interfaces.IVariantGroupingService;
import io.mersel.services.testcase.application.models.DetailedReport;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileConfigurationState;
import io.mersel.services.testcase.application.models.ReportCategory;
import io.mersel.services.testcase.application.models.ReportDocument;
import io.mersel.services.testcase.application.models.ReportModule;
import io.mersel.services.testcase.application.models.ReportTestcase;
import io.mersel.services.testcase.infrastructure.diagnostics.TestcaseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Rapor oluşturucu için filtrelenmiş ve varyant gruplaması uygulanmış veri hazırlar.
 */
@Service
public class ReportService implements IReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final ITestcaseAggregationService aggregationService;
    private final IVariantGroupingService groupingService;
    private final IProfileConfigurationService profileConfigurationService;
    private final TestcaseMetrics metrics;
    private final Clock clock;

    public ReportService(ITestcaseAggregationService aggregationService,
                         IVariantGroupingService groupingService,
                         IProfileConfigurationService profileConfigurationService,
                         TestcaseMetrics metrics,
                         Clock clock) {
        this.aggregationService = aggregationService;
        this.groupingService = groupingService;
        this.profileConfigurationService = profileConfigurationService;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public ReportDocument buildReport(InstancePaths paths, List<String> activeProfiles, FilterMode filterMode)
            throws IOException {
        long start = clock.millis();

        ProfileConfiguration configuration = loadConfiguration(paths);
        FilterMode mode = filterMode;
        if (mode == null) {
            mode = configuration != null
                    ? configuration.templateConfiguration().profileFilterMode()
                    : FilterMode.OR;
        }
        String productName = configuration != null ? configuration.metadata().productName() : "";

        DetailedReport detailed = aggregationService.collectDetailedTestcases(
                paths.testcasesPath(), activeProfiles, mode);

        var modules = new ArrayList<ReportDocument.Module>();
        for (ReportModule module : detailed.modules()) {
            var categories = new ArrayList<ReportDocument.Category>();
            for (ReportCategory category : module.categories()) {
                categories.add(new ReportDocument.Category(
                        category.name(),
                        category.statistics(),
                        groupingService.group(category.testcases(), ReportTestcase::id)));
            }
            modules.add(new ReportDocument.Module(module.name(), module.statistics(), categories));
        }

        var report = new ReportDocument(
                paths.instanceName(),
                IsoTimestamps.now(clock),
                activeProfiles,
                mode,
                productName,
                detailed.statistics(),
                modules);

        long durationMs = clock.millis() - start;
        metrics.recordReportBuild(detailed.statistics().total(), durationMs);
        log.info("Rapor verisi hazırlandı: {} ({} TestCase, mod={}, {}ms)",
                paths.instanceName(), detailed.statistics().total(), mode, durationMs);
        return report;
    }

    /**
     * Rapor, bozuk profil yapılandırmasıyla da oluşturulabilmeli; bu durumda
     * filtre modu ve ürün adı varsayılana düşer.
     */
    private ProfileConfiguration loadConfiguration(InstancePaths paths) throws IOException {
        try {
            ProfileConfigurationState state = profileConfigurationService.load(paths);
            return state.exists() ? state.configuration() : null;
        } catch (DocumentParseException e) {
            log.warn("Rapor için profil yapılandırması okunamadı, varsayılanlar kullanılıyor: {}", e.getMessage());
            return null;
        }
    }
}
