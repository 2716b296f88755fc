package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Modül bazında filtrelenmiş kategori listesi.
 */
public record ReportModule(
        String name,
        List<ReportCategory> categories,
        StatusStatistics statistics
) {

    public ReportModule {
        categories = ModelDefaults.list(categories);
        statistics = statistics != null ? statistics : StatusStatistics.empty();
    }
}
