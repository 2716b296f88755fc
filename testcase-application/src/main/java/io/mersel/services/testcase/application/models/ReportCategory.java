package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Kategori bazında filtrelenmiş TestCase listesi.
 *
 * @param name       Kategori dizin adı
 * @param testcases  Kimliğe göre sıralı TestCase özetleri
 * @param statistics Kategori istatistikleri
 */
public record ReportCategory(
        String name,
        List<ReportTestcase> testcases,
        StatusStatistics statistics
) {

    public ReportCategory {
        testcases = ModelDefaults.list(testcases);
        statistics = statistics != null ? statistics : StatusStatistics.empty();
    }
}
