package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Modül ağacı ve genel toplamlar.
 */
public record DetailedReport(List<ReportModule> modules, StatusStatistics statistics) {

    public DetailedReport {
        modules = ModelDefaults.list(modules);
        statistics = statistics != null ? statistics : StatusStatistics.empty();
    }
}
