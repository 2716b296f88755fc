package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.ReportDocument;

import java.io.IOException;
import java.util.List;

/**
 * Rapor oluşturucuya verilecek veriyi hazırlar (filtrelenmiş ağaç + varyant gruplaması).
 */
public interface IReportService {

    /**
     * @param activeProfiles profil filtresi; {@code null} veya boş ise filtre yok
     * @param filterMode     {@code null} ise instance'ın şablon ayarı, o da yoksa OR
     */
    ReportDocument buildReport(InstancePaths paths, List<String> activeProfiles, FilterMode filterMode)
            throws IOException;
}
