package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.models.DashboardData;
import io.mersel.services.testcase.application.models.DetailedReport;
import io.mersel.services.testcase.application.models.FolderStructure;
import io.mersel.services.testcase.application.models.HashtagIndex;
import io.mersel.services.testcase.application.models.ReportModule;
import io.mersel.services.testcase.application.models.SearchResult;
import io.mersel.services.testcase.application.models.TagGroup;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Modül/kategori/TestCase ağacını tarayıp filtreleyen ve sayan servis.
 * <p>
 * Tek bir dosyanın ayrıştırma hatası taramayı durdurmaz; dosya loglanır ve atlanır.
 * Çıktı, değişmemiş bir ağaç üzerinde her çağrıda aynı sıradadır.
 * {@link IOException} yalnızca dizin listelenemediğinde fırlatılır.
 */
public interface ITestcaseAggregationService {

    /**
     * @param testcasesRoot  ağaç kökü
     * @param activeProfiles aktif profiller; {@code null} veya boş ise filtre uygulanmaz
     * @param filterMode     profil filtresi modu
     */
    List<ReportModule> collectAllTestcases(Path testcasesRoot, List<String> activeProfiles,
                                           FilterMode filterMode) throws IOException;

    DetailedReport collectDetailedTestcases(Path testcasesRoot, List<String> activeProfiles,
                                            FilterMode filterMode) throws IOException;

    FolderStructure readFolderStructure(Path testcasesRoot) throws IOException;

    List<SearchResult> search(Path testcasesRoot, String query) throws IOException;

    DashboardData getDashboard(Path testcasesRoot) throws IOException;

    /**
     * @return profil adına göre sıralı profil grupları
     */
    Map<String, TagGroup> getProfilesStructure(Path testcasesRoot) throws IOException;

    HashtagIndex getHashtagsStructure(Path testcasesRoot) throws IOException;
}
