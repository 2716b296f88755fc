package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.FilterMode;

import java.util.List;

/**
 * Rapor oluşturucunun (PDF/DOCX) tükettiği veri.
 * <p>
 * Her kategori, varyant gruplaması ve boşluk tespiti uygulanmış girdi dizisini taşır;
 * oluşturucu ek filtreleme veya gruplama yapmaz.
 *
 * @param instance       Instance adı
 * @param generatedAt    ISO-8601 oluşturulma zamanı
 * @param activeProfiles Uygulanan profil filtresi
 * @param filterMode     Uygulanan filtre modu
 * @param productName    Profil meta verisindeki ürün adı
 * @param statistics     Genel istatistikler
 * @param modules        Modüller
 */
public record ReportDocument(
        String instance,
        String generatedAt,
        List<String> activeProfiles,
        FilterMode filterMode,
        String productName,
        StatusStatistics statistics,
        List<Module> modules
) {

    public ReportDocument {
        activeProfiles = ModelDefaults.list(activeProfiles);
        modules = ModelDefaults.list(modules);
    }

    public record Module(String name, StatusStatistics statistics, List<Category> categories) {

        public Module {
            categories = ModelDefaults.list(categories);
        }
    }

    public record Category(
            String name,
            StatusStatistics statistics,
            List<GroupedEntry<ReportTestcase>> entries
    ) {

        public Category {
            entries = ModelDefaults.list(entries);
        }
    }
}
