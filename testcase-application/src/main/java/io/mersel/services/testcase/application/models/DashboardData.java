package io.mersel.services.testcase.application.models;

import java.util.List;
import java.util.Map;

/**
 * Pano istatistikleri ve son aktiviteler.
 * <p>
 * Sayımlar kök {@code status} attribute'una göre yapılır; notlar ve ekler
 * en yeniden eskiye sıralanır, zaman damgası olmayanlar sona düşer.
 */
public record DashboardData(
        int total,
        int passed,
        int failed,
        int skipped,
        int open,
        Map<String, StatusStatistics> byModule,
        Map<String, StatusStatistics> byProfile,
        List<RecentNote> recentNotes,
        List<RecentAttachment> recentAttachments
) {

    public DashboardData {
        byModule = ModelDefaults.orderedMap(byModule);
        byProfile = ModelDefaults.orderedMap(byProfile);
        recentNotes = ModelDefaults.list(recentNotes);
        recentAttachments = ModelDefaults.list(recentAttachments);
    }

    public record RecentNote(
            String testcaseId,
            String module,
            String category,
            String filename,
            String text,
            String timestamp
    ) {
    }

    public record RecentAttachment(
            String testcaseId,
            String module,
            String category,
            String testcaseFilename,
            String filename,
            String originalName,
            String mimeType,
            String timestamp
    ) {
    }
}
