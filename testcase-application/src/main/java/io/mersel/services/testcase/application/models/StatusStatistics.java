package io.mersel.services.testcase.application.models;

/**
 * Durum sayaçları ve ilerleme yüzdesi.
 * <p>
 * {@code progress = round(100 * (passed + skipped) / total)}, toplam 0 ise 0.
 */
public record StatusStatistics(
        int total,
        int passed,
        int failed,
        int skipped,
        int open,
        int progress
) {

    public static StatusStatistics of(int passed, int failed, int skipped, int open) {
        int total = passed + failed + skipped + open;
        return new StatusStatistics(total, passed, failed, skipped, open, progress(passed, skipped, total));
    }

    public static StatusStatistics empty() {
        return new StatusStatistics(0, 0, 0, 0, 0, 0);
    }

    public static int progress(int passed, int skipped, int total) {
        if (total == 0) {
            return 0;
        }
        return (int) Math.round(100.0 * (passed + skipped) / total);
    }
}
