package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.TestStatus;
import io.mersel.services.testcase.application.models.StatusStatistics;

/**
 * Tek bir tarama boyunca biriken durum sayaçları. {@code null} durum açık sayılır.
 */
final class StatusCounter {

    private int passed;
    private int failed;
    private int skipped;
    private int open;

    void add(TestStatus status) {
        if (status == null) {
            open++;
            return;
        }
        switch (status) {
            case PASSED -> passed++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
        }
    }

    int total() {
        return passed + failed + skipped + open;
    }

    StatusStatistics toStatistics() {
        return StatusStatistics.of(passed, failed, skipped, open);
    }
}
