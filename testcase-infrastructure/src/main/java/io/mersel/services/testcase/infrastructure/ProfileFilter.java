package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.FilterMode;

import java.util.HashSet;
import java.util.List;

/**
 * Aktif profil filtresi.
 * <ul>
 *   <li>Aktif profil listesi {@code null} veya boşsa filtre uygulanmaz</li>
 *   <li>Profili olmayan TestCase'ler her zaman geçer</li>
 *   <li>AND: TestCase profillerinin tümü aktif olmalı; OR: en az biri</li>
 * </ul>
 */
final class ProfileFilter {

    private ProfileFilter() {
    }

    static boolean matches(List<String> testcaseProfiles, List<String> activeProfiles, FilterMode mode) {
        if (activeProfiles == null || activeProfiles.isEmpty()) {
            return true;
        }
        if (testcaseProfiles == null || testcaseProfiles.isEmpty()) {
            return true;
        }
        var active = new HashSet<>(activeProfiles);
        if (mode == FilterMode.AND) {
            return active.containsAll(testcaseProfiles);
        }
        return testcaseProfiles.stream().anyMatch(active::contains);
    }
}
