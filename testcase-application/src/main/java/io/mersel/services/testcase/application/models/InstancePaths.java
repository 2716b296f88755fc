package io.mersel.services.testcase.application.models;

import java.nio.file.Path;

/**
 * Doğrulanmış instance dizinleri.
 *
 * @param instanceName  Instance adı
 * @param instancePath  Instance kök dizini (ekler burada)
 * @param testcasesPath TestCase ağacının kökü
 */
public record InstancePaths(String instanceName, Path instancePath, Path testcasesPath) {

    public static final String ATTACHMENTS_DIR = "_attachments";

    /**
     * Ek dizini adı için kimlikten {@code .xml} uzantısını çıkarır.
     */
    public static String cleanTestcaseId(String testcaseId) {
        if (testcaseId == null) {
            return "";
        }
        return testcaseId.endsWith(".xml")
                ? testcaseId.substring(0, testcaseId.length() - 4)
                : testcaseId;
    }
}
