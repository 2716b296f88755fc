package io.mersel.services.testcase.application.models;

/**
 * Test edilen ürüne ait serbest metin meta verileri. Tüm alanlar isteğe bağlıdır.
 */
public record ProfileMetadata(
        String productName,
        String manufacturer,
        String productVersion,
        String description,
        String testDate,
        String tester
) {

    public ProfileMetadata {
        productName = ModelDefaults.text(productName);
        manufacturer = ModelDefaults.text(manufacturer);
        productVersion = ModelDefaults.text(productVersion);
        description = ModelDefaults.text(description);
        testDate = ModelDefaults.text(testDate);
        tester = ModelDefaults.text(tester);
    }

    public static ProfileMetadata empty() {
        return new ProfileMetadata(null, null, null, null, null, null);
    }
}
