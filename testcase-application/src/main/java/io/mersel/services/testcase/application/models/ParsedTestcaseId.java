package io.mersel.services.testcase.application.models;

/**
 * Yapısal olarak ayrıştırılmış TestCase kimliği.
 * <p>
 * Varyant biçiminde {@code baseId = prefix + number} (rakamlar yazıldığı gibi),
 * temel biçimde ise {@code baseId} orijinal kimliğin kendisidir.
 *
 * @param prefix     Sondaki alt çizgi dahil önek (örn: "II_EXF_")
 * @param number     Sayısal kısım, yapısız kimliklerde 0
 * @param variant    Harf varyantı (örn: "A", "AB"), yoksa {@code null}
 * @param baseId     Temel kimlik
 * @param hasVariant Varyant içeriyor mu
 */
public record ParsedTestcaseId(
        String prefix,
        int number,
        String variant,
        String baseId,
        boolean hasVariant
) {
}
