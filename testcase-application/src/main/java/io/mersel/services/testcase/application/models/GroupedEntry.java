package io.mersel.services.testcase.application.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.testcase.application.enums.GroupedEntryType;

/**
 * Rapor sıralamasında tek bir girdi: TestCase, grup sınırı veya boşluk bildirimi.
 * <p>
 * Tipe göre yalnızca ilgili alanlar doludur; diğerleri {@code null} kalır ve JSON
 * çıktısına yazılmaz.
 *
 * @param <T> TestCase özet tipi
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupedEntry<T>(
        GroupedEntryType type,
        T testcase,
        Boolean isInGroup,
        Boolean isBase,
        Boolean isVariant,
        String variant,
        String baseId,
        Integer variantCount,
        String prefix,
        Integer fromNumber,
        Integer toNumber,
        String fromId,
        String toId,
        String from,
        String to,
        Integer missingCount
) {

    // ── Fabrika metotları ──

    public static <T> GroupedEntry<T> ofTestcase(T testcase) {
        return new GroupedEntry<>(GroupedEntryType.TESTCASE, testcase, false, null, null,
                null, null, null, null, null, null, null, null, null, null, null);
    }

    public static <T> GroupedEntry<T> baseMember(T testcase) {
        return new GroupedEntry<>(GroupedEntryType.TESTCASE, testcase, true, true, null,
                null, null, null, null, null, null, null, null, null, null, null);
    }

    public static <T> GroupedEntry<T> variantMember(T testcase, String variant) {
        return new GroupedEntry<>(GroupedEntryType.TESTCASE, testcase, true, null, true,
                variant, null, null, null, null, null, null, null, null, null, null);
    }

    public static <T> GroupedEntry<T> groupStart(String baseId, int variantCount) {
        return new GroupedEntry<>(GroupedEntryType.GROUP_START, null, null, null, null,
                null, baseId, variantCount, null, null, null, null, null, null, null, null);
    }

    public static <T> GroupedEntry<T> groupEnd(String baseId) {
        return new GroupedEntry<>(GroupedEntryType.GROUP_END, null, null, null, null,
                null, baseId, null, null, null, null, null, null, null, null, null);
    }

    public static <T> GroupedEntry<T> baseGap(String prefix, int fromNumber, int toNumber,
                                              String fromId, String toId) {
        return new GroupedEntry<>(GroupedEntryType.BASE_GAP, null, null, null, null,
                null, null, null, prefix, fromNumber, toNumber, fromId, toId, null, null,
                toNumber - fromNumber - 1);
    }

    public static <T> GroupedEntry<T> variantGap(String baseId, String from, String to, int missingCount) {
        return new GroupedEntry<>(GroupedEntryType.VARIANT_GAP, null, null, null, null,
                null, baseId, null, null, null, null, null, null, from, to, missingCount);
    }
}
