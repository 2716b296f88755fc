package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.models.ParsedTestcaseId;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TestCase kimlik ayrıştırıcısı.
 * <p>
 * Desteklenen biçimler:
 * <ul>
 *   <li>{@code PREFIX_NN_HARF}: varyant (örn: {@code II_EXF_01_A}, {@code II_EXF_01_AB})</li>
 *   <li>{@code PREFIX_NN}: temel (örn: {@code II_EXF_01})</li>
 *   <li>diğerleri: yapısız, tüm kimlik önek kabul edilir ve numara 0 olur</li>
 * </ul>
 * Varyant harfleri 1 tabanlı bijektif 26 tabanında sayıya çevrilir
 * ({@code A=1, Z=26, AA=27, ZZ=702, AAA=703}).
 */
public final class TestcaseIdParser {

    private static final Pattern VARIANT_ID = Pattern.compile("^(.+_)(\\d+)_([A-Z]+)$");
    private static final Pattern BASE_ID = Pattern.compile("^(.+_)(\\d+)$");

    private TestcaseIdParser() {
    }

    /**
     * Kimliği ayrıştırır. Hiçbir girdi için hata fırlatmaz.
     * <p>
     * Varyant biçiminde {@code baseId} önek ile rakamların yazıldığı hâlinden kurulur;
     * temel biçimde kimliğin kendisidir.
     */
    public static ParsedTestcaseId parse(String id) {
        String value = id != null ? id : "";

        Matcher variant = VARIANT_ID.matcher(value);
        if (variant.matches()) {
            Integer number = toInt(variant.group(2));
            if (number != null) {
                return new ParsedTestcaseId(variant.group(1), number, variant.group(3),
                        variant.group(1) + variant.group(2), true);
            }
            return unstructured(value);
        }

        Matcher base = BASE_ID.matcher(value);
        if (base.matches()) {
            Integer number = toInt(base.group(2));
            if (number != null) {
                return new ParsedTestcaseId(base.group(1), number, null, value, false);
            }
        }
        return unstructured(value);
    }

    /**
     * Varyant harflerini sayıya çevirir.
     *
     * @return 1 tabanlı sıra; boş, {@code null} veya A-Z dışı karakter içeren girdi için 0.
     *         Taşmada {@link Integer#MAX_VALUE} döner.
     */
    public static int variantToNumber(String letters) {
        if (letters == null || letters.isEmpty()) {
            return 0;
        }
        long result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                return 0;
            }
            result = result * 26 + (c - 'A' + 1);
            if (result > Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
        }
        return (int) result;
    }

    /**
     * {@link #variantToNumber(String)} fonksiyonunun tam tersi.
     *
     * @return harf dizisi; {@code n <= 0} için {@code null}
     */
    public static String numberToVariant(int n) {
        if (n <= 0) {
            return null;
        }
        var sb = new StringBuilder();
        int remaining = n;
        while (remaining > 0) {
            remaining--;
            sb.append((char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Varyant numarasının harf uzunluğu (1-26 → 1, 27-702 → 2, ...). {@code n <= 0} için 0.
     */
    public static int letterLength(int n) {
        String letters = numberToVariant(n);
        return letters != null ? letters.length() : 0;
    }

    private static ParsedTestcaseId unstructured(String id) {
        return new ParsedTestcaseId(id, 0, null, id, false);
    }

    private static Integer toInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // int'e sığmayan rakam dizileri yapısız kimlik olarak ele alınır
            return null;
        }
    }
}
