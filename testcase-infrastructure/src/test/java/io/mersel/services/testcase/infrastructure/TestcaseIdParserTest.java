package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.models.ParsedTestcaseId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TestcaseIdParser birim testleri.
 * <p>
 * Kimlik biçimlerinin (temel, varyant, yapısız) ayrıştırılmasını ve
 * varyant harfi ↔ sayı dönüşümünü test eder.
 */
@DisplayName("TestcaseIdParser")
class TestcaseIdParserTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("II_EXF_01_A → önek II_EXF_, numara 1, varyant A")
        void parse_variant() {
            ParsedTestcaseId parsed = TestcaseIdParser.parse("II_EXF_01_A");

            assertThat(parsed.prefix()).isEqualTo("II_EXF_");
            assertThat(parsed.number()).isEqualTo(1);
            assertThat(parsed.variant()).isEqualTo("A");
            assertThat(parsed.baseId()).isEqualTo("II_EXF_01");
            assertThat(parsed.hasVariant()).isTrue();
        }

        @Test
        @DisplayName("Çok harfli varyant → varyant AB")
        void parse_multiLetterVariant() {
            ParsedTestcaseId parsed = TestcaseIdParser.parse("II_EXF_12_AB");

            assertThat(parsed.number()).isEqualTo(12);
            assertThat(parsed.variant()).isEqualTo("AB");
            assertThat(parsed.baseId()).isEqualTo("II_EXF_12");
        }

        @Test
        @DisplayName("II_EXF_07 → temel kimlik, varyant yok")
        void parse_base() {
            ParsedTestcaseId parsed = TestcaseIdParser.parse("II_EXF_07");

            assertThat(parsed.prefix()).isEqualTo("II_EXF_");
            assertThat(parsed.number()).isEqualTo(7);
            assertThat(parsed.variant()).isNull();
            assertThat(parsed.baseId()).isEqualTo("II_EXF_07");
            assertThat(parsed.hasVariant()).isFalse();
        }

        @Test
        @DisplayName("Baştaki sıfırlar baseId içinde korunur")
        void parse_keepsLeadingZerosInBaseId() {
            assertThat(TestcaseIdParser.parse("TC_007_B").baseId()).isEqualTo("TC_007");
            assertThat(TestcaseIdParser.parse("TC_007_B").number()).isEqualTo(7);
        }

        @ParameterizedTest(name = "[{index}] \"{0}\" yapısız")
        @ValueSource(strings = {"README", "II_EXF_01_a", "II_EXF_", "_01", "01", "II_EXF_01_A1"})
        @DisplayName("Kalıba uymayan kimlik → numara 0, önek = kimlik")
        void parse_unstructured(String id) {
            ParsedTestcaseId parsed = TestcaseIdParser.parse(id);

            assertThat(parsed.prefix()).isEqualTo(id);
            assertThat(parsed.number()).isZero();
            assertThat(parsed.variant()).isNull();
            assertThat(parsed.baseId()).isEqualTo(id);
            assertThat(parsed.hasVariant()).isFalse();
        }

        @ParameterizedTest
        @NullAndEmptySource
        @DisplayName("null ve boş girdi hata fırlatmaz")
        void parse_nullOrEmpty(String id) {
            ParsedTestcaseId parsed = TestcaseIdParser.parse(id);

            assertThat(parsed.prefix()).isEmpty();
            assertThat(parsed.number()).isZero();
        }

        @Test
        @DisplayName("int'e sığmayan numara → yapısız")
        void parse_numberOverflow() {
            ParsedTestcaseId parsed = TestcaseIdParser.parse("TC_99999999999");

            assertThat(parsed.number()).isZero();
            assertThat(parsed.prefix()).isEqualTo("TC_99999999999");
        }
    }

    @Nested
    @DisplayName("Varyant harf dönüşümü")
    class VariantConversion {

        @ParameterizedTest(name = "{0} ↔ {1}")
        @CsvSource({"A,1", "B,2", "Z,26", "AA,27", "AB,28", "AZ,52", "BA,53", "ZZ,702", "AAA,703"})
        @DisplayName("Bilinen değerler")
        void known_values(String letters, int number) {
            assertThat(TestcaseIdParser.variantToNumber(letters)).isEqualTo(number);
            assertThat(TestcaseIdParser.numberToVariant(number)).isEqualTo(letters);
        }

        @Test
        @DisplayName("1..702 aralığında iki yönlü dönüşüm birbirinin tersi")
        void roundTrip_twoLetterRange() {
            for (int n = 1; n <= 702; n++) {
                String letters = TestcaseIdParser.numberToVariant(n);
                assertThat(TestcaseIdParser.variantToNumber(letters)).as("n=%d", n).isEqualTo(n);
            }
        }

        @Test
        @DisplayName("Geçersiz harfler → 0")
        void invalid_letters() {
            assertThat(TestcaseIdParser.variantToNumber(null)).isZero();
            assertThat(TestcaseIdParser.variantToNumber("")).isZero();
            assertThat(TestcaseIdParser.variantToNumber("a")).isZero();
            assertThat(TestcaseIdParser.variantToNumber("A1")).isZero();
        }

        @Test
        @DisplayName("Taşma → Integer.MAX_VALUE")
        void overflow_saturates() {
            assertThat(TestcaseIdParser.variantToNumber("ZZZZZZZZZZ")).isEqualTo(Integer.MAX_VALUE);
        }

        @Test
        @DisplayName("Sıfır ve negatif → null")
        void nonPositive_toNull() {
            assertThat(TestcaseIdParser.numberToVariant(0)).isNull();
            assertThat(TestcaseIdParser.numberToVariant(-5)).isNull();
        }

        @Test
        @DisplayName("letterLength sınırları")
        void letterLength_boundaries() {
            assertThat(TestcaseIdParser.letterLength(0)).isZero();
            assertThat(TestcaseIdParser.letterLength(1)).isEqualTo(1);
            assertThat(TestcaseIdParser.letterLength(26)).isEqualTo(1);
            assertThat(TestcaseIdParser.letterLength(27)).isEqualTo(2);
            assertThat(TestcaseIdParser.letterLength(702)).isEqualTo(2);
            assertThat(TestcaseIdParser.letterLength(703)).isEqualTo(3);
        }
    }
}
