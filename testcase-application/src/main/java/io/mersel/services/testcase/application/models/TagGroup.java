package io.mersel.services.testcase.application.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Bir etikete (profil, fonksiyon veya kullanıcı) göre gruplanmış TestCase'ler.
 *
 * @param id        Etiket değeri
 * @param name      Görünen ad
 * @param type      "function" / "user"; profil gruplarında {@code null}
 * @param testcases Kimliğe göre sıralı TestCase'ler
 * @param stats     Kök {@code status} üzerinden sayımlar
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TagGroup(
        String id,
        String name,
        String type,
        List<Member> testcases,
        StatusStatistics stats
) {

    public static final String TYPE_FUNCTION = "function";
    public static final String TYPE_USER = "user";

    public TagGroup {
        testcases = ModelDefaults.list(testcases);
    }

    /**
     * @param status   PASSED, FAILED, SKIPPED veya OPEN
     * @param profiles Yalnızca profil gruplarında dolu
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Member(
            String id,
            String filename,
            String title,
            String status,
            String module,
            String category,
            List<String> profiles
    ) {
    }
}
