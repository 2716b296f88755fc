package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.TestStatus;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Tek bir TestCase XML belgesinin kanonik bellek içi modeli.
 * <p>
 * Bir dosya = bir TestCase. {@code id} kategori dizini içinde tekildir ve
 * {@code PREFIX_NN} veya {@code PREFIX_NN_HARF} kalıbını izler.
 * {@code profiles} filtreleme açısından küme gibi değerlendirilir; tekrar eden
 * değerler XML üzerinde olduğu gibi korunur.
 *
 * @param id           TestCase kimliği (örn: "II_EXF_01_A")
 * @param version      Belge sürümü (varsayılan "1.0")
 * @param status       Yürütme durumu, {@code null} ise açık
 * @param title        Başlık
 * @param purpose      Amaç
 * @param preconditions Ön koşullar
 * @param profiles     Uygulanabilirlik profilleri
 * @param references   Referanslar
 * @param refFunctions TestCase seviyesindeki fonksiyon etiketleri
 * @param refUsers     TestCase seviyesindeki kullanıcı etiketleri
 * @param testSteps    Sıralı test adımları (1 tabanlı pozisyon anlamlıdır)
 * @param notes        Notlar (sona eklenir, indeks ile silinir)
 * @param attachments  Ek meta verileri (dosyanın kendisi belge dışında tutulur)
 * @param result       Sonuç bloğu, boş olabilir ama {@code null} olmaz
 */
public record TestCase(
        String id,
        String version,
        TestStatus status,
        String title,
        String purpose,
        List<String> preconditions,
        List<String> profiles,
        List<String> references,
        List<String> refFunctions,
        List<String> refUsers,
        List<TestStep> testSteps,
        List<Note> notes,
        List<Attachment> attachments,
        TestResult result
) {

    public static final String DEFAULT_VERSION = "1.0";

    public TestCase {
        id = ModelDefaults.text(id);
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        title = ModelDefaults.text(title);
        purpose = ModelDefaults.text(purpose);
        preconditions = ModelDefaults.list(preconditions);
        profiles = ModelDefaults.list(profiles);
        references = ModelDefaults.list(references);
        refFunctions = ModelDefaults.list(refFunctions);
        refUsers = ModelDefaults.list(refUsers);
        testSteps = ModelDefaults.list(testSteps);
        notes = ModelDefaults.list(notes);
        attachments = ModelDefaults.list(attachments);
        result = result != null ? result : TestResult.empty();
    }

    public TestCase withId(String newId) {
        return new TestCase(newId, version, status, title, purpose, preconditions, profiles, references,
                refFunctions, refUsers, testSteps, notes, attachments, result);
    }

    public TestCase withNotes(List<Note> newNotes) {
        return new TestCase(id, version, status, title, purpose, preconditions, profiles, references,
                refFunctions, refUsers, testSteps, newNotes, attachments, result);
    }

    public TestCase withAttachments(List<Attachment> newAttachments) {
        return new TestCase(id, version, status, title, purpose, preconditions, profiles, references,
                refFunctions, refUsers, testSteps, notes, newAttachments, result);
    }

    /**
     * TestCase ve adım seviyesindeki fonksiyon etiketlerinin tekilleştirilmiş birleşimi.
     */
    public List<String> mergedRefFunctions() {
        var merged = new LinkedHashSet<>(refFunctions);
        testSteps.forEach(step -> merged.addAll(step.refFunctions()));
        return List.copyOf(merged);
    }

    /**
     * TestCase ve adım seviyesindeki kullanıcı etiketlerinin tekilleştirilmiş birleşimi.
     */
    public List<String> mergedRefUsers() {
        var merged = new LinkedHashSet<>(refUsers);
        testSteps.forEach(step -> merged.addAll(step.refUsers()));
        return List.copyOf(merged);
    }

    /**
     * Raporlarda kullanılan durum: yalnızca {@code Result/Status}. Kök {@code status}
     * attribute'u rapora yansımaz, Result durumu yoksa TestCase açık sayılır.
     *
     * @return durum veya açık ise {@code null}
     */
    public TestStatus reportStatus() {
        return result.status();
    }
}
