package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.models.InstanceInfo;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileConfigurationState;
import io.mersel.services.testcase.infrastructure.diagnostics.TestcaseMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProfileConfigurationService birim testleri.
 * <p>
 * {@code profiles.xml} → {@code profiles-template.xml} geri düşüşünü, kaydetme ve sıfırlamayı test eder.
 */
@DisplayName("ProfileConfigurationService")
class ProfileConfigurationServiceTest {

    private static final String TEMPLATE = """
            <ProfileConfiguration completed="false">
              <Metadata><ProductName>Vorlage</ProductName></Metadata>
              <ChecklistSections>
                <Section id="s1">
                  <Question id="q1" type="boolean">
                    <Text>Drucker?</Text>
                    <Answer answered="false"/>
                    <ProfileMapping condition="true"><Profile>PRINT</Profile></ProfileMapping>
                  </Question>
                </Section>
              </ChecklistSections>
            </ProfileConfiguration>
            """;

    private static final String PROFILES = """
            <ProfileConfiguration completed="true">
              <Metadata>
                <ProductName>Kasse X</ProductName>
                <Manufacturer>ACME</Manufacturer>
                <ProductVersion>3.0</ProductVersion>
              </Metadata>
              <ChecklistSections>
                <Section id="s1">
                  <Question id="q1" type="boolean">
                    <Text>Drucker?</Text>
                    <Answer answered="true"><Value>true</Value></Answer>
                    <ProfileMapping condition="true"><Profile>PRINT</Profile></ProfileMapping>
                  </Question>
                </Section>
              </ChecklistSections>
            </ProfileConfiguration>
            """;

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private ProfileConfigurationService service;
    private InstancePaths paths;

    @BeforeEach
    void setUp() throws Exception {
        registry = new SimpleMeterRegistry();
        service = new ProfileConfigurationService(new ProfileConfigurationXmlCodec(), new ProfileDerivationEngine(),
                new TestcaseMetrics(registry));
        paths = new InstancePaths("demo", tempDir, tempDir.resolve("testcases"));
        Files.createDirectories(paths.testcasesPath());
    }

    private void writeFile(String name, String content) throws Exception {
        Files.writeString(paths.testcasesPath().resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("load: hiçbir dosya yoksa exists=false")
    void load_missing() throws Exception {
        ProfileConfigurationState state = service.load(paths);

        assertThat(state.exists()).isFalse();
        assertThat(state.configuration()).isNull();
        assertThat(state.derivedProfiles()).isEmpty();
    }

    @Test
    @DisplayName("load: profiles.xml yoksa şablon okunur")
    void load_template() throws Exception {
        writeFile(ProfileConfigurationService.TEMPLATE_FILE, TEMPLATE);

        ProfileConfigurationState state = service.load(paths);

        assertThat(state.exists()).isTrue();
        assertThat(state.source()).isEqualTo(ProfileConfigurationState.SOURCE_TEMPLATE);
        assertThat(state.configuration().metadata().productName()).isEqualTo("Vorlage");
        assertThat(state.derivedProfiles()).isEmpty();
    }

    @Test
    @DisplayName("load: profiles.xml şablona göre önceliklidir")
    void load_profilesWins() throws Exception {
        writeFile(ProfileConfigurationService.TEMPLATE_FILE, TEMPLATE);
        writeFile(ProfileConfigurationService.PROFILES_FILE, PROFILES);

        ProfileConfigurationState state = service.load(paths);

        assertThat(state.source()).isEqualTo(ProfileConfigurationState.SOURCE_PROFILES);
        assertThat(state.derivedProfiles()).containsExactly("PRINT");
    }

    @Test
    @DisplayName("load: bozuk dosya DocumentParseException ve metrik")
    void load_broken() throws Exception {
        writeFile(ProfileConfigurationService.PROFILES_FILE, "<ProfileConfiguration>");

        assertThatThrownBy(() -> service.load(paths)).isInstanceOf(DocumentParseException.class);
        assertThat(registry.counter("testcase_document_parse_failures_total", "document_type", "profiles").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("save: her zaman profiles.xml'e yazar, şablona dokunmaz")
    void save() throws Exception {
        writeFile(ProfileConfigurationService.TEMPLATE_FILE, TEMPLATE);
        ProfileConfiguration answered = new ProfileConfigurationXmlCodec().parse(PROFILES, "test");

        List<String> derived = service.save(paths, answered);

        assertThat(derived).containsExactly("PRINT");
        assertThat(paths.testcasesPath().resolve(ProfileConfigurationService.PROFILES_FILE)).exists();
        assertThat(Files.readString(paths.testcasesPath().resolve(ProfileConfigurationService.TEMPLATE_FILE)))
                .isEqualTo(TEMPLATE);
        assertThat(service.load(paths).configuration()).isEqualTo(answered);
    }

    @Test
    @DisplayName("reset: profiles.xml silinir, okuma şablona düşer; dosya yoksa hata yok")
    void reset() throws Exception {
        writeFile(ProfileConfigurationService.TEMPLATE_FILE, TEMPLATE);
        writeFile(ProfileConfigurationService.PROFILES_FILE, PROFILES);

        service.reset(paths);

        assertThat(service.load(paths).source()).isEqualTo(ProfileConfigurationState.SOURCE_TEMPLATE);
        assertThatCode(() -> service.reset(paths)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("getInstanceInfo: ürün alanları meta veriden gelir")
    void instanceInfo() throws Exception {
        writeFile(ProfileConfigurationService.PROFILES_FILE, PROFILES);

        InstanceInfo info = service.getInstanceInfo(paths);

        assertThat(info.id()).isEqualTo("demo");
        assertThat(info.productName()).isEqualTo("Kasse X");
        assertThat(info.manufacturer()).isEqualTo("ACME");
        assertThat(info.version()).isEqualTo("3.0");
    }

    @Test
    @DisplayName("getInstanceInfo: bozuk yapılandırmada boş ürün alanları")
    void instanceInfo_broken() throws Exception {
        writeFile(ProfileConfigurationService.PROFILES_FILE, "kaputt");

        InstanceInfo info = service.getInstanceInfo(paths);

        assertThat(info.name()).isEqualTo("demo");
        assertThat(info.productName()).isEmpty();
    }
}
