package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.enums.QuestionType;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.models.Answer;
import io.mersel.services.testcase.application.models.ChecklistQuestion;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileDefinition;
import io.mersel.services.testcase.application.models.ProfileMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProfileConfigurationXmlCodec birim testleri.
 * <p>
 * Güncel ve eski profil yapılandırma şekillerinin okunmasını ve güncel şeklin yazılmasını test eder.
 */
@DisplayName("ProfileConfigurationXmlCodec")
class ProfileConfigurationXmlCodecTest {

    private final ProfileConfigurationXmlCodec codec = new ProfileConfigurationXmlCodec();

    private static final String CURRENT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <ProfileConfiguration version="1.0" completed="true"
                                  xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                                  xsi:noNamespaceSchemaLocation="_schema/profiles.xsd">
              <Metadata>
                <ProductName>Kasse X</ProductName>
                <Manufacturer>ACME</Manufacturer>
                <ProductVersion>2.1</ProductVersion>
              </Metadata>
              <TemplateConfiguration>
                <ProfileFilterMode>AND</ProfileFilterMode>
              </TemplateConfiguration>
              <ProfileDefinitions>
                <ProfileCategory id="export">
                  <Title>Export</Title>
                  <Profile id="EXP">
                    <Name>Export-Profil</Name>
                    <Description>Exportfunktion</Description>
                  </Profile>
                </ProfileCategory>
              </ProfileDefinitions>
              <ChecklistSections>
                <Section id="s1">
                  <Title>Allgemein</Title>
                  <Question id="q1" type="boolean" required="true">
                    <Text>Export vorhanden?</Text>
                    <HelpText>Hilfe</HelpText>
                    <Answer answered="true"><Value>true</Value></Answer>
                    <ProfileMapping condition="true"><Profile>EXP</Profile></ProfileMapping>
                    <ProfileMapping condition="false"><Profile>NOEXP</Profile></ProfileMapping>
                  </Question>
                  <Question id="q2" type="multi-choice">
                    <Text>Schnittstellen</Text>
                    <DependsOn logic="AND">
                      <Condition questionId="q1"><Value>true</Value></Condition>
                    </DependsOn>
                    <Answer answered="true"><Value>usb</Value><Value>lan</Value></Answer>
                    <ProfileMapping condition="usb"><Profile>USB</Profile></ProfileMapping>
                  </Question>
                </Section>
              </ChecklistSections>
            </ProfileConfiguration>
            """;

    @Nested
    @DisplayName("Güncel şekil")
    class Current {

        @Test
        @DisplayName("Meta veri, şablon ayarı ve profil kataloğu okunur")
        void parse_header() throws Exception {
            ProfileConfiguration config = codec.parse(CURRENT, "profiles.xml");

            assertThat(config.completed()).isTrue();
            assertThat(config.metadata().productName()).isEqualTo("Kasse X");
            assertThat(config.metadata().manufacturer()).isEqualTo("ACME");
            assertThat(config.metadata().productVersion()).isEqualTo("2.1");
            assertThat(config.templateConfiguration().profileFilterMode()).isEqualTo(FilterMode.AND);
            assertThat(config.profileDefinitions()).containsExactly(
                    new ProfileDefinition("EXP", "Export-Profil", "Exportfunktion", "Export"));
        }

        @Test
        @DisplayName("Sorular, cevaplar, eşlemeler ve bağımlılıklar okunur")
        void parse_questions() throws Exception {
            ProfileConfiguration config = codec.parse(CURRENT, "profiles.xml");

            List<ChecklistQuestion> questions = config.sections().get(0).questions();
            assertThat(questions).hasSize(2);

            ChecklistQuestion q1 = questions.get(0);
            assertThat(q1.type()).isEqualTo(QuestionType.BOOLEAN);
            assertThat(q1.required()).isTrue();
            assertThat(q1.text()).isEqualTo("Export vorhanden?");
            assertThat(q1.helpText()).isEqualTo("Hilfe");
            assertThat(q1.answer()).isEqualTo(new Answer(true, List.of("true")));
            assertThat(q1.profileMappings()).extracting(ProfileMapping::condition).containsExactly("true", "false");
            assertThat(q1.dependsOn()).isNull();

            ChecklistQuestion q2 = questions.get(1);
            assertThat(q2.type()).isEqualTo(QuestionType.MULTI_CHOICE);
            assertThat(q2.answer().values()).containsExactly("usb", "lan");
            assertThat(q2.dependsOn().logic()).isEqualTo(FilterMode.AND);
            assertThat(q2.dependsOn().conditions().get(0).questionId()).isEqualTo("q1");
        }

        @Test
        @DisplayName("Yazılıp tekrar okunan yapılandırma aynı kalır")
        void write_preservesModel() throws Exception {
            ProfileConfiguration original = codec.parse(CURRENT, "profiles.xml");

            ProfileConfiguration reparsed = codec.parse(codec.write(original), "profiles.xml");

            assertThat(reparsed).isEqualTo(original);
        }

        @Test
        @DisplayName("Yazılan belge şema konumu ve güncel eleman adlarını taşır")
        void write_shape() throws Exception {
            String xml = codec.write(codec.parse(CURRENT, "profiles.xml"));

            assertThat(xml).contains("xsi:noNamespaceSchemaLocation=\"_schema/profiles.xsd\"");
            assertThat(xml).contains("<ChecklistSections>");
            assertThat(xml).contains("type=\"multi-choice\"");
            assertThat(xml).contains("<ProfileFilterMode>AND</ProfileFilterMode>");
            assertThat(xml).contains("<ProfileCategory id=\"export\">");
        }
    }

    @Nested
    @DisplayName("Eski şekil")
    class Legacy {

        private static final String LEGACY = """
                <ProfileConfiguration>
                  <Metadata><Version>0.9</Version></Metadata>
                  <Sections>
                    <Section id="alt">
                      <Item id="i1">
                        <Label>Drucker?</Label>
                        <Info>Altes Hilfefeld</Info>
                        <Value>ja</Value>
                        <Profiles><Profile>PRINT</Profile></Profiles>
                      </Item>
                      <Item id="i2">
                        <Label>Display?</Label>
                        <Value>false</Value>
                        <Profiles><Profile>DISPLAY</Profile></Profiles>
                        <Dependencies><Dependency itemId="i1" requiredValue="true"/></Dependencies>
                      </Item>
                      <Item id="i3" type="choice">
                        <Label>Land</Label>
                        <Value>DE</Value>
                      </Item>
                    </Section>
                  </Sections>
                  <ProfileDefinitions>
                    <Profile id="PRINT"><Category>Hardware</Category></Profile>
                    <Profile id="DISPLAY"/>
                  </ProfileDefinitions>
                </ProfileConfiguration>
                """;

        @Test
        @DisplayName("Item/Label/Info güncel alanlara çevrilir")
        void parse_itemsAsQuestions() throws Exception {
            ProfileConfiguration config = codec.parse(LEGACY, "profiles.xml");

            ChecklistQuestion i1 = config.sections().get(0).questions().get(0);
            assertThat(i1.id()).isEqualTo("i1");
            assertThat(i1.text()).isEqualTo("Drucker?");
            assertThat(i1.helpText()).isEqualTo("Altes Hilfefeld");
            assertThat(config.metadata().productVersion()).isEqualTo("0.9");
            assertThat(config.templateConfiguration().profileFilterMode()).isEqualTo(FilterMode.OR);
        }

        @Test
        @DisplayName("Doğrudan profiller her zaman sağlanan eşlemeye, değer doğruluk cevabına çevrilir")
        void parse_directProfiles() throws Exception {
            ProfileConfiguration config = codec.parse(LEGACY, "profiles.xml");
            List<ChecklistQuestion> items = config.sections().get(0).questions();

            assertThat(items.get(0).profileMappings())
                    .containsExactly(new ProfileMapping(ProfileMapping.ALWAYS, List.of("PRINT")));
            assertThat(items.get(0).answer()).isEqualTo(new Answer(true, List.of("true")));
            assertThat(items.get(1).answer()).isEqualTo(new Answer(false, List.of("false")));
        }

        @Test
        @DisplayName("Profilsiz eski Value cevap değeri olarak korunur")
        void parse_plainValue() throws Exception {
            ChecklistQuestion i3 = codec.parse(LEGACY, "profiles.xml").sections().get(0).questions().get(2);

            assertThat(i3.type()).isEqualTo(QuestionType.CHOICE);
            assertThat(i3.answer()).isEqualTo(new Answer(true, List.of("DE")));
        }

        @Test
        @DisplayName("Dependencies → DependsOn (OR)")
        void parse_dependencies() throws Exception {
            ChecklistQuestion i2 = codec.parse(LEGACY, "profiles.xml").sections().get(0).questions().get(1);

            assertThat(i2.dependsOn().logic()).isEqualTo(FilterMode.OR);
            assertThat(i2.dependsOn().conditions().get(0).questionId()).isEqualTo("i1");
            assertThat(i2.dependsOn().conditions().get(0).values()).containsExactly("true");
        }

        @Test
        @DisplayName("Düz profil listesi: kategori yoksa varsayılan kategori")
        void parse_flatDefinitions() throws Exception {
            List<ProfileDefinition> definitions = codec.parse(LEGACY, "profiles.xml").profileDefinitions();

            assertThat(definitions).containsExactly(
                    new ProfileDefinition("PRINT", "PRINT", "", "Hardware"),
                    new ProfileDefinition("DISPLAY", "DISPLAY", "", ProfileDefinition.DEFAULT_CATEGORY));
        }

        @Test
        @DisplayName("Eski şekil okunup yazıldığında yalnızca güncel elemanlar kalır")
        void write_dropsLegacyNames() throws Exception {
            String xml = codec.write(codec.parse(LEGACY, "profiles.xml"));

            assertThat(xml).contains("<Question id=\"i1\"");
            assertThat(xml).contains("<ProfileMapping condition=\"true\">");
            assertThat(xml).doesNotContain("<Item").doesNotContain("<Label>").doesNotContain("<Dependencies>");
        }
    }

    @Test
    @DisplayName("Yanlış kök eleman → DocumentParseException")
    void parse_wrongRoot() {
        assertThatThrownBy(() -> codec.parse("<TestCase/>", "profiles.xml"))
                .isInstanceOf(DocumentParseException.class);
    }

    @Test
    @DisplayName("isTruthy: boş ve 'false' dışındaki her değer doğru")
    void isTruthy() {
        assertThat(ProfileConfigurationXmlCodec.isTruthy("ja")).isTrue();
        assertThat(ProfileConfigurationXmlCodec.isTruthy("true")).isTrue();
        assertThat(ProfileConfigurationXmlCodec.isTruthy("FALSE")).isFalse();
        assertThat(ProfileConfigurationXmlCodec.isTruthy(" ")).isFalse();
        assertThat(ProfileConfigurationXmlCodec.isTruthy(null)).isFalse();
    }

    @Test
    @DisplayName("categoryId: küçük harf, boşluk ve tire alt çizgi olur")
    void categoryId() {
        assertThat(ProfileConfigurationXmlCodec.categoryId("Kassen Hard-ware")).isEqualTo("kassen_hard_ware");
    }
}
