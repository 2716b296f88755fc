package io.mersel.services.testcase.web.controllers;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.enums.QuestionType;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IInstancePathResolver;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationService;
import io.mersel.services.testcase.application.interfaces.ITestcaseAggregationService;
import io.mersel.services.testcase.application.models.Answer;
import io.mersel.services.testcase.application.models.ChecklistQuestion;
import io.mersel.services.testcase.application.models.ChecklistSection;
import io.mersel.services.testcase.application.models.HashtagIndex;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileConfigurationState;
import io.mersel.services.testcase.application.models.ProfileMapping;
import io.mersel.services.testcase.application.models.ProfileMetadata;
import io.mersel.services.testcase.application.models.StatusStatistics;
import io.mersel.services.testcase.application.models.TagGroup;
import io.mersel.services.testcase.application.models.TemplateConfiguration;
import io.mersel.services.testcase.web.infrastructure.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ProfileController birim testleri.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProfileController")
class ProfileControllerTest {

    private static final InstancePaths PATHS = new InstancePaths(
            "demo", Path.of("/data/demo"), Path.of("/data/demo/testcases"));

    private MockMvc mockMvc;

    @Mock
    private IInstancePathResolver pathResolver;

    @Mock
    private ITestcaseAggregationService aggregationService;

    @Mock
    private IProfileConfigurationService profileConfigurationService;

    @InjectMocks
    private ProfileController controller;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        when(pathResolver.resolve("demo")).thenReturn(PATHS);
    }

    private static TagGroup group(String id, String type) {
        var member = new TagGroup.Member("TC_01", "TC_01.xml", "Titel", "PASSED", "MOD_A", "CAT_1", null);
        return new TagGroup(id, id, type, List.of(member), type == null ? StatusStatistics.of(1, 0, 0, 0) : null);
    }

    @Test
    @DisplayName("profiles: gruplar dizi olarak 'profiles' altında dönmeli")
    void profiles() throws Exception {
        Map<String, TagGroup> groups = new LinkedHashMap<>();
        groups.put("BASIC", group("BASIC", null));
        groups.put("EXPORT", group("EXPORT", null));
        when(aggregationService.getProfilesStructure(PATHS.testcasesPath())).thenReturn(groups);

        mockMvc.perform(get("/api/demo/profiles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.profiles.length()").value(2))
                .andExpect(jsonPath("$.profiles[0].id").value("BASIC"))
                .andExpect(jsonPath("$.profiles[0].stats.progress").value(100))
                .andExpect(jsonPath("$.functions").doesNotExist());
    }

    @Test
    @DisplayName("hashtags: functions ve users dizileri dönmeli")
    void hashtags() throws Exception {
        var index = new HashtagIndex(
                Map.of("Export-Modul", group("Export-Modul", TagGroup.TYPE_FUNCTION)),
                Map.of("Admin", group("Admin", TagGroup.TYPE_USER)));
        when(aggregationService.getHashtagsStructure(PATHS.testcasesPath())).thenReturn(index);

        mockMvc.perform(get("/api/demo/hashtags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.functions[0].name").value("Export-Modul"))
                .andExpect(jsonPath("$.functions[0].type").value("function"))
                .andExpect(jsonPath("$.users[0].name").value("Admin"))
                .andExpect(jsonPath("$.profiles").doesNotExist());
    }

    @Nested
    @DisplayName("profile-config")
    class ProfileConfig {

        @Test
        @DisplayName("GET: yapılandırma yoksa exists=false ve mesaj dönmeli")
        void missing() throws Exception {
            when(profileConfigurationService.load(PATHS)).thenReturn(ProfileConfigurationState.missing());

            mockMvc.perform(get("/api/demo/profile-config"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.exists").value(false))
                    .andExpect(jsonPath("$.message").isNotEmpty())
                    .andExpect(jsonPath("$.derivedProfiles").doesNotExist());
        }

        @Test
        @DisplayName("GET: yapılandırma alanları kök seviyesinde, türetilmiş profillerle dönmeli")
        void loaded() throws Exception {
            var question = new ChecklistQuestion("q1", "Drucker vorhanden?", QuestionType.BOOLEAN, true, "",
                    new Answer(true, List.of("true")),
                    List.of(new ProfileMapping("true", List.of("PRINT"))), null);
            var config = new ProfileConfiguration(true,
                    new ProfileMetadata("Kasse X", "Muster GmbH", "2.1", "", "", ""),
                    new TemplateConfiguration(FilterMode.AND),
                    List.of(new ChecklistSection("hw", "Hardware", "", List.of(question))),
                    List.of());
            when(profileConfigurationService.load(PATHS)).thenReturn(new ProfileConfigurationState(
                    true, ProfileConfigurationState.SOURCE_PROFILES, config, List.of("PRINT")));

            mockMvc.perform(get("/api/demo/profile-config"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.exists").value(true))
                    .andExpect(jsonPath("$.source").value("profiles"))
                    .andExpect(jsonPath("$.completed").value(true))
                    .andExpect(jsonPath("$.metadata.productName").value("Kasse X"))
                    .andExpect(jsonPath("$.templateConfiguration.profileFilterMode").value("AND"))
                    .andExpect(jsonPath("$.sections[0].questions[0].type").value("boolean"))
                    .andExpect(jsonPath("$.sections[0].questions[0].answer.values[0]").value("true"))
                    .andExpect(jsonPath("$.derivedProfiles[0]").value("PRINT"))
                    .andExpect(jsonPath("$.activeProfiles[0]").value("PRINT"))
                    .andExpect(jsonPath("$.configuration").doesNotExist());
        }

        @Test
        @DisplayName("GET: bozuk yapılandırma 500 dönmeli")
        void broken() throws Exception {
            when(profileConfigurationService.load(PATHS))
                    .thenThrow(new DocumentParseException("profiles.xml", "XML okunamadı"));

            mockMvc.perform(get("/api/demo/profile-config"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.source").value("profiles.xml"));
        }

        @Test
        @DisplayName("PUT: eski alan adları normalize edilip kaydedilmeli")
        void saveLegacy() throws Exception {
            String body = """
                    {
                      "exists": true,
                      "completed": false,
                      "metadata": {"productName": "Kasse X"},
                      "sections": [
                        {"id": "hw", "title": "Hardware", "items": [
                          {"id": "q1", "label": "Drucker?", "info": "Bondrucker", "value": true,
                           "profiles": ["PRINT"]}
                        ]}
                      ],
                      "derivedProfiles": ["OLD"]
                    }
                    """;
            when(profileConfigurationService.save(eq(PATHS), any()))
                    .thenReturn(List.of("PRINT"));

            mockMvc.perform(put("/api/demo/profile-config")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.derivedProfiles[0]").value("PRINT"))
                    .andExpect(jsonPath("$.activeProfiles[0]").value("PRINT"))
                    .andExpect(jsonPath("$.exists").doesNotExist());

            var captor = ArgumentCaptor.forClass(ProfileConfiguration.class);
            verify(profileConfigurationService).save(eq(PATHS), captor.capture());
            var question = captor.getValue().sections().get(0).questions().get(0);
            assertThat(question.text()).isEqualTo("Drucker?");
            assertThat(question.helpText()).isEqualTo("Bondrucker");
            assertThat(question.answer()).isEqualTo(new Answer(true, List.of("true")));
            assertThat(question.profileMappings())
                    .containsExactly(new ProfileMapping(ProfileMapping.ALWAYS, List.of("PRINT")));
            assertThat(captor.getValue().metadata().productName()).isEqualTo("Kasse X");
        }

        @Test
        @DisplayName("DELETE: sıfırlama başarı mesajı dönmeli")
        void reset() throws Exception {
            mockMvc.perform(delete("/api/demo/profile-config"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true));

            verify(profileConfigurationService).reset(PATHS);
        }
    }
}
