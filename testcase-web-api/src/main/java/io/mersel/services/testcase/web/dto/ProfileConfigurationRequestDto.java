package io.mersel.services.testcase.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.enums.QuestionType;
import io.mersel.services.testcase.application.models.Answer;
import io.mersel.services.testcase.application.models.ChecklistQuestion;
import io.mersel.services.testcase.application.models.ChecklistSection;
import io.mersel.services.testcase.application.models.DependencyCondition;
import io.mersel.services.testcase.application.models.DependsOn;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileDefinition;
import io.mersel.services.testcase.application.models.ProfileMapping;
import io.mersel.services.testcase.application.models.ProfileMetadata;
import io.mersel.services.testcase.application.models.TemplateConfiguration;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Profil yapılandırması kaydetme isteği DTO'su.
 * <p>
 * Güncel alan adlarının yanında eski istemcilerin gönderdiği adları da kabul eder
 * ve {@link #toConfiguration()} ile kanonik modele normalize eder:
 * <ul>
 *   <li>{@code items} → {@code questions}, {@code label} → {@code text}, {@code info} → {@code helpText}</li>
 *   <li>{@code value} → {@code answer}</li>
 *   <li>{@code profiles} (düz liste) → koşulsuz {@code profileMappings}</li>
 *   <li>{@code dependencies} ({@code itemId}/{@code requiredValue}) → {@code dependsOn} (OR)</li>
 * </ul>
 * GET yanıtındaki ek alanlar ({@code exists}, {@code derivedProfiles} vb.) yok sayılır.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileConfigurationRequestDto {

    @Schema(description = "Kontrol listesi tamamlandı mı")
    private boolean completed;

    @Schema(description = "Ürün meta verisi", nullable = true)
    private ProfileMetadata metadata;

    @Schema(description = "Şablon ayarları (profil filtre modu)", nullable = true)
    private TemplateConfiguration templateConfiguration;

    @Schema(description = "Kontrol listesi bölümleri")
    private List<SectionDto> sections;

    @Schema(description = "Profil tanımları", nullable = true)
    private List<ProfileDefinition> profileDefinitions;

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public ProfileMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(ProfileMetadata metadata) {
        this.metadata = metadata;
    }

    public TemplateConfiguration getTemplateConfiguration() {
        return templateConfiguration;
    }

    public void setTemplateConfiguration(TemplateConfiguration templateConfiguration) {
        this.templateConfiguration = templateConfiguration;
    }

    public List<SectionDto> getSections() {
        return sections;
    }

    public void setSections(List<SectionDto> sections) {
        this.sections = sections;
    }

    public List<ProfileDefinition> getProfileDefinitions() {
        return profileDefinitions;
    }

    public void setProfileDefinitions(List<ProfileDefinition> profileDefinitions) {
        this.profileDefinitions = profileDefinitions;
    }

    /**
     * İstek gövdesini kanonik {@link ProfileConfiguration} modeline dönüştürür.
     */
    public ProfileConfiguration toConfiguration() {
        List<ChecklistSection> canonicalSections = new ArrayList<>();
        if (sections != null) {
            for (SectionDto section : sections) {
                if (section != null) {
                    canonicalSections.add(section.toSection());
                }
            }
        }
        return new ProfileConfiguration(completed, metadata, templateConfiguration,
                canonicalSections, profileDefinitions);
    }

    static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String text = node.asText();
        return !text.isBlank() && !"false".equalsIgnoreCase(text.strip());
    }

    private static List<String> texts(JsonNode node) {
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return result;
        }
        if (node.isArray()) {
            node.forEach(item -> {
                if (!item.isNull() && !item.asText().isEmpty()) {
                    result.add(item.asText());
                }
            });
        } else if (!node.asText().isEmpty()) {
            result.add(node.asText());
        }
        return result;
    }

    // ── Bölüm ───────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SectionDto {

        private String id;
        private String title;
        private String description;

        @JsonAlias("items")
        private List<QuestionDto> questions;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<QuestionDto> getQuestions() {
            return questions;
        }

        public void setQuestions(List<QuestionDto> questions) {
            this.questions = questions;
        }

        ChecklistSection toSection() {
            List<ChecklistQuestion> canonical = new ArrayList<>();
            if (questions != null) {
                for (QuestionDto question : questions) {
                    if (question != null) {
                        canonical.add(question.toQuestion());
                    }
                }
            }
            return new ChecklistSection(id, title, description, canonical);
        }
    }

    // ── Soru ────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuestionDto {

        private String id;

        @JsonAlias("label")
        private String text;

        private String type;
        private boolean required;

        @JsonAlias("info")
        private String helpText;

        /** Güncel biçim: {@code {answered, values}} */
        private JsonNode answer;

        /** Eski biçim: tek değer (boolean, metin) veya değer listesi */
        private JsonNode value;

        /** Güncel biçim: {@code [{condition, profiles}]} */
        private JsonNode profileMappings;

        /** Eski biçim: koşulsuz profil listesi */
        private JsonNode profiles;

        /** Güncel biçim: {@code {logic, conditions: [{questionId, values}]}} */
        private JsonNode dependsOn;

        /** Eski biçim: {@code [{itemId, requiredValue}]} */
        private JsonNode dependencies;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }

        public String getHelpText() {
            return helpText;
        }

        public void setHelpText(String helpText) {
            this.helpText = helpText;
        }

        public JsonNode getAnswer() {
            return answer;
        }

        public void setAnswer(JsonNode answer) {
            this.answer = answer;
        }

        public JsonNode getValue() {
            return value;
        }

        public void setValue(JsonNode value) {
            this.value = value;
        }

        public JsonNode getProfileMappings() {
            return profileMappings;
        }

        public void setProfileMappings(JsonNode profileMappings) {
            this.profileMappings = profileMappings;
        }

        public JsonNode getProfiles() {
            return profiles;
        }

        public void setProfiles(JsonNode profiles) {
            this.profiles = profiles;
        }

        public JsonNode getDependsOn() {
            return dependsOn;
        }

        public void setDependsOn(JsonNode dependsOn) {
            this.dependsOn = dependsOn;
        }

        public JsonNode getDependencies() {
            return dependencies;
        }

        public void setDependencies(JsonNode dependencies) {
            this.dependencies = dependencies;
        }

        ChecklistQuestion toQuestion() {
            List<ProfileMapping> mappings = toMappings();
            List<String> legacyProfiles = mappings.isEmpty() ? texts(profiles) : List.of();
            if (!legacyProfiles.isEmpty()) {
                mappings = List.of(new ProfileMapping(ProfileMapping.ALWAYS, legacyProfiles));
            }

            return new ChecklistQuestion(id, text, QuestionType.fromValue(type), required, helpText,
                    toAnswer(!legacyProfiles.isEmpty()), mappings, toDependsOn());
        }

        private List<ProfileMapping> toMappings() {
            List<ProfileMapping> result = new ArrayList<>();
            if (profileMappings == null || !profileMappings.isArray()) {
                return result;
            }
            for (JsonNode mapping : profileMappings) {
                if (mapping.isObject()) {
                    result.add(new ProfileMapping(
                            mapping.path("condition").asText(""),
                            texts(mapping.get("profiles"))));
                }
            }
            return result;
        }

        private Answer toAnswer(boolean legacyProfiles) {
            if (answer != null && answer.isObject()) {
                return new Answer(answer.path("answered").asBoolean(false), texts(answer.get("values")));
            }
            if (value == null || value.isNull() || value.isMissingNode()) {
                return Answer.unanswered();
            }
            if (legacyProfiles || value.isBoolean()) {
                boolean truthy = isTruthy(value);
                return new Answer(truthy, List.of(truthy ? "true" : "false"));
            }
            List<String> values = texts(value);
            return new Answer(!values.isEmpty(), values);
        }

        private DependsOn toDependsOn() {
            if (dependsOn != null && dependsOn.isObject()) {
                List<DependencyCondition> conditions = new ArrayList<>();
                for (JsonNode condition : dependsOn.path("conditions")) {
                    List<String> values = texts(condition.get("values"));
                    if (values.isEmpty()) {
                        values = texts(condition.get("value"));
                    }
                    conditions.add(new DependencyCondition(condition.path("questionId").asText(""), values));
                }
                if (!conditions.isEmpty()) {
                    return new DependsOn(FilterMode.fromValue(dependsOn.path("logic").asText(null)), conditions);
                }
            }

            if (dependencies != null && dependencies.isArray()) {
                List<DependencyCondition> conditions = new ArrayList<>();
                for (JsonNode dependency : dependencies) {
                    boolean required = !dependency.has("requiredValue")
                            || isTruthy(dependency.get("requiredValue"));
                    conditions.add(new DependencyCondition(
                            dependency.path("itemId").asText(""),
                            List.of(required ? "true" : "false")));
                }
                if (!conditions.isEmpty()) {
                    return new DependsOn(FilterMode.OR, conditions);
                }
            }
            return null;
        }
    }
}
