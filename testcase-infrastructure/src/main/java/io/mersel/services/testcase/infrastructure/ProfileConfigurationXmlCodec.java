package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.enums.QuestionType;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationCodec;
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
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ProfileConfiguration XML codec'i (DOM tabanlı).
 * <p>
 * Güncel şekil {@code ChecklistSections/Section/Question} yapısıdır. Eski şekil
 * ({@code Sections}, {@code Item}, {@code Label}/{@code Info}, doğrudan {@code Value},
 * doğrudan {@code Profiles}, {@code Dependencies}) okunurken güncel modele normalize edilir
 * ve hiçbir zaman yazılmaz.
 */
@Component
public class ProfileConfigurationXmlCodec implements IProfileConfigurationCodec {

    static final String ROOT = "ProfileConfiguration";
    static final String SCHEMA_LOCATION = "_schema/profiles.xsd";

    // ── Okuma ───────────────────────────────────────────────────────

    @Override
    public ProfileConfiguration parse(String xml, String sourceId) throws DocumentParseException {
        Element root = XmlNodes.parseRoot(xml, sourceId, ROOT);

        Element template = XmlNodes.child(root, "TemplateConfiguration");
        var templateConfiguration = new TemplateConfiguration(
                FilterMode.fromValue(XmlNodes.childText(template, "ProfileFilterMode")));

        Element metadata = XmlNodes.child(root, "Metadata");
        var profileMetadata = new ProfileMetadata(
                XmlNodes.childText(metadata, "ProductName"),
                XmlNodes.childText(metadata, "Manufacturer"),
                XmlNodes.childText(metadata, "ProductVersion", "Version"),
                XmlNodes.childText(metadata, "Description"),
                XmlNodes.childText(metadata, "TestDate"),
                XmlNodes.childText(metadata, "Tester"));

        List<ChecklistSection> sections = new ArrayList<>();
        Element sectionsContainer = XmlNodes.child(root, "ChecklistSections", "Sections");
        for (Element section : XmlNodes.children(sectionsContainer, "Section")) {
            sections.add(new ChecklistSection(
                    XmlNodes.attr(section, "id"),
                    XmlNodes.childText(section, "Title"),
                    XmlNodes.childText(section, "Description"),
                    XmlNodes.children(section, "Question", "Item").stream()
                            .map(this::parseQuestion)
                            .toList()));
        }

        return new ProfileConfiguration(
                "true".equals(XmlNodes.attr(root, "completed")),
                profileMetadata,
                templateConfiguration,
                sections,
                parseProfileDefinitions(XmlNodes.child(root, "ProfileDefinitions")));
    }

    private ChecklistQuestion parseQuestion(Element question) {
        List<ProfileMapping> mappings = new ArrayList<>();
        for (Element mapping : XmlNodes.children(question, "ProfileMapping")) {
            mappings.add(new ProfileMapping(
                    XmlNodes.attr(mapping, "condition"),
                    XmlNodes.values(mapping, "Profile")));
        }

        // Eski biçim: doğrudan Profiles listesi = her zaman sağlanan eşleme
        List<String> legacyProfiles = XmlNodes.values(XmlNodes.child(question, "Profiles"), "Profile");
        if (mappings.isEmpty() && !legacyProfiles.isEmpty()) {
            mappings.add(new ProfileMapping(ProfileMapping.ALWAYS, legacyProfiles));
        }

        return new ChecklistQuestion(
                XmlNodes.attr(question, "id"),
                XmlNodes.childText(question, "Text", "Label"),
                QuestionType.fromValue(XmlNodes.attr(question, "type")),
                "true".equals(XmlNodes.attr(question, "required")),
                XmlNodes.childText(question, "HelpText", "Info"),
                parseAnswer(question, !legacyProfiles.isEmpty()),
                mappings,
                parseDependsOn(question));
    }

    private Answer parseAnswer(Element question, boolean legacyProfiles) {
        Element answer = XmlNodes.child(question, "Answer");
        if (answer != null) {
            return new Answer("true".equals(XmlNodes.attr(answer, "answered")),
                    XmlNodes.values(answer, "Value"));
        }

        Element legacyValue = XmlNodes.child(question, "Value");
        if (legacyValue == null) {
            return Answer.unanswered();
        }
        String value = XmlNodes.text(legacyValue).strip();
        boolean truthy = isTruthy(value);
        if (legacyProfiles) {
            return new Answer(truthy, List.of(truthy ? "true" : "false"));
        }
        return new Answer(!value.isEmpty(), value.isEmpty() ? List.of() : List.of(value));
    }

    private DependsOn parseDependsOn(Element question) {
        Element dependsOn = XmlNodes.child(question, "DependsOn");
        if (dependsOn != null) {
            List<DependencyCondition> conditions = XmlNodes.children(dependsOn, "Condition").stream()
                    .map(c -> new DependencyCondition(XmlNodes.attr(c, "questionId"), XmlNodes.values(c, "Value")))
                    .toList();
            return conditions.isEmpty() ? null
                    : new DependsOn(FilterMode.fromValue(XmlNodes.attr(dependsOn, "logic")), conditions);
        }

        List<DependencyCondition> legacy = XmlNodes.children(XmlNodes.child(question, "Dependencies"), "Dependency")
                .stream()
                .map(d -> new DependencyCondition(
                        XmlNodes.attr(d, "itemId"),
                        List.of("false".equals(XmlNodes.attr(d, "requiredValue")) ? "false" : "true")))
                .toList();
        return legacy.isEmpty() ? null : new DependsOn(FilterMode.OR, legacy);
    }

    private List<ProfileDefinition> parseProfileDefinitions(Element definitions) {
        List<ProfileDefinition> result = new ArrayList<>();
        if (definitions == null) {
            return result;
        }

        for (Element category : XmlNodes.children(definitions, "ProfileCategory")) {
            String categoryId = XmlNodes.attr(category, "id", "");
            String title = XmlNodes.childText(category, "Title");
            String categoryLabel = title.isBlank() ? categoryId : title;
            for (Element profile : XmlNodes.children(category, "Profile")) {
                result.add(new ProfileDefinition(
                        XmlNodes.attr(profile, "id"),
                        XmlNodes.childText(profile, "Name"),
                        XmlNodes.childText(profile, "Description"),
                        categoryLabel));
            }
        }

        // Eski düz liste: Profile/Category
        for (Element profile : XmlNodes.children(definitions, "Profile")) {
            result.add(new ProfileDefinition(
                    XmlNodes.attr(profile, "id"),
                    XmlNodes.childText(profile, "Name"),
                    XmlNodes.childText(profile, "Description"),
                    XmlNodes.childText(profile, "Category")));
        }
        return result;
    }

    static boolean isTruthy(String value) {
        return value != null && !value.isBlank() && !"false".equalsIgnoreCase(value.strip());
    }

    // ── Yazma ───────────────────────────────────────────────────────

    @Override
    public String write(ProfileConfiguration configuration) {
        Document doc = XmlNodes.newDocument();
        Element root = doc.createElementNS(null, ROOT);
        doc.appendChild(root);
        root.setAttribute("version", "1.0");
        XmlNodes.declareXsi(root);
        root.setAttributeNS(XmlNodes.XSI_NS, "xsi:noNamespaceSchemaLocation", SCHEMA_LOCATION);
        root.setAttribute("completed", String.valueOf(configuration.completed()));

        ProfileMetadata metadata = configuration.metadata();
        Element m = element(root, "Metadata");
        text(m, "ProductName", metadata.productName());
        text(m, "Manufacturer", metadata.manufacturer());
        text(m, "ProductVersion", metadata.productVersion());
        text(m, "Description", metadata.description());
        text(m, "TestDate", metadata.testDate());
        text(m, "Tester", metadata.tester());

        Element template = element(root, "TemplateConfiguration");
        text(template, "ProfileFilterMode", configuration.templateConfiguration().profileFilterMode().name());

        if (!configuration.profileDefinitions().isEmpty()) {
            writeProfileDefinitions(element(root, "ProfileDefinitions"), configuration.profileDefinitions());
        }

        Element sections = element(root, "ChecklistSections");
        for (ChecklistSection section : configuration.sections()) {
            Element s = element(sections, "Section");
            s.setAttribute("id", section.id());
            text(s, "Title", section.title());
            text(s, "Description", section.description());
            section.questions().forEach(q -> writeQuestion(s, q));
        }

        return XmlNodes.serialize(doc);
    }

    private void writeQuestion(Element section, ChecklistQuestion question) {
        Element q = element(section, "Question");
        q.setAttribute("id", question.id());
        q.setAttribute("type", question.type().wireValue());
        if (question.required()) {
            q.setAttribute("required", "true");
        }
        text(q, "Text", question.text());
        if (!question.helpText().isEmpty()) {
            text(q, "HelpText", question.helpText());
        }

        if (question.dependsOn() != null) {
            Element dependsOn = element(q, "DependsOn");
            dependsOn.setAttribute("logic", question.dependsOn().logic().name());
            for (DependencyCondition condition : question.dependsOn().conditions()) {
                Element c = element(dependsOn, "Condition");
                c.setAttribute("questionId", condition.questionId());
                condition.values().forEach(v -> text(c, "Value", v));
            }
        }

        Element answer = element(q, "Answer");
        answer.setAttribute("answered", String.valueOf(question.answer().answered()));
        question.answer().values().forEach(v -> text(answer, "Value", v));

        for (ProfileMapping mapping : question.profileMappings()) {
            Element pm = element(q, "ProfileMapping");
            pm.setAttribute("condition", mapping.condition());
            mapping.profiles().forEach(p -> text(pm, "Profile", p));
        }
    }

    /**
     * Profil tanımlarını kategori etiketine göre (ilk görülme sırasıyla) gruplayarak yazar.
     */
    private void writeProfileDefinitions(Element definitions, List<ProfileDefinition> profiles) {
        Map<String, List<ProfileDefinition>> byCategory = new LinkedHashMap<>();
        for (ProfileDefinition profile : profiles) {
            byCategory.computeIfAbsent(profile.category(), k -> new ArrayList<>()).add(profile);
        }

        for (var entry : byCategory.entrySet()) {
            Element category = element(definitions, "ProfileCategory");
            category.setAttribute("id", categoryId(entry.getKey()));
            text(category, "Title", entry.getKey());
            for (ProfileDefinition profile : entry.getValue()) {
                Element p = element(category, "Profile");
                p.setAttribute("id", profile.id());
                text(p, "Name", profile.name());
                text(p, "Description", profile.description());
            }
        }
    }

    /**
     * Kategori etiketini attribute değerine çevirir: küçük harf, boşluk dizileri ve tireler alt çizgi.
     */
    static String categoryId(String label) {
        return label.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "_")
                .replace('-', '_');
    }

    private static Element element(Element parent, String name) {
        return XmlNodes.appendElement(parent, null, name);
    }

    private static Element text(Element parent, String name, String value) {
        return XmlNodes.appendText(parent, null, name, value);
    }
}
