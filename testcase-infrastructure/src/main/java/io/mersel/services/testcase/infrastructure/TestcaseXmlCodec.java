package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.TestStatus;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.ITestcaseCodec;
import io.mersel.services.testcase.application.models.Attachment;
import io.mersel.services.testcase.application.models.ExpectedResult;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.Note;
import io.mersel.services.testcase.application.models.TestCase;
import io.mersel.services.testcase.application.models.TestResult;
import io.mersel.services.testcase.application.models.TestStep;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * TestCase XML codec'i (DOM tabanlı).
 * <p>
 * Okurken tolere edilen eski şekiller:
 * <ul>
 *   <li>Tekrarlanabilir her alan 0..n eleman olabilir</li>
 *   <li>Metin yaprakları düz metin veya attribute'lu metin olabilir</li>
 *   <li>{@code Command} yerine {@code Action}</li>
 *   <li>{@code Notes} içinde {@code Note} yerine düz metin (tek, zaman damgasız not)</li>
 * </ul>
 * Yazarken tek bir kanonik şekil üretilir: tekrarlanabilir kapsayıcılar boş olsa da yazılır,
 * boş {@code Result}/{@code Notes}/{@code Attachments} blokları yazılmaz.
 */
@Component
public class TestcaseXmlCodec implements ITestcaseCodec {

    public static final String NAMESPACE = "http://www.bsi.bund.de/TR-03153-1/TS/TestCase";
    static final String ROOT = "TestCase";

    private final Clock clock;

    public TestcaseXmlCodec(Clock clock) {
        this.clock = clock;
    }

    // ── Okuma ───────────────────────────────────────────────────────

    @Override
    public TestCase parse(String xml, String sourceId) throws DocumentParseException {
        Element root = XmlNodes.parseRoot(xml, sourceId, ROOT);

        List<TestStep> steps = new ArrayList<>();
        List<Element> stepElements = XmlNodes.children(XmlNodes.child(root, "TestSteps"), "TestStep");
        for (int i = 0; i < stepElements.size(); i++) {
            steps.add(parseStep(stepElements.get(i), i + 1));
        }

        return new TestCase(
                XmlNodes.attr(root, "id", fallbackId(sourceId)),
                XmlNodes.childText(root, "Version"),
                TestStatus.fromValue(XmlNodes.attr(root, "status")),
                XmlNodes.childText(root, "Title"),
                XmlNodes.childText(root, "Purpose"),
                XmlNodes.texts(XmlNodes.child(root, "Preconditions"), "Precondition"),
                XmlNodes.texts(XmlNodes.child(root, "Profiles"), "Profile"),
                XmlNodes.texts(XmlNodes.child(root, "References"), "Reference"),
                XmlNodes.texts(root, "RefFunction"),
                XmlNodes.texts(root, "RefUser"),
                steps,
                parseNotes(XmlNodes.child(root, "Notes")),
                parseAttachments(XmlNodes.child(root, "Attachments")),
                parseResult(XmlNodes.child(root, "Result")));
    }

    private TestStep parseStep(Element step, int stepNumber) {
        List<ExpectedResult> expectedResults = new ArrayList<>();
        List<Element> resultElements =
                XmlNodes.children(XmlNodes.child(step, "ExpectedResults"), "ExpectedResult");
        for (int j = 0; j < resultElements.size(); j++) {
            Element er = resultElements.get(j);
            expectedResults.add(new ExpectedResult(
                    ExpectedResult.syntheticId(stepNumber, j + 1),
                    XmlNodes.text(er),
                    TestStatus.fromValue(XmlNodes.attr(er, "status")),
                    XmlNodes.attr(er, "actualResult"),
                    parseVariables(XmlNodes.attr(er, "variables"))));
        }

        return new TestStep(
                XmlNodes.attr(step, "id", "step-" + stepNumber),
                XmlNodes.childText(step, "Command", "Action"),
                expectedResults,
                TestStatus.fromValue(XmlNodes.attr(step, "status")),
                XmlNodes.childText(step, "ErrorMessage"),
                XmlNodes.texts(step, "RefFunction"),
                XmlNodes.texts(step, "RefUser"));
    }

    /**
     * {@code k1=v1,k2=v2} biçimindeki attribute'u sıralı haritaya çevirir.
     */
    static Map<String, String> parseVariables(String raw) {
        var variables = new LinkedHashMap<String, String>();
        if (raw == null || raw.isBlank()) {
            return variables;
        }
        for (String pair : raw.split(",")) {
            String[] parts = pair.split("=", 2);
            String key = parts[0].trim();
            if (!key.isEmpty()) {
                variables.put(key, parts.length > 1 ? parts[1] : "");
            }
        }
        return variables;
    }

    private List<Note> parseNotes(Element notes) {
        if (notes == null) {
            return List.of();
        }
        List<Element> noteElements = XmlNodes.children(notes, "Note");
        if (noteElements.isEmpty()) {
            // Eski biçim: <Notes>serbest metin</Notes>
            String legacyText = XmlNodes.text(notes);
            return legacyText.isBlank() || XmlNodes.hasElementChildren(notes)
                    ? List.of()
                    : List.of(new Note(legacyText, null, ""));
        }
        return noteElements.stream()
                .map(n -> new Note(XmlNodes.text(n), XmlNodes.attr(n, "timestamp"), XmlNodes.attr(n, "author")))
                .toList();
    }

    private List<Attachment> parseAttachments(Element attachments) {
        return XmlNodes.children(attachments, "Attachment").stream()
                .map(a -> new Attachment(
                        XmlNodes.attr(a, "filename"),
                        XmlNodes.attr(a, "originalName"),
                        XmlNodes.attr(a, "timestamp"),
                        XmlNodes.attr(a, "description"),
                        XmlNodes.attr(a, "mimeType"),
                        parseSize(XmlNodes.attr(a, "size"))))
                .toList();
    }

    private TestResult parseResult(Element result) {
        if (result == null) {
            return TestResult.empty();
        }
        return new TestResult(
                TestStatus.fromValue(XmlNodes.childText(result, "Status")),
                XmlNodes.childText(result, "Summary"),
                XmlNodes.childText(result, "TestedBy"),
                XmlNodes.childText(result, "TestedDate"),
                XmlNodes.childText(result, "Comments"));
    }

    private static long parseSize(String raw) {
        if (raw == null) {
            return 0;
        }
        try {
            return Long.parseLong(raw.strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String fallbackId(String sourceId) {
        if (sourceId == null) {
            return "";
        }
        int slash = Math.max(sourceId.lastIndexOf('/'), sourceId.lastIndexOf('\\'));
        return InstancePaths.cleanTestcaseId(sourceId.substring(slash + 1));
    }

    // ── Yazma ───────────────────────────────────────────────────────

    @Override
    public String write(TestCase testCase) {
        Document doc = XmlNodes.newDocument();
        Element root = doc.createElementNS(NAMESPACE, ROOT);
        doc.appendChild(root);
        root.setAttribute("id", testCase.id());
        XmlNodes.declareDefaultNamespace(root, NAMESPACE);
        XmlNodes.declareXsi(root);
        if (testCase.status() != null) {
            root.setAttribute("status", testCase.status().name());
        }

        text(root, "Version", testCase.version());
        text(root, "Title", testCase.title());
        text(root, "Purpose", testCase.purpose());
        testCase.refFunctions().forEach(v -> text(root, "RefFunction", v));
        testCase.refUsers().forEach(v -> text(root, "RefUser", v));
        list(root, "Profiles", "Profile", testCase.profiles());
        list(root, "References", "Reference", testCase.references());
        list(root, "Preconditions", "Precondition", testCase.preconditions());

        Element steps = element(root, "TestSteps");
        for (int i = 0; i < testCase.testSteps().size(); i++) {
            writeStep(steps, testCase.testSteps().get(i), i + 1);
        }

        if (!testCase.result().isEmpty()) {
            writeResult(element(root, "Result"), testCase.result());
        }

        if (!testCase.notes().isEmpty()) {
            Element notes = element(root, "Notes");
            for (Note note : testCase.notes()) {
                Element n = text(notes, "Note", note.text());
                n.setAttribute("timestamp", note.timestamp() != null ? note.timestamp() : IsoTimestamps.now(clock));
                n.setAttribute("author", note.author());
            }
        }

        if (!testCase.attachments().isEmpty()) {
            Element attachments = element(root, "Attachments");
            for (Attachment attachment : testCase.attachments()) {
                Element a = element(attachments, "Attachment");
                a.setAttribute("filename", attachment.filename());
                a.setAttribute("originalName", attachment.originalName());
                a.setAttribute("timestamp", attachment.timestamp() != null
                        ? attachment.timestamp() : IsoTimestamps.now(clock));
                a.setAttribute("description", attachment.description());
                a.setAttribute("mimeType", attachment.mimeType());
                a.setAttribute("size", String.valueOf(attachment.size()));
            }
        }

        return XmlNodes.serialize(doc);
    }

    private void writeStep(Element steps, TestStep step, int stepNumber) {
        Element s = element(steps, "TestStep");
        s.setAttribute("id", step.id().isEmpty() ? "step-" + stepNumber : step.id());
        if (step.status() != null) {
            s.setAttribute("status", step.status().name());
        }
        text(s, "Command", step.command());

        Element results = element(s, "ExpectedResults");
        for (ExpectedResult er : step.expectedResults()) {
            Element e = text(results, "ExpectedResult", er.text());
            String variables = joinVariables(er.variables());
            if (er.status() != null || !er.actualResult().isEmpty() || !variables.isEmpty()) {
                e.setAttribute("status", er.status() != null ? er.status().name() : "");
                e.setAttribute("actualResult", er.actualResult());
                if (!variables.isEmpty()) {
                    e.setAttribute("variables", variables);
                }
            }
        }

        step.refFunctions().forEach(v -> text(s, "RefFunction", v));
        step.refUsers().forEach(v -> text(s, "RefUser", v));
        if (!step.errorMessage().isEmpty()) {
            text(s, "ErrorMessage", step.errorMessage());
        }
    }

    private void writeResult(Element result, TestResult value) {
        if (value.status() != null) {
            text(result, "Status", value.status().name());
        }
        if (value.summary() != null) {
            text(result, "Summary", value.summary());
        }
        if (value.testedBy() != null) {
            text(result, "TestedBy", value.testedBy());
        }
        if (value.testedDate() != null) {
            text(result, "TestedDate", value.testedDate());
        }
        if (value.comments() != null) {
            text(result, "Comments", value.comments());
        }
    }

    /**
     * Yalnızca değeri boş olmayan değişkenler yazılır.
     */
    static String joinVariables(Map<String, String> variables) {
        return variables.entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().isEmpty())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    private static void list(Element parent, String containerName, String itemName, List<String> values) {
        Element container = element(parent, containerName);
        values.forEach(v -> text(container, itemName, v));
    }

    private static Element element(Element parent, String name) {
        return XmlNodes.appendElement(parent, NAMESPACE, name);
    }

    private static Element text(Element parent, String name, String value) {
        return XmlNodes.appendText(parent, NAMESPACE, name, value);
    }
}
