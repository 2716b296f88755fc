package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.ITestcaseCodec;
import io.mersel.services.testcase.application.models.TestCase;
import io.mersel.services.testcase.infrastructure.diagnostics.TestcaseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * {@code <kök>/<modül>/<kategori>/*.xml} ağacını okur.
 * <p>
 * {@code .} veya {@code _} ile başlayan dizin ve dosyalar atlanır. Modüller, kategoriler
 * ve dosyalar ada göre sıralanır. Okunamayan veya ayrıştırılamayan dosyalar taramayı
 * durdurmaz: loglanır, metriğe yazılır ve {@link TestcaseFile#testCase()} {@code null}
 * olarak döner. Listelenemeyen modül ve kategori dizinleri de loglanıp atlanır.
 */
@Component
public class TestcaseTreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TestcaseTreeWalker.class);

    private final ITestcaseCodec codec;
    private final TestcaseMetrics metrics;

    public TestcaseTreeWalker(ITestcaseCodec codec, TestcaseMetrics metrics) {
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * @param root TestCase ağacının kökü; yoksa boş liste döner
     * @return boş dizinler dahil tüm modüller ve kategoriler
     * @throws IOException kök dizin listelenemezse
     */
    public List<ModuleNode> walk(Path root) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            log.debug("TestCase kök dizini bulunamadı: {}", root);
            return List.of();
        }

        var modules = new ArrayList<ModuleNode>();
        for (Path moduleDir : list(root, Files::isDirectory)) {
            List<Path> categoryDirs = listOrSkip(moduleDir, Files::isDirectory);
            if (categoryDirs == null) {
                continue;
            }
            var categories = new ArrayList<CategoryNode>();
            for (Path categoryDir : categoryDirs) {
                List<Path> xmlFiles = listOrSkip(categoryDir, p -> Files.isRegularFile(p) && isXml(p));
                if (xmlFiles == null) {
                    continue;
                }
                var files = new ArrayList<TestcaseFile>();
                for (Path file : xmlFiles) {
                    files.add(read(file));
                }
                categories.add(new CategoryNode(name(categoryDir), files));
            }
            modules.add(new ModuleNode(name(moduleDir), categories));
        }
        return modules;
    }

    /**
     * @return görünür ve filtreye uyan girdiler; dizin listelenemezse {@code null}
     */
    private List<Path> listOrSkip(Path dir, Predicate<Path> filter) {
        try {
            return list(dir, filter);
        } catch (IOException e) {
            log.warn("Dizin atlandı: {} ({})", dir, e.getMessage());
            metrics.recordSkippedDirectory();
            return null;
        }
    }

    private TestcaseFile read(Path file) {
        String filename = name(file);
        try {
            String xml = Files.readString(file, StandardCharsets.UTF_8);
            return new TestcaseFile(filename, codec.parse(xml, file.toString()));
        } catch (DocumentParseException | IOException e) {
            log.warn("TestCase dosyası atlandı: {} ({})", file, e.getMessage());
            metrics.recordParseFailure("testcase");
            return new TestcaseFile(filename, null);
        }
    }

    List<Path> list(Path dir, Predicate<Path> filter) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(p -> isVisible(name(p)))
                    .filter(filter)
                    .sorted(Comparator.comparing(TestcaseTreeWalker::name))
                    .toList();
        }
    }

    static boolean isVisible(String name) {
        return !name.startsWith(".") && !name.startsWith("_");
    }

    private static boolean isXml(Path file) {
        return name(file).endsWith(".xml");
    }

    private static String name(Path path) {
        return path.getFileName().toString();
    }

    // ── Ağaç düğümleri ──

    public record ModuleNode(String name, List<CategoryNode> categories) {
    }

    public record CategoryNode(String name, List<TestcaseFile> files) {
    }

    /**
     * @param filename  Dosya adı
     * @param testCase  Ayrıştırılmış TestCase; dosya okunamadıysa {@code null}
     */
    public record TestcaseFile(String filename, TestCase testCase) {

        public boolean isReadable() {
            return testCase != null;
        }
    }
}
