package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.infrastructure.diagnostics.TestcaseMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

import static io.mersel.services.testcase.infrastructure.TreeFixture.testcase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TestcaseTreeWalker birim testleri.
 * <p>
 * Sıralamayı, gizli girdilerin atlanmasını ve okunamayan dosya/dizinlerde
 * taramanın sürmesini test eder.
 */
@DisplayName("TestcaseTreeWalker")
class TestcaseTreeWalkerTest {

    @TempDir
    Path root;

    private SimpleMeterRegistry registry;
    private TestcaseMetrics metrics;
    private TreeFixture tree;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TestcaseMetrics(registry);
        tree = new TreeFixture(root);
    }

    /**
     * Verilen dizin için listeleme hatası üreten walker.
     */
    private TestcaseTreeWalker walkerFailingOn(Path unreadable) {
        return new TestcaseTreeWalker(new TestcaseXmlCodec(TreeFixture.CLOCK), metrics) {
            @Override
            List<Path> list(Path dir, Predicate<Path> filter) throws IOException {
                if (dir.equals(unreadable)) {
                    throw new AccessDeniedException(dir.toString());
                }
                return super.list(dir, filter);
            }
        };
    }

    @Test
    @DisplayName("walk: modül, kategori ve dosyalar ada göre sıralı; _ ve . ile başlayanlar atlanır")
    void walk_sortedAndFiltered() throws Exception {
        tree.write("MOD_B", "CAT_1", testcase("TC_02", null));
        tree.write("MOD_A", "CAT_2", testcase("TC_03", null));
        tree.write("MOD_A", "CAT_1", testcase("TC_01", null));
        tree.write("_intern", "CAT_1", testcase("TC_09", null));
        tree.writeRaw("MOD_A", "CAT_1", ".gizli.xml", "<TestCase/>");

        var modules = walkerFailingOn(null).walk(root);

        assertThat(modules).extracting(TestcaseTreeWalker.ModuleNode::name).containsExactly("MOD_A", "MOD_B");
        assertThat(modules.get(0).categories())
                .extracting(TestcaseTreeWalker.CategoryNode::name).containsExactly("CAT_1", "CAT_2");
        assertThat(modules.get(0).categories().get(0).files())
                .extracting(TestcaseTreeWalker.TestcaseFile::filename).containsExactly("TC_01.xml");
    }

    @Test
    @DisplayName("walk: listelenemeyen kategori atlanır, tarama diğer dizinlerle sürer")
    void walk_skipsUnreadableCategory() throws Exception {
        tree.write("MOD_A", "CAT_1", testcase("TC_01", null));
        tree.write("MOD_A", "CAT_2", testcase("TC_02", null));
        tree.write("MOD_B", "CAT_1", testcase("TC_03", null));

        var modules = walkerFailingOn(root.resolve("MOD_A").resolve("CAT_1")).walk(root);

        assertThat(modules).extracting(TestcaseTreeWalker.ModuleNode::name).containsExactly("MOD_A", "MOD_B");
        assertThat(modules.get(0).categories())
                .extracting(TestcaseTreeWalker.CategoryNode::name).containsExactly("CAT_2");
        assertThat(registry.counter("testcase_directory_skips_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("walk: listelenemeyen modül atlanır")
    void walk_skipsUnreadableModule() throws Exception {
        tree.write("MOD_A", "CAT_1", testcase("TC_01", null));
        tree.write("MOD_B", "CAT_1", testcase("TC_02", null));

        var modules = walkerFailingOn(root.resolve("MOD_A")).walk(root);

        assertThat(modules).extracting(TestcaseTreeWalker.ModuleNode::name).containsExactly("MOD_B");
        assertThat(registry.counter("testcase_directory_skips_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("walk: kök dizin listelenemezse hata yayılır")
    void walk_rootFailurePropagates() {
        assertThatThrownBy(() -> walkerFailingOn(root).walk(root))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("walk: ayrıştırılamayan dosya okunamaz olarak işaretlenir")
    void walk_marksBrokenFile() throws Exception {
        tree.writeRaw("MOD_A", "CAT_1", "BROKEN.xml", "<TestCase><Title>");

        var file = walkerFailingOn(null).walk(root).get(0).categories().get(0).files().get(0);

        assertThat(file.isReadable()).isFalse();
        assertThat(registry.counter("testcase_document_parse_failures_total", "document_type", "testcase").count())
                .isEqualTo(1.0);
    }
}
