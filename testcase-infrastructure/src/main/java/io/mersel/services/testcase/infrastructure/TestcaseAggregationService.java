package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.FilterMode;
import io.mersel.services.testcase.application.enums.SearchMatchType;
import io.mersel.services.testcase.application.enums.TestStatus;
import io.mersel.services.testcase.application.interfaces.ITestcaseAggregationService;
import io.mersel.services.testcase.application.models.DashboardData;
import io.mersel.services.testcase.application.models.DetailedReport;
import io.mersel.services.testcase.application.models.FolderStructure;
import io.mersel.services.testcase.application.models.HashtagIndex;
import io.mersel.services.testcase.application.models.ReportCategory;
import io.mersel.services.testcase.application.models.ReportModule;
import io.mersel.services.testcase.application.models.ReportTestcase;
import io.mersel.services.testcase.application.models.SearchResult;
import io.mersel.services.testcase.application.models.StatusStatistics;
import io.mersel.services.testcase.application.models.TagGroup;
import io.mersel.services.testcase.application.models.TestCase;
import io.mersel.services.testcase.infrastructure.TestcaseTreeWalker.CategoryNode;
import io.mersel.services.testcase.infrastructure.TestcaseTreeWalker.ModuleNode;
import io.mersel.services.testcase.infrastructure.TestcaseTreeWalker.TestcaseFile;
import io.mersel.services.testcase.infrastructure.config.TestcaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Modül/kategori/TestCase ağacı üzerinde toplama, filtreleme ve sayım.
 * <p>
 * Tüm görünümler {@link TestcaseTreeWalker} üzerinden okunur; ayrıştırılamayan dosyalar
 * walker tarafından loglanıp metriğe yazılır ve burada sonuçlardan çıkarılır
 * (klasör görünümünde {@code error=true} yer tutucu olarak kalır).
 * <p>
 * Sıralama: modüller ve kategoriler ada, TestCase'ler kimliğe göre.
 */
@Service
public class TestcaseAggregationService implements ITestcaseAggregationService {

    private static final Logger log = LoggerFactory.getLogger(TestcaseAggregationService.class);

    private static final String OPEN = ReportTestcase.OPEN;

    private final TestcaseTreeWalker walker;
    private final TestcaseProperties properties;

    public TestcaseAggregationService(TestcaseTreeWalker walker, TestcaseProperties properties) {
        this.walker = walker;
        this.properties = properties;
    }

    // ── Rapor toplama ───────────────────────────────────────────────

    @Override
    public List<ReportModule> collectAllTestcases(Path testcasesRoot, List<String> activeProfiles,
                                                  FilterMode filterMode) throws IOException {
        return collectDetailedTestcases(testcasesRoot, activeProfiles, filterMode).modules();
    }

    @Override
    public DetailedReport collectDetailedTestcases(Path testcasesRoot, List<String> activeProfiles,
                                                   FilterMode filterMode) throws IOException {
        FilterMode mode = filterMode != null ? filterMode : FilterMode.OR;
        var overall = new StatusCounter();
        var modules = new ArrayList<ReportModule>();

        for (ModuleNode module : walker.walk(testcasesRoot)) {
            var moduleCounter = new StatusCounter();
            var categories = new ArrayList<ReportCategory>();

            for (CategoryNode category : module.categories()) {
                var categoryCounter = new StatusCounter();
                var testcases = new ArrayList<ReportTestcase>();

                for (TestCase tc : readable(category)) {
                    if (!ProfileFilter.matches(tc.profiles(), activeProfiles, mode)) {
                        continue;
                    }
                    TestStatus status = tc.reportStatus();
                    categoryCounter.add(status);
                    moduleCounter.add(status);
                    overall.add(status);
                    testcases.add(new ReportTestcase(tc.id(), tc.title(), tc.purpose(), tc.profiles(),
                            status != null ? status.name() : OPEN));
                }

                if (!testcases.isEmpty()) {
                    testcases.sort(Comparator.comparing(ReportTestcase::id));
                    categories.add(new ReportCategory(category.name(), testcases, categoryCounter.toStatistics()));
                }
            }

            if (!categories.isEmpty()) {
                modules.add(new ReportModule(module.name(), categories, moduleCounter.toStatistics()));
            }
        }

        log.debug("Rapor verisi toplandı: {} modül, {} TestCase (profiller={}, mod={})",
                modules.size(), overall.total(), activeProfiles, mode);
        return new DetailedReport(modules, overall.toStatistics());
    }

    // ── Klasör yapısı ve arama ──────────────────────────────────────

    @Override
    public FolderStructure readFolderStructure(Path testcasesRoot) throws IOException {
        var modules = new ArrayList<FolderStructure.Module>();

        for (ModuleNode module : walker.walk(testcasesRoot)) {
            var categories = new ArrayList<FolderStructure.Category>();
            for (CategoryNode category : module.categories()) {
                var items = new ArrayList<FolderStructure.Item>();
                for (TestcaseFile file : category.files()) {
                    items.add(file.isReadable()
                            ? toItem(file.filename(), file.testCase())
                            : FolderStructure.Item.unreadable(file.filename()));
                }
                if (!items.isEmpty()) {
                    items.sort(Comparator.comparing(FolderStructure.Item::id));
                    categories.add(new FolderStructure.Category(
                            category.name(), category.name(), category.name(), items));
                }
            }
            if (!categories.isEmpty()) {
                modules.add(new FolderStructure.Module(module.name(), module.name(), module.name(), categories));
            }
        }
        return new FolderStructure(modules);
    }

    private FolderStructure.Item toItem(String filename, TestCase tc) {
        return new FolderStructure.Item(
                tc.id(),
                filename,
                tc.title().isEmpty() ? filename : tc.title(),
                tc.status(),
                tc.profiles(),
                tc.mergedRefFunctions(),
                tc.mergedRefUsers(),
                tc.notes().size(),
                tc.attachments().size(),
                false);
    }

    @Override
    public List<SearchResult> search(Path testcasesRoot, String query) throws IOException {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.strip().toLowerCase(Locale.ROOT);
        var results = new ArrayList<SearchResult>();

        for (ModuleNode module : walker.walk(testcasesRoot)) {
            for (CategoryNode category : module.categories()) {
                for (TestcaseFile file : category.files()) {
                    if (!file.isReadable()) {
                        continue;
                    }
                    TestCase tc = file.testCase();
                    List<String> refFunctions = tc.mergedRefFunctions();
                    List<String> refUsers = tc.mergedRefUsers();
                    SearchMatchType matchType = matchType(tc, refFunctions, refUsers, needle);
                    if (matchType != null) {
                        results.add(new SearchResult(tc.id(), file.filename(), tc.title(), tc.purpose(),
                                tc.status(), tc.profiles(), refFunctions, refUsers,
                                module.name(), category.name(), matchType));
                    }
                }
            }
        }

        log.debug("Arama '{}': {} sonuç", query, results.size());
        return results;
    }

    /**
     * Eşleşen alanı öncelik sırasıyla belirler: id, başlık, fonksiyon, kullanıcı, amaç.
     *
     * @return eşleşme yoksa {@code null}
     */
    static SearchMatchType matchType(TestCase tc, List<String> refFunctions, List<String> refUsers, String needle) {
        if (contains(tc.id(), needle)) {
            return SearchMatchType.ID;
        }
        if (contains(tc.title(), needle)) {
            return SearchMatchType.TITLE;
        }
        if (refFunctions.stream().anyMatch(v -> contains(v, needle))) {
            return SearchMatchType.REF_FUNCTION;
        }
        if (refUsers.stream().anyMatch(v -> contains(v, needle))) {
            return SearchMatchType.REF_USER;
        }
        if (contains(tc.purpose(), needle)) {
            return SearchMatchType.PURPOSE;
        }
        return null;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    // ── Pano ────────────────────────────────────────────────────────

    @Override
    public DashboardData getDashboard(Path testcasesRoot) throws IOException {
        var overall = new StatusCounter();
        Map<String, StatusCounter> byModule = new LinkedHashMap<>();
        Map<String, StatusCounter> byProfile = new TreeMap<>();
        var notes = new ArrayList<DashboardData.RecentNote>();
        var attachments = new ArrayList<DashboardData.RecentAttachment>();

        for (ModuleNode module : walker.walk(testcasesRoot)) {
            StatusCounter moduleCounter = byModule.computeIfAbsent(module.name(), k -> new StatusCounter());
            for (CategoryNode category : module.categories()) {
                for (TestcaseFile file : category.files()) {
                    if (!file.isReadable()) {
                        continue;
                    }
                    TestCase tc = file.testCase();
                    overall.add(tc.status());
                    moduleCounter.add(tc.status());
                    for (String profile : new LinkedHashSet<>(tc.profiles())) {
                        byProfile.computeIfAbsent(profile, k -> new StatusCounter()).add(tc.status());
                    }

                    tc.notes().stream()
                            .filter(n -> !n.text().isBlank())
                            .forEach(n -> notes.add(new DashboardData.RecentNote(tc.id(), module.name(),
                                    category.name(), file.filename(), n.text().strip(), n.timestamp())));
                    tc.attachments().stream()
                            .filter(a -> !a.filename().isBlank())
                            .forEach(a -> attachments.add(new DashboardData.RecentAttachment(tc.id(),
                                    module.name(), category.name(), file.filename(), a.filename().strip(),
                                    a.originalName(), a.mimeType(), a.timestamp())));
                }
            }
        }

        int limit = properties.getReport().getRecentItemLimit();
        var stats = overall.toStatistics();
        return new DashboardData(
                stats.total(), stats.passed(), stats.failed(), stats.skipped(), stats.open(),
                toStatistics(byModule),
                toStatistics(byProfile),
                newestFirst(notes, DashboardData.RecentNote::timestamp, limit),
                newestFirst(attachments, DashboardData.RecentAttachment::timestamp, limit));
    }

    /**
     * En yeni önce sıralar; zaman damgası olmayan veya çözümlenemeyenler sona düşer.
     */
    static <T> List<T> newestFirst(List<T> items, Function<T, String> timestamp, int limit) {
        Comparator<T> byTime = Comparator.comparing(
                (T item) -> IsoTimestamps.parseOrNull(timestamp.apply(item)),
                Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
        return items.stream()
                .sorted(byTime)
                .limit(limit)
                .toList();
    }

    // ── Profil ve etiket görünümleri ────────────────────────────────

    @Override
    public Map<String, TagGroup> getProfilesStructure(Path testcasesRoot) throws IOException {
        Map<String, GroupBuilder> groups = new TreeMap<>();

        for (ModuleNode module : walker.walk(testcasesRoot)) {
            for (CategoryNode category : module.categories()) {
                for (TestcaseFile file : category.files()) {
                    if (!file.isReadable()) {
                        continue;
                    }
                    TestCase tc = file.testCase();
                    var member = member(tc, file.filename(), module.name(), category.name(), tc.profiles());
                    for (String profile : new LinkedHashSet<>(tc.profiles())) {
                        groups.computeIfAbsent(profile, k -> new GroupBuilder(k, null)).add(member, tc.status());
                    }
                }
            }
        }
        return build(groups);
    }

    @Override
    public HashtagIndex getHashtagsStructure(Path testcasesRoot) throws IOException {
        Map<String, GroupBuilder> functions = new TreeMap<>();
        Map<String, GroupBuilder> users = new TreeMap<>();

        for (ModuleNode module : walker.walk(testcasesRoot)) {
            for (CategoryNode category : module.categories()) {
                for (TestcaseFile file : category.files()) {
                    if (!file.isReadable()) {
                        continue;
                    }
                    TestCase tc = file.testCase();
                    var member = member(tc, file.filename(), module.name(), category.name(), null);
                    for (String fn : tc.mergedRefFunctions()) {
                        functions.computeIfAbsent(fn, k -> new GroupBuilder(k, TagGroup.TYPE_FUNCTION))
                                .add(member, tc.status());
                    }
                    for (String user : tc.mergedRefUsers()) {
                        users.computeIfAbsent(user, k -> new GroupBuilder(k, TagGroup.TYPE_USER))
                                .add(member, tc.status());
                    }
                }
            }
        }
        return new HashtagIndex(build(functions), build(users));
    }

    private static TagGroup.Member member(TestCase tc, String filename, String module, String category,
                                          List<String> profiles) {
        return new TagGroup.Member(tc.id(), filename, tc.title(),
                tc.status() != null ? tc.status().name() : OPEN, module, category, profiles);
    }

    private static Map<String, TagGroup> build(Map<String, GroupBuilder> builders) {
        Map<String, TagGroup> result = new LinkedHashMap<>();
        builders.forEach((key, builder) -> result.put(key, builder.build()));
        return result;
    }

    private static Map<String, StatusStatistics> toStatistics(Map<String, StatusCounter> counters) {
        Map<String, StatusStatistics> result = new LinkedHashMap<>();
        counters.forEach((key, counter) -> result.put(key, counter.toStatistics()));
        return result;
    }

    private static List<TestCase> readable(CategoryNode category) {
        return category.files().stream()
                .filter(TestcaseFile::isReadable)
                .map(TestcaseFile::testCase)
                .toList();
    }

    private static final class GroupBuilder {
        private final String name;
        private final String type;
        private final List<TagGroup.Member> members = new ArrayList<>();
        private final StatusCounter counter = new StatusCounter();

        private GroupBuilder(String name, String type) {
            this.name = name;
            this.type = type;
        }

        private void add(TagGroup.Member member, TestStatus status) {
            members.add(member);
            counter.add(status);
        }

        private TagGroup build() {
            members.sort(Comparator.comparing(TagGroup.Member::id));
            return new TagGroup(name, name, type, members, counter.toStatistics());
        }
    }
}
