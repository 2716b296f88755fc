package io.mersel.services.testcase.application.models;

import io.mersel.services.testcase.application.enums.TestStatus;

import java.util.List;

/**
 * Instance TestCase ağacının gezinme görünümü (modül → kategori → TestCase).
 * <p>
 * Ayrıştırılamayan dosyalar {@code error=true} işaretli yer tutucu olarak listelenir.
 */
public record FolderStructure(List<Module> modules) {

    public FolderStructure {
        modules = ModelDefaults.list(modules);
    }

    public record Module(String id, String name, String path, List<Category> categories) {

        public Module {
            categories = ModelDefaults.list(categories);
        }
    }

    public record Category(String id, String name, String path, List<Item> testcases) {

        public Category {
            testcases = ModelDefaults.list(testcases);
        }
    }

    /**
     * @param refFunctions TestCase ve adım etiketlerinin tekilleştirilmiş birleşimi
     * @param refUsers     TestCase ve adım etiketlerinin tekilleştirilmiş birleşimi
     * @param error        Dosya ayrıştırılamadıysa {@code true}
     */
    public record Item(
            String id,
            String filename,
            String title,
            TestStatus status,
            List<String> profiles,
            List<String> refFunctions,
            List<String> refUsers,
            int notesCount,
            int attachmentsCount,
            boolean error
    ) {

        public Item {
            profiles = ModelDefaults.list(profiles);
            refFunctions = ModelDefaults.list(refFunctions);
            refUsers = ModelDefaults.list(refUsers);
        }

        public static Item unreadable(String filename) {
            return new Item(InstancePaths.cleanTestcaseId(filename), filename, filename, null,
                    List.of(), List.of(), List.of(), 0, 0, true);
        }
    }
}
