package io.mersel.services.testcase.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * TestCase servisi yapılandırma özellikleri.
 * <p>
 * {@code testcase} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code instances-root}: Instance dizinlerinin bulunduğu kök (varsayılan {@code ./instances})</li>
 *   <li>{@code attachments.allowed-mime-types}: Yüklenebilecek ek MIME tipleri</li>
 *   <li>{@code report.recent-item-limit}: Panoda gösterilecek son not/ek sayısı (pozitif olmalı)</li>
 * </ul>
 * Kök dizin başlangıçtan sonra salt okunurdur; codec ve tarama bileşenlerine parametre olarak geçirilir.
 */
@ConfigurationProperties(prefix = "testcase")
public class TestcaseProperties {

    private static final Logger log = LoggerFactory.getLogger(TestcaseProperties.class);

    static final String DEFAULT_INSTANCES_ROOT = "./instances";
    static final int DEFAULT_RECENT_ITEM_LIMIT = 20;

    static final List<String> DEFAULT_ALLOWED_MIME_TYPES = List.of(
            "image/jpeg",
            "image/png",
            "image/gif",
            "image/webp",
            "image/svg+xml",
            "application/pdf",
            "text/plain",
            "text/csv",
            "text/xml",
            "application/json",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/zip",
            "application/x-zip-compressed"
    );

    private String instancesRoot = DEFAULT_INSTANCES_ROOT;
    private final Attachments attachments = new Attachments();
    private final Report report = new Report();

    @PostConstruct
    void validate() {
        if (instancesRoot == null || instancesRoot.isBlank()) {
            log.warn("testcase.instances-root boş, varsayılan {} kullanılıyor", DEFAULT_INSTANCES_ROOT);
            instancesRoot = DEFAULT_INSTANCES_ROOT;
        }
        if (report.recentItemLimit <= 0) {
            log.warn("testcase.report.recent-item-limit pozitif olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    report.recentItemLimit, DEFAULT_RECENT_ITEM_LIMIT);
            report.recentItemLimit = DEFAULT_RECENT_ITEM_LIMIT;
        }
        if (attachments.allowedMimeTypes == null || attachments.allowedMimeTypes.isEmpty()) {
            log.warn("testcase.attachments.allowed-mime-types boş, varsayılan liste kullanılıyor");
            attachments.allowedMimeTypes = new ArrayList<>(DEFAULT_ALLOWED_MIME_TYPES);
        }
    }

    public String getInstancesRoot() {
        return instancesRoot;
    }

    public void setInstancesRoot(String instancesRoot) {
        this.instancesRoot = instancesRoot;
    }

    public Attachments getAttachments() {
        return attachments;
    }

    public Report getReport() {
        return report;
    }

    public static class Attachments {

        private List<String> allowedMimeTypes = new ArrayList<>(DEFAULT_ALLOWED_MIME_TYPES);

        public List<String> getAllowedMimeTypes() {
            return allowedMimeTypes;
        }

        public void setAllowedMimeTypes(List<String> allowedMimeTypes) {
            this.allowedMimeTypes = allowedMimeTypes;
        }
    }

    public static class Report {

        private int recentItemLimit = DEFAULT_RECENT_ITEM_LIMIT;

        public int getRecentItemLimit() {
            return recentItemLimit;
        }

        public void setRecentItemLimit(int recentItemLimit) {
            this.recentItemLimit = recentItemLimit;
        }
    }
}
