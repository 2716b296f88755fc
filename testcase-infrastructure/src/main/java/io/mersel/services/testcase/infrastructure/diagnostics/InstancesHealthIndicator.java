package io.mersel.services.testcase.infrastructure.diagnostics;

import io.mersel.services.testcase.infrastructure.config.TestcaseProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Instance kök dizininin durumunu kontrol eden sağlık göstergesi.
 * <p>
 * Kontroller:
 * <ul>
 *   <li>Kök dizin yapılandırılmış mı? Değilse DOWN</li>
 *   <li>Kök dizin erişilebilir mi? Değilse DOWN</li>
 *   <li>Instance sayısı detay olarak raporlanır (UP durumunu etkilemez)</li>
 * </ul>
 */
@Component
public class InstancesHealthIndicator implements HealthIndicator {

    private final TestcaseProperties properties;

    public InstancesHealthIndicator(TestcaseProperties properties) {
        this.properties = properties;
    }

    @Override
    public Health health() {
        String configured = properties.getInstancesRoot();
        if (configured == null || configured.isBlank()) {
            return Health.down()
                    .withDetail("instances_root", "not_configured")
                    .build();
        }

        Path root = Path.of(configured).toAbsolutePath().normalize();
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            return Health.down()
                    .withDetail("instances_root", "not_accessible")
                    .withDetail("path", root.toString())
                    .build();
        }

        var builder = Health.up()
                .withDetail("instances_root", "accessible")
                .withDetail("path", root.toString());

        try (Stream<Path> entries = Files.list(root)) {
            long instanceCount = entries
                    .filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .count();
            builder.withDetail("instances", instanceCount);
        } catch (IOException e) {
            builder.withDetail("warning", "Instance listesi okunamadı: " + e.getMessage());
        }

        return builder.build();
    }
}
