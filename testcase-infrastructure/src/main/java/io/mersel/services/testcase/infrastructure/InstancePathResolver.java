package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.IInstancePathResolver;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.infrastructure.config.TestcaseProperties;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Instance adını {@code testcase.instances-root} altındaki dizinlere çözer.
 * <p>
 * Instance dizini: {@code <kök>/<ad>}, TestCase ağacı: {@code <kök>/<ad>/testcases}.
 */
@Service
public class InstancePathResolver implements IInstancePathResolver {

    private static final Pattern INSTANCE_NAME = Pattern.compile("^[a-zA-Z0-9_-]+$");
    static final String TESTCASES_DIR = "testcases";

    private final TestcaseProperties properties;

    public InstancePathResolver(TestcaseProperties properties) {
        this.properties = properties;
    }

    @Override
    public InstancePaths resolve(String instanceName) throws DocumentNotFoundException {
        if (instanceName == null || !INSTANCE_NAME.matcher(instanceName).matches()) {
            throw new IllegalArgumentException("Geçersiz instance adı: " + instanceName);
        }

        Path root = Path.of(properties.getInstancesRoot()).toAbsolutePath().normalize();
        Path instancePath = resolveWithin(root, instanceName);
        if (!Files.isDirectory(instancePath)) {
            throw new DocumentNotFoundException("Instance bulunamadı: " + instanceName);
        }
        return new InstancePaths(instanceName, instancePath, instancePath.resolve(TESTCASES_DIR));
    }

    /**
     * Göreceli yol parçalarını {@code base} altında çözer.
     *
     * @throws SecurityException sonuç {@code base} dışına çıkıyorsa
     */
    static Path resolveWithin(Path base, String... segments) {
        Path normalizedBase = base.toAbsolutePath().normalize();
        Path resolved = normalizedBase;
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("Boş yol parçası");
            }
            resolved = resolved.resolve(segment);
        }
        resolved = resolved.normalize();
        if (!resolved.startsWith(normalizedBase) || resolved.equals(normalizedBase)) {
            throw new SecurityException("Path traversal engellendi: " + String.join("/", segments));
        }
        return resolved;
    }
}
