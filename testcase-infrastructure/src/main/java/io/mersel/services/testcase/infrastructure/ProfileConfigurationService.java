package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationCodec;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationService;
import io.mersel.services.testcase.application.interfaces.IProfileDerivationService;
import io.mersel.services.testcase.application.models.InstanceInfo;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileConfigurationState;
import io.mersel.services.testcase.application.models.ProfileMetadata;
import io.mersel.services.testcase.infrastructure.diagnostics.TestcaseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Instance profil yapılandırmasını okur, yazar ve sıfırlar.
 * <p>
 * Okuma sırası: {@code profiles.xml}, yoksa {@code profiles-template.xml}.
 * Yazma her zaman {@code profiles.xml} dosyasına yapılır; şablon hiç değiştirilmez.
 */
@Service
public class ProfileConfigurationService implements IProfileConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(ProfileConfigurationService.class);

    static final String PROFILES_FILE = "profiles.xml";
    static final String TEMPLATE_FILE = "profiles-template.xml";

    private final IProfileConfigurationCodec codec;
    private final IProfileDerivationService derivationService;
    private final TestcaseMetrics metrics;

    public ProfileConfigurationService(IProfileConfigurationCodec codec,
                                       IProfileDerivationService derivationService,
                                       TestcaseMetrics metrics) {
        this.codec = codec;
        this.derivationService = derivationService;
        this.metrics = metrics;
    }

    @Override
    public ProfileConfigurationState load(InstancePaths paths) throws DocumentParseException, IOException {
        Path profiles = paths.testcasesPath().resolve(PROFILES_FILE);
        Path template = paths.testcasesPath().resolve(TEMPLATE_FILE);

        Path source;
        String sourceName;
        if (Files.isRegularFile(profiles)) {
            source = profiles;
            sourceName = ProfileConfigurationState.SOURCE_PROFILES;
        } else if (Files.isRegularFile(template)) {
            source = template;
            sourceName = ProfileConfigurationState.SOURCE_TEMPLATE;
        } else {
            log.debug("Profil yapılandırması bulunamadı: {}", paths.instanceName());
            return ProfileConfigurationState.missing();
        }

        ProfileConfiguration configuration;
        try {
            configuration = codec.parse(Files.readString(source, StandardCharsets.UTF_8), source.toString());
        } catch (DocumentParseException e) {
            metrics.recordParseFailure("profiles");
            throw e;
        }

        List<String> derived = derivationService.deriveActiveProfiles(configuration);
        log.debug("Profil yapılandırması yüklendi: {} (kaynak: {}, aktif profil: {})",
                paths.instanceName(), sourceName, derived.size());
        return new ProfileConfigurationState(true, sourceName, configuration, derived);
    }

    @Override
    public List<String> save(InstancePaths paths, ProfileConfiguration configuration) throws IOException {
        Path target = paths.testcasesPath().resolve(PROFILES_FILE);
        Files.createDirectories(target.getParent());
        Files.writeString(target, codec.write(configuration), StandardCharsets.UTF_8);

        List<String> derived = derivationService.deriveActiveProfiles(configuration);
        metrics.recordWrite("profiles_save");
        log.info("Profil yapılandırması kaydedildi: {} (aktif profiller: {})", paths.instanceName(), derived);
        return derived;
    }

    @Override
    public void reset(InstancePaths paths) throws IOException {
        Path target = paths.testcasesPath().resolve(PROFILES_FILE);
        if (Files.deleteIfExists(target)) {
            metrics.recordWrite("profiles_reset");
            log.info("Profil yapılandırması sıfırlandı: {}", paths.instanceName());
        } else {
            log.debug("Sıfırlanacak profil yapılandırması yok: {}", paths.instanceName());
        }
    }

    @Override
    public InstanceInfo getInstanceInfo(InstancePaths paths) {
        ProfileMetadata metadata = ProfileMetadata.empty();
        try {
            ProfileConfigurationState state = load(paths);
            if (state.exists()) {
                metadata = state.configuration().metadata();
            }
        } catch (DocumentParseException | IOException e) {
            log.warn("Instance bilgisi için profil yapılandırması okunamadı: {} - {}",
                    paths.instanceName(), e.getMessage());
        }

        return new InstanceInfo(
                paths.instanceName(),
                paths.instanceName(),
                paths.instancePath().toString(),
                metadata.productName(),
                metadata.manufacturer(),
                metadata.productVersion());
    }
}
