package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.InstanceInfo;
import io.mersel.services.testcase.application.models.InstancePaths;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileConfigurationState;

import java.io.IOException;
import java.util.List;

/**
 * Instance profil yapılandırmasının ({@code profiles.xml}) yönetimi.
 */
public interface IProfileConfigurationService {

    /**
     * {@code profiles.xml} okunur, yoksa {@code profiles-template.xml}.
     * İkisi de yoksa hata değil, "mevcut değil" durumu döner.
     */
    ProfileConfigurationState load(InstancePaths paths) throws DocumentParseException, IOException;

    /**
     * Her zaman {@code profiles.xml} dosyasına yazar.
     *
     * @return kaydedilen yapılandırmadan türetilen aktif profiller
     */
    List<String> save(InstancePaths paths, ProfileConfiguration configuration) throws IOException;

    /**
     * {@code profiles.xml} dosyasını siler; sonraki okumalar şablona düşer.
     */
    void reset(InstancePaths paths) throws IOException;

    /**
     * Okunamayan yapılandırma yok sayılır, ürün alanları boş kalır.
     */
    InstanceInfo getInstanceInfo(InstancePaths paths);
}
