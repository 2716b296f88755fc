package io.mersel.services.testcase.application.models;

import java.util.List;

/**
 * Okunan profil yapılandırması ve ondan türetilen aktif profiller.
 *
 * @param exists          {@code profiles.xml} veya şablon bulundu mu
 * @param source          "profiles" veya "template"; bulunamadıysa {@code null}
 * @param configuration   Yapılandırma; bulunamadıysa {@code null}
 * @param derivedProfiles Türetilen aktif profiller (sıralı, tekil)
 */
public record ProfileConfigurationState(
        boolean exists,
        String source,
        ProfileConfiguration configuration,
        List<String> derivedProfiles
) {

    public static final String SOURCE_PROFILES = "profiles";
    public static final String SOURCE_TEMPLATE = "template";

    public ProfileConfigurationState {
        derivedProfiles = ModelDefaults.list(derivedProfiles);
    }

    public static ProfileConfigurationState missing() {
        return new ProfileConfigurationState(false, null, null, List.of());
    }
}
