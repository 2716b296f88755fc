package io.mersel.services.testcase.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileConfigurationState;

import java.util.List;

/**
 * Profil yapılandırması okuma/kaydetme yanıtı.
 * <p>
 * Okumada yapılandırma alanları kök seviyesinde döner ({@code completed, metadata, sections, ...});
 * {@code activeProfiles}, {@code derivedProfiles} ile aynı listedir ve eski istemciler için tutulur.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfileConfigResponse(
        Boolean exists,
        Boolean success,
        String message,
        String source,
        @JsonUnwrapped ProfileConfiguration configuration,
        List<String> derivedProfiles,
        List<String> activeProfiles
) {

    public static ProfileConfigResponse missing() {
        return new ProfileConfigResponse(false, null, "Profil yapılandırması bulunamadı",
                null, null, null, null);
    }

    public static ProfileConfigResponse loaded(ProfileConfigurationState state) {
        return new ProfileConfigResponse(true, null, null, state.source(), state.configuration(),
                state.derivedProfiles(), state.derivedProfiles());
    }

    public static ProfileConfigResponse saved(List<String> derivedProfiles) {
        return new ProfileConfigResponse(null, true, "Profil yapılandırması kaydedildi", null, null,
                derivedProfiles, derivedProfiles);
    }
}
