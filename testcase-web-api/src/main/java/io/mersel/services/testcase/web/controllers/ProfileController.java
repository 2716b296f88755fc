package io.mersel.services.testcase.web.controllers;

import io.mersel.services.testcase.application.interfaces.DocumentNotFoundException;
import io.mersel.services.testcase.application.interfaces.DocumentParseException;
import io.mersel.services.testcase.application.interfaces.IInstancePathResolver;
import io.mersel.services.testcase.application.interfaces.IProfileConfigurationService;
import io.mersel.services.testcase.application.interfaces.ITestcaseAggregationService;
import io.mersel.services.testcase.web.dto.OperationResponse;
import io.mersel.services.testcase.web.dto.ProfileConfigResponse;
import io.mersel.services.testcase.web.dto.ProfileConfigurationRequestDto;
import io.mersel.services.testcase.web.dto.TagGroupsResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

/**
 * Profil görünümleri ve profil yapılandırması (kontrol listesi) endpoint'leri.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Profiles", description = "Profil/hashtag görünümleri ve profil yapılandırması")
public class ProfileController {

    private final IInstancePathResolver pathResolver;
    private final ITestcaseAggregationService aggregationService;
    private final IProfileConfigurationService profileConfigurationService;

    public ProfileController(IInstancePathResolver pathResolver,
                             ITestcaseAggregationService aggregationService,
                             IProfileConfigurationService profileConfigurationService) {
        this.pathResolver = pathResolver;
        this.aggregationService = aggregationService;
        this.profileConfigurationService = profileConfigurationService;
    }

    @Operation(summary = "Profillere göre gruplanmış TestCase'ler")
    @GetMapping("/{instance}/profiles")
    public ResponseEntity<TagGroupsResponse> profiles(@PathVariable String instance)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        return ResponseEntity.ok(TagGroupsResponse.ofProfiles(
                aggregationService.getProfilesStructure(paths.testcasesPath())));
    }

    @Operation(summary = "RefFunction / RefUser etiketlerine göre gruplanmış TestCase'ler")
    @GetMapping("/{instance}/hashtags")
    public ResponseEntity<TagGroupsResponse> hashtags(@PathVariable String instance)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        return ResponseEntity.ok(TagGroupsResponse.ofHashtags(
                aggregationService.getHashtagsStructure(paths.testcasesPath())));
    }

    @Operation(summary = "Profil yapılandırmasını oku",
            description = """
                    `profiles.xml` varsa onu, yoksa `profiles-template.xml` dosyasını okur.
                    İkisi de yoksa `exists=false` döner. Yanıt türetilmiş aktif profilleri içerir.
                    """)
    @GetMapping("/{instance}/profile-config")
    public ResponseEntity<ProfileConfigResponse> getProfileConfig(@PathVariable String instance)
            throws DocumentNotFoundException, DocumentParseException, IOException {
        var paths = pathResolver.resolve(instance);
        var state = profileConfigurationService.load(paths);
        if (!state.exists()) {
            return ResponseEntity.ok(ProfileConfigResponse.missing());
        }
        return ResponseEntity.ok(ProfileConfigResponse.loaded(state));
    }

    @Operation(summary = "Profil yapılandırmasını kaydet",
            description = "Her zaman `profiles.xml` dosyasına yazar. Eski JSON alan adları da kabul edilir.")
    @PutMapping("/{instance}/profile-config")
    public ResponseEntity<ProfileConfigResponse> saveProfileConfig(@PathVariable String instance,
                                                                   @RequestBody ProfileConfigurationRequestDto request)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        var derived = profileConfigurationService.save(paths, request.toConfiguration());
        return ResponseEntity.ok(ProfileConfigResponse.saved(derived));
    }

    @Operation(summary = "Profil yapılandırmasını sıfırla",
            description = "`profiles.xml` dosyasını siler; şablon dosyasına dokunulmaz.")
    @DeleteMapping("/{instance}/profile-config")
    public ResponseEntity<OperationResponse> resetProfileConfig(@PathVariable String instance)
            throws DocumentNotFoundException, IOException {
        var paths = pathResolver.resolve(instance);
        profileConfigurationService.reset(paths);
        return ResponseEntity.ok(new OperationResponse(true, "Profil yapılandırması sıfırlandı"));
    }
}
