package io.mersel.services.testcase.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.testcase.application.models.HashtagIndex;
import io.mersel.services.testcase.application.models.TagGroup;

import java.util.List;
import java.util.Map;

/**
 * Profil ve hashtag görünümleri için grup listeleri.
 * <p>
 * Profil görünümünde yalnızca {@code profiles}, hashtag görünümünde
 * {@code functions} ve {@code users} doldurulur.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TagGroupsResponse(List<TagGroup> profiles, List<TagGroup> functions, List<TagGroup> users) {

    public static TagGroupsResponse ofProfiles(Map<String, TagGroup> profiles) {
        return new TagGroupsResponse(List.copyOf(profiles.values()), null, null);
    }

    public static TagGroupsResponse ofHashtags(HashtagIndex index) {
        return new TagGroupsResponse(null,
                List.copyOf(index.functions().values()),
                List.copyOf(index.users().values()));
    }
}
