package io.mersel.services.testcase.application.models;

import java.util.Map;

/**
 * RefFunction ve RefUser etiketlerine göre TestCase grupları, etiket adına göre sıralı.
 */
public record HashtagIndex(Map<String, TagGroup> functions, Map<String, TagGroup> users) {

    public HashtagIndex {
        functions = ModelDefaults.orderedMap(functions);
        users = ModelDefaults.orderedMap(users);
    }
}
