package io.mersel.services.testcase.application.models;

/**
 * Instance özet bilgisi. Ürün alanları profil yapılandırmasının meta verisinden gelir.
 */
public record InstanceInfo(
        String id,
        String name,
        String path,
        String productName,
        String manufacturer,
        String version
) {
}
