package io.mersel.services.testcase.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI testcaseServiceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL TestCase Service API")
                        .description("""
                                Dosya tabanlı TestCase ve profil yapılandırması yönetim servisi.

                                ## Özellikler
                                - **TestCase Belgeleri**: Güncel ve eski XML biçimlerini okur, her zaman güncel biçimde yazar
                                - **Notlar ve Ekler**: TestCase belgelerine not ve dosya eki ekleme/silme
                                - **Profil Yapılandırması**: Kontrol listesi cevaplarından aktif profilleri türetir
                                - **Arama ve Dashboard**: Modül/kategori ağacı üzerinde arama ve durum istatistikleri
                                - **Rapor Verisi**: Profil filtreli, varyant gruplamalı ve boşluk tespitli rapor çıktısı
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT"))
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
