package io.mersel.services.testcase.web;

import io.mersel.services.testcase.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL TestCase Service - Ana uygulama giriş noktası.
 * <p>
 * Dosya sistemi üzerindeki TestCase ve profil yapılandırması XML belgelerini
 * okur, düzenler ve profil filtreli rapor verisi üretir.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class TestcaseServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestcaseServiceApplication.class, args);
    }
}
