package io.mersel.services.testcase.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (codec'ler, motorlar, belge servisleri, metrikler) tarar
 * ve {@link TestcaseProperties} özelliklerini etkinleştirir. Zaman damgaları için
 * UTC {@link Clock} sağlar.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.testcase.infrastructure")
@EnableConfigurationProperties(TestcaseProperties.class)
public class InfrastructureConfig {

    /**
     * Not/ek zaman damgaları ve ek dosya adı önekleri için saat. Testlerde sabit saat verilir.
     */
    @Bean
    Clock testcaseClock() {
        return Clock.systemUTC();
    }
}
