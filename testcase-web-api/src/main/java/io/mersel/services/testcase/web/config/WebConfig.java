package io.mersel.services.testcase.web.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC yapılandırması.
 * <p>
 * CORS: Varsayılan olarak yalnızca aynı origin'e izin verir.
 * {@code testcase.cors.allowed-origins} ile virgülle ayrılmış origin listesi tanımlanabilir.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${testcase.cors.allowed-origins:}")
    private String allowedOriginsConfig;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins;
        if (allowedOriginsConfig != null && !allowedOriginsConfig.isBlank()) {
            origins = allowedOriginsConfig.split(",");
        } else {
            origins = new String[0];
        }

        var mapping = registry.addMapping("/api/**")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);

        if (origins.length > 0) {
            mapping.allowedOrigins(origins).allowCredentials(true);
        }
    }
}
