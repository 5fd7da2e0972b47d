package com.example.pms.router.config;

import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the router endpoints. Origins come from {@code cors.allowed-origins} (comma separated);
 * nothing is registered when it is empty.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final List<String> configuredOrigins;

    public CorsConfig(@Value("${cors.allowed-origins:}") String rawOrigins) {
        this.configuredOrigins = parseOrigins(rawOrigins);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (configuredOrigins.isEmpty()) {
            return;
        }
        registry.addMapping("/v1/**")
                .allowedOriginPatterns(configuredOrigins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Content-Type", "X-Tenant-Id", "X-User-Id", "X-User-Role");
    }

    static List<String> parseOrigins(String rawOrigins) {
        if (!StringUtils.hasText(rawOrigins)) {
            return List.of();
        }
        return Arrays.stream(rawOrigins.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList();
    }
}
