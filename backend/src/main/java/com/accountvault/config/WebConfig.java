package com.accountvault.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Cross-origin access for the API, so the frontend can be served from another origin.
 */
@Configuration
public class WebConfig implements WebFluxConfigurer {

    private final AccountProperties properties;

    public WebConfig(AccountProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST");
    }
}
