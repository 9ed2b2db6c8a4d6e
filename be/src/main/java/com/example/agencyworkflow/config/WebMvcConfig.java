package com.example.agencyworkflow.config;

import lombok.RequiredArgsConstructor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * MVC config: CORS for the editor front end.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig {

    private final WorkflowCompilerProperties properties;

    @Bean
    public WebMvcConfigurer webMvcConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                if (properties.corsAllowedOrigins().isEmpty()) {
                    return;
                }
                registry.addMapping("/api/**")
                        .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                        .allowedHeaders("*");
            }
        };
    }
}
