package com.trusty.decisionservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for browser callers: any origin, the methods the API uses, and the headers clients send
 * (credentials travel in {@code Authorization}, which is never validated here).
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "DELETE", "PATCH")
                .allowedHeaders("User-Agent", "Content-Type", "Authorization")
                .exposedHeaders("X-Correlation-ID")
                .maxAge(3600);
    }
}
