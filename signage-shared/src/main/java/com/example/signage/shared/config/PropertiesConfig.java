package com.example.signage.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.signage.shared.repository")
public class PropertiesConfig {

    // Binds signage.sse.*, signage.scheduling.* and signage.health.*
    @Bean
    @ConfigurationProperties(prefix = "signage")
    public AppProperties appProperties() {
        return new AppProperties();
    }
}
