package com.example.agencyworkflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(WorkflowCompilerProperties.class)
public class CompilerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
