package com.example.SmartDairy.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SmartDairyProperties.class)
public class AppConfig {

    /**
     * Time source for cache freshness and response timing.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
