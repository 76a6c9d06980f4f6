package com.backoffice.ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    // Source of "today" for statuses, default payment dates and credit application dates
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
