package com.gatekeeper.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class AuthConfig {

    /** Time source for token issuance and expiry checks. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
