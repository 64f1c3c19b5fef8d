package com.agentid.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Shared ledger beans. The clock is a bean so time-dependent rules (rate windows,
 * daily caps, claim expiry) can be driven from tests.
 */
@Configuration
@EnableScheduling
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
