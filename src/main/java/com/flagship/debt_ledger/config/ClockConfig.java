package com.flagship.debt_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wall clock used for "now" and for turning instants into calendar dates.
 *
 * Repayment days are evaluated in {@code debt.zone-id}, UTC unless set.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${debt.zone-id:UTC}") String zoneId) {
        ZoneId zone = ZoneId.of(zoneId);
        log.info("Evaluating repayment dates in zone {}", zone);
        return Clock.system(zone);
    }
}
