package com.flagship.tax_submission.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock used for issue dates, certificate validity checks and error logs.
 *
 * Issue dates are rendered in the tax authority's time zone, not the host's.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${documents.time-zone:America/Lima}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
