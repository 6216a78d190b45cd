package com.nicedentist.manager.config;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The clinic runs in a single timezone; every "now" in the application comes from this clock.
 */
@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Value("${nicedentist.timezone:}")
    private String timezone;

    @Bean
    public Clock clock() {
        ZoneId zone = StringUtils.isBlank(timezone) ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
        log.info("Clinic clock running in zone {}", zone);
        return Clock.system(zone);
    }
}
