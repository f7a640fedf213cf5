package org.example.verse.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    // "Today" for the verse of the day is evaluated in this zone
    @Bean
    public Clock clock(@Value("${verse.timezone:UTC}") String timezone) {
        ZoneId zone = ZoneId.of(timezone.trim());
        log.info("Verse of the day resolved in time zone {}", zone);
        return Clock.system(zone);
    }
}
