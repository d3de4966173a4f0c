package dev.postify.config;

import dev.postify.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Single clock for the whole engine, in the configured rotation time zone.
 */
@Slf4j
@Configuration
public class ClockConfig {

    @Bean
    public Clock rotationClock(RotationProperties properties) {
        try {
            ZoneId zone = ZoneId.of(properties.getZone());
            log.info("Rotation clock zone: {}", zone);
            return Clock.system(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid rotation.zone: " + properties.getZone(), e);
        }
    }
}
