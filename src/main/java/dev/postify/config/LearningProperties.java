package dev.postify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Rejection pattern learning.
 * Loaded from application.yml under 'learning' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "learning")
public class LearningProperties {

    private int windowDays = 30;
    private int minRejections = 3;
    private String cron = "0 30 6 * * *";
}
