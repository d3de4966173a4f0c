package dev.postify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Approval channel settings.
 * Loaded from application.yml under 'approval' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "approval")
public class ApprovalProperties {

    /**
     * "log" (default) or "telegram".
     */
    private String channel = "log";

    private Telegram telegram = new Telegram();

    @Data
    public static class Telegram {
        private String botToken;
        private String chatId;
        private String baseUrl = "https://api.telegram.org";
        private int pollTimeoutSeconds = 25;
        private Duration pollInterval = Duration.ofSeconds(2);
    }
}
