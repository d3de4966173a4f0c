package dev.postify.config;

import dev.postify.entity.Tenant;
import dev.postify.entity.TenantPolicy;
import dev.postify.model.ApprovalMode;
import dev.postify.model.EffectivePolicy;
import dev.postify.model.TimeoutPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * System-wide rotation settings and tenant policy defaults.
 * Loaded from application.yml under 'rotation' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rotation")
public class RotationProperties {

    private String zone = "Africa/Johannesburg";
    private boolean dryRun = true;

    // Cadence
    private List<String> slots = new ArrayList<>(List.of("09:00", "13:00", "17:30"));
    private int postsPerSlot = 1;

    // Policy defaults
    private int cooldownDays = 14;
    private int monthlyCap = 2;
    private ApprovalMode approvalMode = ApprovalMode.MANUAL;
    private TimeoutPolicy timeoutPolicy = TimeoutPolicy.AUTO_CANCEL;

    // Timeouts
    private int graceMinutes = 120;
    private Duration sweepInterval = Duration.ofMinutes(5);

    // Slot timing: each post of a slot starts after a random 0..jitter delay plus i * stagger
    private int jitterMinutes = 25;
    private int staggerMinutes = 5;

    // Upgrade announcements
    private Duration upgradeWatchInterval = Duration.ofMinutes(5);
    private int upgradeLookbackDays = 7;

    // Total publish attempts per approved candidate, first one included
    private int publishAttempts = 3;

    private int recentTemplateWindow = 3;
    private boolean skipTenantsWithPending = true;
    private String fallbackImageUrl;

    /**
     * Resolve a tenant's policy against the defaults above.
     */
    public EffectivePolicy effectivePolicy(Tenant tenant) {
        TenantPolicy policy = tenant.getPolicy();
        if (policy == null) {
            return new EffectivePolicy(cooldownDays, monthlyCap, approvalMode, timeoutPolicy);
        }
        return new EffectivePolicy(
                policy.getCooldownDays() != null ? policy.getCooldownDays() : cooldownDays,
                policy.getMonthlyCap() != null ? policy.getMonthlyCap() : monthlyCap,
                policy.getApprovalMode() != null ? policy.getApprovalMode() : approvalMode,
                policy.getTimeoutPolicy() != null ? policy.getTimeoutPolicy() : timeoutPolicy);
    }
}
