package dev.postify.entity;

import dev.postify.model.ApprovalMode;
import dev.postify.model.TimeoutPolicy;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-tenant policy overrides. A null field means "use the system default".
 */
@Data
@Builder
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class TenantPolicy {

    @Column(name = "cooldown_days")
    private Integer cooldownDays;

    @Column(name = "monthly_cap")
    private Integer monthlyCap;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_mode", length = 20)
    private ApprovalMode approvalMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "timeout_policy", length = 20)
    private TimeoutPolicy timeoutPolicy;
}
