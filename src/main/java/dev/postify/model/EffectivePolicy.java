package dev.postify.model;

/**
 * Tenant policy with every field resolved against the system defaults.
 */
public record EffectivePolicy(
        int cooldownDays,
        int monthlyCap,
        ApprovalMode approvalMode,
        TimeoutPolicy timeoutPolicy) {
}
