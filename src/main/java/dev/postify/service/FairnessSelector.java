package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.Tenant;
import dev.postify.model.EffectivePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SplittableRandom;

/**
 * Picks the tenant for a posting slot.
 * <p>
 * Eligible tenants are those not opted out, with content consent, outside
 * their cooldown and under their monthly cap. Among them only the ones with
 * the lowest monthly count are considered, and one of those is chosen
 * uniformly with a seed derived from the slot's date and minute, so the same
 * slot always yields the same tenant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FairnessSelector {

    private final LedgerService ledgerService;
    private final RotationProperties rotationProperties;

    /**
     * Eligibility snapshot of one tenant.
     */
    public record TenantStanding(Tenant tenant, long monthlyCount, EffectivePolicy policy) {
    }

    /**
     * Select the tenant for the slot at {@code now}.
     *
     * @param tenants all known tenants
     * @param now     slot time
     * @return the chosen tenant, or empty if nobody is eligible
     */
    public Optional<Tenant> selectTenant(List<Tenant> tenants, LocalDateTime now) {
        List<TenantStanding> eligible = eligibleStandings(tenants, now);
        if (eligible.isEmpty()) {
            log.info("No eligible tenant for slot {}", now);
            return Optional.empty();
        }

        long minCount = eligible.stream()
                .mapToLong(TenantStanding::monthlyCount)
                .min()
                .orElseThrow();

        List<Tenant> shortlist = eligible.stream()
                .filter(s -> s.monthlyCount() == minCount)
                .map(TenantStanding::tenant)
                .sorted(Comparator.comparing(Tenant::getId))
                .toList();

        Tenant chosen = shortlist.get(new SplittableRandom(slotSeed(now)).nextInt(shortlist.size()));
        log.info("Selected tenant {} ({}) for slot {} - monthly count {}, {} tied of {} eligible",
                chosen.getId(), chosen.getName(), now, minCount, shortlist.size(), eligible.size());
        return Optional.of(chosen);
    }

    /**
     * Tenants passing every eligibility filter, with their monthly counts.
     */
    public List<TenantStanding> eligibleStandings(List<Tenant> tenants, LocalDateTime now) {
        List<TenantStanding> result = new ArrayList<>();
        for (Tenant tenant : tenants) {
            standing(tenant, now).ifPresent(result::add);
        }
        return result;
    }

    private Optional<TenantStanding> standing(Tenant tenant, LocalDateTime now) {
        if (tenant.isOptedOut()) {
            log.debug("Tenant {} opted out", tenant.getId());
            return Optional.empty();
        }
        if (!tenant.isContentConsent()) {
            log.debug("Tenant {} has not granted content consent", tenant.getId());
            return Optional.empty();
        }

        EffectivePolicy policy = rotationProperties.effectivePolicy(tenant);
        if (ledgerService.isInCooldown(tenant.getId(), policy.cooldownDays(), now)) {
            log.debug("Tenant {} in cooldown ({} days)", tenant.getId(), policy.cooldownDays());
            return Optional.empty();
        }

        long count = ledgerService.monthlyCount(tenant.getId(), now);
        if (count >= policy.monthlyCap()) {
            log.debug("Tenant {} reached monthly cap ({}/{})", tenant.getId(), count, policy.monthlyCap());
            return Optional.empty();
        }
        return Optional.of(new TenantStanding(tenant, count, policy));
    }

    static long slotSeed(LocalDateTime now) {
        return now.toLocalDate().toEpochDay() * 1440L + now.getHour() * 60L + now.getMinute();
    }
}
