package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.Tenant;
import dev.postify.exception.ConfigurationException;
import dev.postify.model.PostTemplate;
import dev.postify.model.TemplateCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;

/**
 * 4-1-1 content mix: four educational posts, one soft-sell, one hard-sell,
 * repeating every six posts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryCycler {

    static final int CYCLE_LENGTH = 6;

    private final LedgerService ledgerService;
    private final RotationProperties rotationProperties;
    private final Clock clock;

    /**
     * Category for the next post given how many posts the tenant had this month.
     */
    public static TemplateCategory categoryFor(long monthlyPostCount) {
        int index = (int) Math.floorMod(monthlyPostCount, (long) CYCLE_LENGTH);
        if (index < 4) {
            return TemplateCategory.EDUCATIONAL;
        }
        return index == 4 ? TemplateCategory.SOFT_SELL : TemplateCategory.HARD_SELL;
    }

    /**
     * Pick a template for today, avoiding the tenant's recently used ones.
     */
    public PostTemplate selectTemplate(List<PostTemplate> catalog, Tenant tenant, long monthlyPostCount) {
        List<String> recent = ledgerService.recentTemplateKeys(tenant.getId(),
                rotationProperties.getRecentTemplateWindow());
        return selectTemplate(catalog, tenant, monthlyPostCount, recent, LocalDate.now(clock));
    }

    /**
     * Pure selection over a catalog snapshot.
     *
     * @throws ConfigurationException if the catalog is empty
     */
    public PostTemplate selectTemplate(List<PostTemplate> catalog, Tenant tenant, long monthlyPostCount,
                                       Collection<String> recentTemplateKeys, LocalDate day) {
        List<PostTemplate> rotation = catalog == null ? List.of() : catalog.stream()
                .filter(t -> t.category().isRotation())
                .toList();
        if (rotation.isEmpty()) {
            throw new ConfigurationException("Template catalog is empty - cannot draft a post");
        }

        TemplateCategory target = categoryFor(monthlyPostCount);
        List<PostTemplate> pool = rotation.stream()
                .filter(t -> t.category() == target)
                .toList();
        if (pool.isEmpty()) {
            log.warn("No {} templates - falling back to the full catalog for tenant {}", target, tenant.getId());
            pool = rotation;
        }

        List<PostTemplate> fresh = pool.stream()
                .filter(t -> !recentTemplateKeys.contains(t.key()))
                .toList();
        if (!fresh.isEmpty()) {
            pool = fresh;
        }

        List<PostTemplate> ordered = pool.stream()
                .sorted(Comparator.comparing(PostTemplate::key))
                .toList();
        PostTemplate chosen = ordered.get(new SplittableRandom(daySeed(day, tenant.getId())).nextInt(ordered.size()));
        log.debug("Tenant {} count {} -> {} -> template {}", tenant.getId(), monthlyPostCount, target, chosen.key());
        return chosen;
    }

    static long daySeed(LocalDate day, String tenantId) {
        return day.toEpochDay() * 31L + tenantId.hashCode();
    }
}
