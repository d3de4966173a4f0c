package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.Tenant;
import dev.postify.entity.Watermark;
import dev.postify.exception.StoreException;
import dev.postify.exception.TemplateRenderException;
import dev.postify.model.Draft;
import dev.postify.repository.TenantRepository;
import dev.postify.repository.WatermarkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Announces tenants that were upgraded since the last run. Progress is kept
 * in a persisted watermark, so each upgrade is announced once across
 * restarts. Announcements go through the normal approval routing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpgradeAnnouncer {

    static final String WATERMARK = "last_seen_upgrade";

    private final TenantRepository tenantRepository;
    private final WatermarkRepository watermarkRepository;
    private final DraftComposer draftComposer;
    private final CandidateLifecycleService lifecycleService;
    private final RotationProperties rotationProperties;
    private final Clock clock;

    /**
     * @return number of announcements submitted
     */
    public int announceUpgrades() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Tenant> upgraded;
        try {
            LocalDateTime lastSeen = watermarkRepository.findById(WATERMARK)
                    .map(Watermark::getPosition)
                    .orElse(now.minusDays(rotationProperties.getUpgradeLookbackDays()));
            upgraded = tenantRepository
                    .findByOptedOutFalseAndContentConsentTrueAndUpgradedAtAfterOrderByUpgradedAtAsc(lastSeen);
        } catch (DataAccessException e) {
            log.error("Upgrade watch aborted, store failure: {}", e.getMessage(), e);
            return 0;
        }

        int announced = 0;
        for (Tenant tenant : upgraded) {
            try {
                Optional<Draft> draft = draftComposer.composeAnnouncement(tenant);
                if (draft.isEmpty()) {
                    log.warn("No ANNOUNCEMENT template configured - {} upgrade(s) left for later", upgraded.size());
                    return announced;
                }
                lifecycleService.submit(tenant, draft.get(), now, CandidateLifecycleService.SOURCE_UPGRADE);
                announced++;
                log.info("Announced upgrade of tenant {} (upgraded {})", tenant.getId(), tenant.getUpgradedAt());
            } catch (TemplateRenderException e) {
                log.warn("Skipping upgrade announcement for tenant {}: {}", tenant.getId(), e.getMessage());
            } catch (StoreException | DataAccessException e) {
                log.error("Upgrade announcement for tenant {} failed, retrying next run: {}",
                        tenant.getId(), e.getMessage(), e);
                return announced;
            }
            advance(tenant.getUpgradedAt(), now);
        }
        return announced;
    }

    private void advance(LocalDateTime position, LocalDateTime now) {
        watermarkRepository.save(new Watermark(WATERMARK, position, now));
    }
}
