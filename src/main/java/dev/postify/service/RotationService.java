package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.Tenant;
import dev.postify.exception.StoreException;
import dev.postify.exception.TemplateRenderException;
import dev.postify.metrics.RotationMetrics;
import dev.postify.model.CandidateStatus;
import dev.postify.model.DecisionOutcome;
import dev.postify.model.DraftPreview;
import dev.postify.model.Draft;
import dev.postify.repository.PostCandidateRepository;
import dev.postify.repository.TenantRepository;
import dev.postify.service.FairnessSelector.TenantStanding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main orchestration service: turns a posting slot into candidates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RotationService {

    private static final String SEPARATOR = "========================================";
    static final int MAX_PREVIEW = 20;

    private final TenantRepository tenantRepository;
    private final PostCandidateRepository candidateRepository;
    private final FairnessSelector fairnessSelector;
    private final DraftComposer draftComposer;
    private final CandidateLifecycleService lifecycleService;
    private final RotationProperties rotationProperties;
    private final RotationMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final ReentrantLock dispatchLock = new ReentrantLock();

    private record Created(Long id, Tenant tenant, Draft draft) {
    }

    /**
     * Fill one slot with {@code rotation.posts-per-slot} candidates.
     *
     * @param slotTime the slot being filled
     * @return one outcome per candidate created; empty if nobody was eligible
     */
    public List<DecisionOutcome> dispatchSlot(LocalDateTime slotTime) {
        return dispatchSlot(slotTime, rotationProperties.getPostsPerSlot());
    }

    /**
     * Create and route up to {@code posts} candidates. The whole run holds the
     * dispatch lock, routing included: an AUTO publish writes the ledger entry
     * the next selection reads.
     */
    public List<DecisionOutcome> dispatchSlot(LocalDateTime slotTime, int posts) {
        log.info(SEPARATOR);
        log.info("Rotation slot {} (dry run: {})", slotTime, rotationProperties.isDryRun());
        log.info(SEPARATOR);

        List<DecisionOutcome> outcomes = new ArrayList<>();
        Set<String> chosen = new HashSet<>();
        dispatchLock.lock();
        try {
            for (int i = 0; i < Math.max(1, posts); i++) {
                Optional<Created> created = selectAndCreate(slotTime, chosen);
                if (created.isEmpty()) {
                    metrics.recordSlotSkipped();
                    break;
                }
                Created c = created.get();
                chosen.add(c.tenant().getId());
                metrics.recordSlotDispatched();
                try {
                    outcomes.add(lifecycleService.route(c.id(), c.tenant(), c.draft(), slotTime));
                } catch (StoreException e) {
                    log.error("Routing candidate {} failed: {}", c.id(), e.getMessage(), e);
                }
            }
        } finally {
            dispatchLock.unlock();
        }

        log.info("Slot {} done: {} candidate(s) {}", slotTime, outcomes.size(),
                outcomes.stream().map(o -> o.candidateId() + "=" + o.status()).toList());
        return outcomes;
    }

    /**
     * Selection and candidate insert run in one transaction.
     */
    private Optional<Created> selectAndCreate(LocalDateTime slotTime, Set<String> exclude) {
        try {
            return Optional.ofNullable(transactionTemplate.execute(status -> {
                List<Tenant> tenants = candidatePool(exclude);
                Optional<Tenant> selected = fairnessSelector.selectTenant(tenants, slotTime);
                if (selected.isEmpty()) {
                    return null;
                }
                Tenant tenant = selected.get();
                Draft draft;
                try {
                    draft = draftComposer.compose(tenant, slotTime);
                } catch (TemplateRenderException e) {
                    log.warn("Skipping slot {} for tenant {}: {}", slotTime, tenant.getId(), e.getMessage());
                    return null;
                }
                Long id = lifecycleService.createCandidate(tenant, draft, slotTime,
                        CandidateLifecycleService.SOURCE_ROTATION);
                return new Created(id, tenant, draft);
            }));
        } catch (StoreException | DataAccessException e) {
            log.error("Slot {} aborted, store failure: {}", slotTime, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private List<Tenant> candidatePool(Set<String> exclude) {
        List<Tenant> tenants = tenantRepository.findByOptedOutFalseAndContentConsentTrue().stream()
                .filter(t -> !exclude.contains(t.getId()))
                .toList();
        if (!rotationProperties.isSkipTenantsWithPending()) {
            return tenants;
        }
        return tenants.stream()
                .filter(t -> {
                    boolean pending = candidateRepository.existsByTenantIdAndStatus(t.getId(), CandidateStatus.PENDING);
                    if (pending) {
                        log.debug("Tenant {} has a pending candidate - skipped", t.getId());
                    }
                    return !pending;
                })
                .toList();
    }

    /**
     * Render drafts for up to {@code count} eligible tenants without
     * persisting anything. Lowest monthly count first.
     */
    public List<DraftPreview> preview(int count) {
        int limit = Math.min(Math.max(count, 1), MAX_PREVIEW);
        LocalDateTime now = LocalDateTime.now(clock);

        List<Tenant> tenants = tenantRepository.findByOptedOutFalseAndContentConsentTrue();
        List<TenantStanding> standings = fairnessSelector.eligibleStandings(tenants, now).stream()
                .sorted(Comparator.comparingLong(TenantStanding::monthlyCount)
                        .thenComparing(s -> s.tenant().getId()))
                .toList();

        List<DraftPreview> previews = new ArrayList<>();
        for (TenantStanding standing : standings) {
            if (previews.size() >= limit) {
                break;
            }
            Tenant tenant = standing.tenant();
            try {
                Draft draft = draftComposer.compose(tenant, standing.monthlyCount());
                previews.add(new DraftPreview(tenant.getId(), tenant.getName(), standing.monthlyCount(),
                        draft.template().key(), draft.template().category(), draft.text(), draft.mediaUrl(),
                        draft.platforms()));
            } catch (TemplateRenderException e) {
                log.warn("Preview skipped tenant {}: {}", tenant.getId(), e.getMessage());
            }
        }
        log.info("Preview rendered {} draft(s) from {} eligible tenant(s)", previews.size(), standings.size());
        return previews;
    }

    /**
     * Draft a post for one tenant outside the rotation. Cooldown and cap are
     * not checked; the approval gate still applies.
     *
     * @throws IllegalArgumentException if the tenant is unknown, opted out or
     *                                  has not granted content consent
     */
    public DecisionOutcome requestDraft(String tenantId) {
        Tenant tenant = tenantRepository.findById(tenantId)
                .orElseThrow(() -> new IllegalArgumentException("Tenant '" + tenantId + "' not found"));
        if (tenant.isOptedOut() || !tenant.isContentConsent()) {
            throw new IllegalArgumentException("Tenant '" + tenantId + "' does not allow posting");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Draft draft = draftComposer.compose(tenant, now);
        log.info("On-demand draft for tenant {} (template: {})", tenantId, draft.template().key());
        return lifecycleService.submit(tenant, draft, now, CandidateLifecycleService.SOURCE_ON_DEMAND);
    }
}
