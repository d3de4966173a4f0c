package dev.postify.service;

import dev.postify.approval.ApprovalChannel;
import dev.postify.config.RotationProperties;
import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.exception.ApprovalChannelException;
import dev.postify.exception.PublishException;
import dev.postify.exception.StaleDecisionException;
import dev.postify.exception.StoreException;
import dev.postify.metrics.RotationMetrics;
import dev.postify.model.ApprovalMode;
import dev.postify.model.CandidateStatus;
import dev.postify.model.CandidateSummary;
import dev.postify.model.Decision;
import dev.postify.model.DecisionOutcome;
import dev.postify.model.Draft;
import dev.postify.model.PlatformResult;
import dev.postify.model.PublishReceipt;
import dev.postify.model.RewrittenDraft;
import dev.postify.publish.Publisher;
import dev.postify.publish.PublisherRegistry;
import dev.postify.repository.PostCandidateRepository;
import dev.postify.repository.TenantRepository;
import dev.postify.rewrite.DraftRewriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Owns the candidate state machine: PENDING is the only non-terminal state and
 * a candidate leaves it at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateLifecycleService implements CandidateDecisions {

    public static final String SOURCE_ROTATION = "rotation";
    public static final String SOURCE_FALLBACK = "fallback";
    public static final String SOURCE_ON_DEMAND = "on-demand";
    public static final String SOURCE_UPGRADE = "upgrade";

    private static final Duration PUBLISH_TIMEOUT = Duration.ofSeconds(60);

    private final PostCandidateRepository candidateRepository;
    private final TenantRepository tenantRepository;
    private final LedgerService ledgerService;
    private final PublisherRegistry publisherRegistry;
    private final DraftRewriter draftRewriter;
    private final ApprovalChannel approvalChannel;
    private final RotationProperties rotationProperties;
    private final RotationMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Persist a new PENDING candidate.
     *
     * @return the candidate id
     * @throws StoreException if the store is unreachable
     */
    public Long createCandidate(Tenant tenant, Draft draft, LocalDateTime slotTime, String source) {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, String> metadata = new HashMap<>();
        metadata.put(PostCandidate.META_SOURCE, source);

        PostCandidate candidate = PostCandidate.builder()
                .tenantId(tenant.getId())
                .templateKey(draft.template().key())
                .category(draft.template().category())
                .textBody(draft.text())
                .mediaUrl(draft.mediaUrl())
                .platforms(new ArrayList<>(draft.platforms()))
                .slotTime(slotTime)
                .status(CandidateStatus.PENDING)
                .metadata(metadata)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            Long id = candidateRepository.save(candidate).getId();
            metrics.recordCandidateCreated();
            log.info("Created candidate {} for tenant {} (template: {}, slot: {}, source: {})",
                    id, tenant.getId(), draft.template().key(), slotTime, source);
            return id;
        } catch (DataAccessException e) {
            throw new StoreException("Could not create candidate for tenant " + tenant.getId(), e);
        }
    }

    /**
     * Create a candidate and route it through the tenant's approval mode:
     * AUTO publishes right away, MANUAL hands it to the approval channel.
     * A channel failure falls back to a direct publish.
     */
    public DecisionOutcome submit(Tenant tenant, Draft draft, LocalDateTime slotTime, String source) {
        return route(createCandidate(tenant, draft, slotTime, source), tenant, draft, slotTime);
    }

    /**
     * Route an already created candidate through the tenant's approval mode.
     */
    public DecisionOutcome route(Long id, Tenant tenant, Draft draft, LocalDateTime slotTime) {
        ApprovalMode mode = rotationProperties.effectivePolicy(tenant).approvalMode();
        if (mode == ApprovalMode.AUTO) {
            return decide(id, Decision.APPROVE, null);
        }

        try {
            String reference = approvalChannel.notify(summary(id, tenant, draft, slotTime));
            updateCandidate(id, c -> {
                c.setChannelReference(reference);
                c.getMetadata().put(PostCandidate.META_CHANNEL_REF, reference);
            });
            log.info("Candidate {} awaiting approval via {} ({})", id, approvalChannel.getName(), reference);
            return DecisionOutcome.of(id, CandidateStatus.PENDING);
        } catch (ApprovalChannelException e) {
            metrics.recordChannelFailure();
            log.warn("Approval channel {} failed for candidate {} - publishing directly: {}",
                    approvalChannel.getName(), id, e.getMessage());
            return decide(id, Decision.APPROVE, null);
        }
    }

    @Override
    public DecisionOutcome decide(Long candidateId, Decision decision, String payload) {
        LocalDateTime now = LocalDateTime.now(clock);
        DecisionOutcome outcome = switch (decision) {
            case APPROVE -> approve(candidateId, now);
            case REJECT -> {
                requireUpdated(candidateRepository.reject(candidateId, payload, now), candidateId, decision);
                log.info("Candidate {} rejected: {}", candidateId, payload);
                notifyResolved(candidateId, CandidateStatus.REJECTED);
                yield DecisionOutcome.of(candidateId, CandidateStatus.REJECTED);
            }
            case CANCEL -> {
                requireUpdated(candidateRepository.transition(candidateId, CandidateStatus.PENDING,
                        CandidateStatus.CANCELLED, now), candidateId, decision);
                log.info("Candidate {} cancelled", candidateId);
                notifyResolved(candidateId, CandidateStatus.CANCELLED);
                yield DecisionOutcome.of(candidateId, CandidateStatus.CANCELLED);
            }
            case REGENERATE, CUSTOMIZE -> rewrite(candidateId, decision, payload);
        };
        metrics.recordDecision(decision.name());
        return outcome;
    }

    /**
     * Publish again to the platforms that failed when an APPROVED candidate
     * went out. Only candidates flagged for retry are picked up, and the flag
     * is claimed atomically so two callers never publish the same retry.
     *
     * @return the per-platform results of this attempt; empty when nothing was pending
     * @throws StaleDecisionException if the candidate is not APPROVED
     */
    public DecisionOutcome retryFailed(Long candidateId) {
        PostCandidate candidate = load(candidateId);
        if (candidate.getStatus() != CandidateStatus.APPROVED) {
            throw new StaleDecisionException(candidateId, Decision.APPROVE, candidate.getStatus());
        }
        if (candidateRepository.claimRetry(candidateId, LocalDateTime.now(clock)) != 1) {
            log.debug("Candidate {} has no publish retry pending", candidateId);
            return DecisionOutcome.of(candidateId, CandidateStatus.APPROVED);
        }

        List<PlatformResult> results = new ArrayList<>();
        for (String platform : candidate.getPlatforms()) {
            if (!isDelivered(candidate, platform)) {
                results.add(publishTo(candidate, platform));
            }
        }
        storeResults(candidateId, results, false);

        DecisionOutcome outcome = new DecisionOutcome(candidateId, CandidateStatus.APPROVED, results);
        log.info("Candidate {} publish retry: {} published, {} still failing",
                candidateId, outcome.publishedCount(), results.stream().filter(r -> !r.isSuccess()).count());
        return outcome;
    }

    /**
     * Mark a pending candidate as timed out.
     *
     * @return true if this call moved it out of PENDING
     */
    public boolean expire(Long candidateId) {
        try {
            boolean expired = candidateRepository.transition(candidateId, CandidateStatus.PENDING,
                    CandidateStatus.TIMEOUT, LocalDateTime.now(clock)) == 1;
            if (expired) {
                log.info("Candidate {} timed out", candidateId);
                notifyResolved(candidateId, CandidateStatus.TIMEOUT);
            }
            return expired;
        } catch (DataAccessException e) {
            throw new StoreException("Could not expire candidate " + candidateId, e);
        }
    }

    public Optional<PostCandidate> find(Long candidateId) {
        return candidateRepository.findById(candidateId);
    }

    private DecisionOutcome approve(Long candidateId, LocalDateTime now) {
        // claim first so only one caller ever publishes
        requireUpdated(candidateRepository.transition(candidateId, CandidateStatus.PENDING,
                CandidateStatus.APPROVED, now), candidateId, Decision.APPROVE);

        PostCandidate candidate = load(candidateId);
        List<PlatformResult> results = new ArrayList<>();
        for (String platform : candidate.getPlatforms()) {
            results.add(publishTo(candidate, platform));
        }

        storeResults(candidateId, results, true);

        DecisionOutcome outcome = new DecisionOutcome(candidateId, CandidateStatus.APPROVED, results);
        log.info("Candidate {} approved: {} published, {} failed of {} platforms",
                candidateId, outcome.publishedCount(),
                results.stream().filter(r -> !r.isSuccess()).count(), results.size());
        notifyResolved(candidate, CandidateStatus.APPROVED);
        return outcome;
    }

    /**
     * Write per-platform results into metadata and flag the candidate for a
     * retry while failures remain and attempts are left.
     */
    private void storeResults(Long candidateId, List<PlatformResult> results, boolean countAttempt) {
        boolean failed = results.stream().anyMatch(r -> !r.isSuccess());
        updateCandidate(candidateId, c -> {
            results.forEach(r -> c.getMetadata().put(PostCandidate.META_PUBLISH_PREFIX + r.platform(), describe(r)));
            if (countAttempt) {
                c.setPublishAttempts(c.getPublishAttempts() + 1);
            }
            c.setRetryPending(failed && c.getPublishAttempts() < rotationProperties.getPublishAttempts());
            if (failed && !c.isRetryPending()) {
                log.warn("Candidate {} gave up after {} publish attempt(s)", candidateId, c.getPublishAttempts());
            }
        });
    }

    private static boolean isDelivered(PostCandidate candidate, String platform) {
        String result = candidate.getMetadata().get(PostCandidate.META_PUBLISH_PREFIX + platform);
        return result != null && !result.startsWith("FAILED");
    }

    private PlatformResult publishTo(PostCandidate candidate, String platform) {
        String tenantId = candidate.getTenantId();
        if (ledgerService.isPublished(tenantId, platform, LedgerService.textHash(candidate.getTextBody()))) {
            log.info("Candidate {} already on {} for tenant {} - skipping", candidate.getId(), platform, tenantId);
            return PlatformResult.alreadyPublished(platform);
        }

        Optional<Publisher> publisher = publisherRegistry.find(platform);
        if (publisher.isEmpty()) {
            log.warn("No publisher for platform {} (candidate {})", platform, candidate.getId());
            metrics.recordPublishFailure(platform);
            return PlatformResult.failed(platform, "no publisher registered");
        }

        PublishReceipt receipt;
        long start = System.currentTimeMillis();
        try {
            receipt = publisher.get().publish(candidate.getTextBody(), candidate.getMediaUrl())
                    .block(PUBLISH_TIMEOUT);
        } catch (PublishException e) {
            log.warn("Publish to {} failed for candidate {}: {}", platform, candidate.getId(), e.getMessage());
            metrics.recordPublishFailure(platform);
            return PlatformResult.failed(platform, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Publish to {} failed for candidate {}: {}", platform, candidate.getId(), e.getMessage(), e);
            metrics.recordPublishFailure(platform);
            return PlatformResult.failed(platform, e.getMessage());
        }
        metrics.recordPublishLatency(platform, System.currentTimeMillis() - start);

        String externalId = receipt != null ? receipt.externalId() : null;
        try {
            if (!ledgerService.record(tenantId, platform, candidate.getTemplateKey(),
                    candidate.getTextBody(), externalId)) {
                return PlatformResult.alreadyPublished(platform);
            }
        } catch (StoreException e) {
            log.error("Published candidate {} to {} but the ledger write failed: {}",
                    candidate.getId(), platform, e.getMessage(), e);
            return PlatformResult.failed(platform, "ledger write failed: " + e.getMessage());
        }
        metrics.recordPublished(platform);
        return PlatformResult.published(platform, externalId);
    }

    private DecisionOutcome rewrite(Long candidateId, Decision decision, String instructions) {
        if (decision == Decision.CUSTOMIZE && (instructions == null || instructions.isBlank())) {
            throw new IllegalArgumentException("Customize needs instructions");
        }
        PostCandidate candidate = load(candidateId);
        if (candidate.getStatus() != CandidateStatus.PENDING) {
            throw new StaleDecisionException(candidateId, decision, candidate.getStatus());
        }
        Tenant tenant = tenantRepository.findById(candidate.getTenantId())
                .orElseThrow(() -> new IllegalArgumentException("Tenant " + candidate.getTenantId() + " not found"));

        RewrittenDraft rewritten = draftRewriter
                .rewrite(tenant, candidate, decision == Decision.CUSTOMIZE ? instructions : null)
                .block(PUBLISH_TIMEOUT);
        if (rewritten == null) {
            rewritten = new RewrittenDraft(candidate.getTextBody(), candidate.getTemplateKey());
        }

        requireUpdated(candidateRepository.replaceText(candidateId, rewritten.text(), rewritten.templateKey(),
                LocalDateTime.now(clock)), candidateId, decision);
        log.info("Candidate {} text replaced ({}, template: {})", candidateId, decision, rewritten.templateKey());

        if (candidate.getChannelReference() != null) {
            candidate.setTextBody(rewritten.text());
            candidate.setTemplateKey(rewritten.templateKey());
            try {
                approvalChannel.refresh(candidate.getChannelReference(), summary(candidate, tenant));
            } catch (ApprovalChannelException e) {
                metrics.recordChannelFailure();
                log.warn("Could not refresh preview for candidate {}: {}", candidateId, e.getMessage());
            }
        }
        return DecisionOutcome.of(candidateId, CandidateStatus.PENDING);
    }

    private void requireUpdated(int rows, Long candidateId, Decision decision) {
        if (rows == 1) {
            return;
        }
        CandidateStatus current = candidateRepository.findById(candidateId)
                .map(PostCandidate::getStatus)
                .orElseThrow(() -> new IllegalArgumentException("Candidate " + candidateId + " not found"));
        throw new StaleDecisionException(candidateId, decision, current);
    }

    private PostCandidate load(Long candidateId) {
        return candidateRepository.findById(candidateId)
                .orElseThrow(() -> new IllegalArgumentException("Candidate " + candidateId + " not found"));
    }

    /**
     * Load-modify-flush inside one transaction; dynamic updates keep the write
     * to the columns that changed.
     */
    private void updateCandidate(Long candidateId, Consumer<PostCandidate> change) {
        try {
            transactionTemplate.executeWithoutResult(status ->
                    candidateRepository.findById(candidateId).ifPresent(change));
        } catch (DataAccessException e) {
            throw new StoreException("Could not update candidate " + candidateId, e);
        }
    }

    private void notifyResolved(Long candidateId, CandidateStatus status) {
        candidateRepository.findById(candidateId).ifPresent(c -> notifyResolved(c, status));
    }

    private void notifyResolved(PostCandidate candidate, CandidateStatus status) {
        if (candidate.getChannelReference() == null) {
            return;
        }
        try {
            approvalChannel.resolved(candidate.getChannelReference(), status);
        } catch (RuntimeException e) {
            log.debug("Channel could not show {} for candidate {}: {}", status, candidate.getId(), e.getMessage());
        }
    }

    private static String describe(PlatformResult result) {
        return switch (result.outcome()) {
            case PUBLISHED -> "PUBLISHED" + (result.externalId() != null ? ":" + result.externalId() : "");
            case ALREADY_PUBLISHED -> "ALREADY_PUBLISHED";
            case FAILED -> "FAILED:" + result.error();
        };
    }

    private CandidateSummary summary(Long id, Tenant tenant, Draft draft, LocalDateTime slotTime) {
        return new CandidateSummary(id, tenant.getId(), tenant.getName(), tenant.getIndustry(), tenant.getCity(),
                draft.template().key(), draft.template().category(), draft.text(), draft.mediaUrl(),
                draft.platforms(), slotTime);
    }

    private CandidateSummary summary(PostCandidate candidate, Tenant tenant) {
        return new CandidateSummary(candidate.getId(), tenant.getId(), tenant.getName(), tenant.getIndustry(),
                tenant.getCity(), candidate.getTemplateKey(), candidate.getCategory(), candidate.getTextBody(),
                candidate.getMediaUrl(), candidate.getPlatforms(), candidate.getSlotTime());
    }
}
