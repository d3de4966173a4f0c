package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.exception.ConfigurationException;
import dev.postify.exception.StaleDecisionException;
import dev.postify.metrics.RotationMetrics;
import dev.postify.model.CandidateStatus;
import dev.postify.model.Decision;
import dev.postify.model.DecisionOutcome;
import dev.postify.model.Draft;
import dev.postify.model.SweepResult;
import dev.postify.model.TimeoutPolicy;
import dev.postify.repository.PostCandidateRepository;
import dev.postify.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Resolves candidates nobody decided on within the grace period, according
 * to the tenant's timeout policy. Safe to run concurrently with decisions:
 * every mutation is conditional on the candidate still being PENDING.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeoutSweeper {

    private final PostCandidateRepository candidateRepository;
    private final TenantRepository tenantRepository;
    private final CandidateLifecycleService lifecycleService;
    private final DraftComposer draftComposer;
    private final RotationProperties rotationProperties;
    private final RotationMetrics metrics;
    private final Clock clock;

    private enum Result { AUTO_POSTED, CANCELLED, FALLBACK, ALREADY_RESOLVED }

    public SweepResult sweep() {
        return sweep(rotationProperties.getGraceMinutes());
    }

    /**
     * Resolve every PENDING candidate whose slot time is older than
     * {@code graceMinutes}.
     */
    public SweepResult sweep(int graceMinutes) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<PostCandidate> overdue;
        try {
            overdue = candidateRepository.findByStatusAndSlotTimeBeforeOrderBySlotTimeAsc(
                    CandidateStatus.PENDING, now.minusMinutes(graceMinutes));
        } catch (DataAccessException e) {
            log.error("Timeout sweep aborted, store failure: {}", e.getMessage(), e);
            return SweepResult.empty();
        }
        if (overdue.isEmpty()) {
            log.debug("Timeout sweep: nothing overdue");
            metrics.updateLastSweep(SweepResult.empty());
            return SweepResult.empty();
        }

        int autoPosted = 0;
        int cancelled = 0;
        int fallbacks = 0;
        int alreadyResolved = 0;
        int failed = 0;
        for (PostCandidate candidate : overdue) {
            try {
                switch (resolve(candidate, now)) {
                    case AUTO_POSTED -> autoPosted++;
                    case CANCELLED -> cancelled++;
                    case FALLBACK -> fallbacks++;
                    case ALREADY_RESOLVED -> alreadyResolved++;
                }
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                log.error("Timeout handling failed for candidate {}: {}", candidate.getId(), e.getMessage(), e);
            }
        }

        SweepResult result = new SweepResult(overdue.size(), autoPosted, cancelled, fallbacks,
                alreadyResolved, failed);
        metrics.updateLastSweep(result);
        log.info("Timeout sweep: {}", result);
        return result;
    }

    /**
     * Give approved candidates with failed platforms another publish attempt.
     *
     * @return number of candidates fully delivered by this run
     */
    public int retryFailedPublishes() {
        List<PostCandidate> failed;
        try {
            failed = candidateRepository.findByStatusAndRetryPendingTrueOrderByUpdatedAtAsc(CandidateStatus.APPROVED);
        } catch (DataAccessException e) {
            log.error("Publish retry aborted, store failure: {}", e.getMessage(), e);
            return 0;
        }

        int delivered = 0;
        for (PostCandidate candidate : failed) {
            try {
                DecisionOutcome outcome = lifecycleService.retryFailed(candidate.getId());
                if (!outcome.platformResults().isEmpty() && !outcome.hasFailures()) {
                    delivered++;
                }
            } catch (StaleDecisionException e) {
                log.info("Candidate {} is {} - no retry", candidate.getId(), e.getCurrentStatus());
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Publish retry failed for candidate {}: {}", candidate.getId(), e.getMessage(), e);
            }
        }
        if (!failed.isEmpty()) {
            log.info("Publish retry: {} of {} candidate(s) delivered", delivered, failed.size());
        }
        return delivered;
    }

    private Result resolve(PostCandidate candidate, LocalDateTime now) {
        Optional<Tenant> tenant = tenantRepository.findById(candidate.getTenantId());
        TimeoutPolicy policy = tenant
                .map(t -> rotationProperties.effectivePolicy(t).timeoutPolicy())
                .orElse(rotationProperties.getTimeoutPolicy());

        switch (policy) {
            case AUTO_POST:
                try {
                    lifecycleService.decide(candidate.getId(), Decision.APPROVE, null);
                    log.info("Candidate {} auto-posted after timeout", candidate.getId());
                    return Result.AUTO_POSTED;
                } catch (StaleDecisionException e) {
                    log.info("Candidate {} already {} - skipped", candidate.getId(), e.getCurrentStatus());
                    return Result.ALREADY_RESOLVED;
                }
            case FALLBACK:
                if (!lifecycleService.expire(candidate.getId())) {
                    return Result.ALREADY_RESOLVED;
                }
                if (tenant.isEmpty()) {
                    throw new IllegalStateException("Tenant " + candidate.getTenantId() + " not found, no fallback post");
                }
                postFallback(tenant.get(), candidate, now);
                return Result.FALLBACK;
            case AUTO_CANCEL:
            default:
                return lifecycleService.expire(candidate.getId()) ? Result.CANCELLED : Result.ALREADY_RESOLVED;
        }
    }

    private void postFallback(Tenant tenant, PostCandidate expired, LocalDateTime now) {
        Draft draft = draftComposer.compose(tenant, now);
        if (draft.template().key().equals(expired.getTemplateKey())) {
            draft = draftComposer.composeAlternative(tenant, draft.template().category(), expired.getTemplateKey())
                    .orElse(draft);
        }
        Long id = lifecycleService.createCandidate(tenant, draft, now, CandidateLifecycleService.SOURCE_FALLBACK);
        lifecycleService.decide(id, Decision.APPROVE, null);
        log.info("Fallback candidate {} posted for tenant {} (replaces {})", id, tenant.getId(), expired.getId());
    }
}
