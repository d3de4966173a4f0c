package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.entity.TenantPolicy;
import dev.postify.exception.StaleDecisionException;
import dev.postify.exception.StoreException;
import dev.postify.metrics.RotationMetrics;
import dev.postify.model.CandidateStatus;
import dev.postify.model.Decision;
import dev.postify.model.DecisionOutcome;
import dev.postify.model.Draft;
import dev.postify.model.PlatformResult;
import dev.postify.model.PostTemplate;
import dev.postify.model.SweepResult;
import dev.postify.model.TemplateCategory;
import dev.postify.model.TimeoutPolicy;
import dev.postify.repository.PostCandidateRepository;
import dev.postify.repository.TenantRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeoutSweeperTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 10, 9, 0);

    @Mock
    private PostCandidateRepository candidateRepository;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private CandidateLifecycleService lifecycleService;

    @Mock
    private DraftComposer draftComposer;

    private SimpleMeterRegistry meterRegistry;
    private TimeoutSweeper sweeper;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T07:00:00Z"), ZoneId.of("Africa/Johannesburg"));
        meterRegistry = new SimpleMeterRegistry();
        sweeper = new TimeoutSweeper(candidateRepository, tenantRepository, lifecycleService, draftComposer,
                new RotationProperties(), new RotationMetrics(meterRegistry), clock);
    }

    private Tenant tenant(String id, TimeoutPolicy policy) {
        return Tenant.builder()
                .id(id)
                .name("Tenant " + id)
                .contentConsent(true)
                .policy(TenantPolicy.builder().timeoutPolicy(policy).build())
                .build();
    }

    private PostCandidate overdue(Long id, String tenantId, String templateKey) {
        return PostCandidate.builder()
                .id(id)
                .tenantId(tenantId)
                .templateKey(templateKey)
                .category(TemplateCategory.EDUCATIONAL)
                .textBody("text " + id)
                .slotTime(NOW.minusHours(3))
                .status(CandidateStatus.PENDING)
                .build();
    }

    private void givenOverdue(PostCandidate... candidates) {
        when(candidateRepository.findByStatusAndSlotTimeBeforeOrderBySlotTimeAsc(
                CandidateStatus.PENDING, NOW.minusMinutes(120))).thenReturn(List.of(candidates));
    }

    @Test
    @DisplayName("Should do nothing when no candidate is overdue")
    void shouldDoNothingWhenNothingOverdue() {
        givenOverdue();

        SweepResult result = sweeper.sweep();

        assertThat(result).isEqualTo(SweepResult.empty());
        verify(lifecycleService, never()).expire(anyLong());
    }

    @Nested
    @DisplayName("Timeout policies")
    class PolicyTests {

        @Test
        @DisplayName("Should cancel under the default policy")
        void shouldCancelByDefault() {
            givenOverdue(overdue(1L, "t1", "edu_1"));
            when(tenantRepository.findById("t1")).thenReturn(Optional.of(tenant("t1", null)));
            when(lifecycleService.expire(1L)).thenReturn(true);

            SweepResult result = sweeper.sweep();

            assertThat(result.cancelled()).isEqualTo(1);
            assertThat(meterRegistry.get("rotation_candidates_timed_out_total").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should approve under auto-post")
        void shouldApproveUnderAutoPost() {
            givenOverdue(overdue(1L, "t1", "edu_1"));
            when(tenantRepository.findById("t1")).thenReturn(Optional.of(tenant("t1", TimeoutPolicy.AUTO_POST)));
            when(lifecycleService.decide(1L, Decision.APPROVE, null))
                    .thenReturn(DecisionOutcome.of(1L, CandidateStatus.APPROVED));

            SweepResult result = sweeper.sweep();

            assertThat(result.autoPosted()).isEqualTo(1);
            verify(lifecycleService, never()).expire(anyLong());
        }

        @Test
        @DisplayName("Should post a different template under fallback")
        void shouldPostDifferentTemplateUnderFallback() {
            Tenant tenant = tenant("t1", TimeoutPolicy.FALLBACK);
            PostTemplate same = new PostTemplate("edu_1", TemplateCategory.EDUCATIONAL, List.of("x"), "a");
            PostTemplate other = new PostTemplate("edu_2", TemplateCategory.EDUCATIONAL, List.of("x"), "b");
            Draft sameDraft = new Draft(same, "a", null, List.of("console"));
            Draft otherDraft = new Draft(other, "b", null, List.of("console"));

            givenOverdue(overdue(1L, "t1", "edu_1"));
            when(tenantRepository.findById("t1")).thenReturn(Optional.of(tenant));
            when(lifecycleService.expire(1L)).thenReturn(true);
            when(draftComposer.compose(tenant, NOW)).thenReturn(sameDraft);
            when(draftComposer.composeAlternative(tenant, TemplateCategory.EDUCATIONAL, "edu_1"))
                    .thenReturn(Optional.of(otherDraft));
            when(lifecycleService.createCandidate(tenant, otherDraft, NOW, CandidateLifecycleService.SOURCE_FALLBACK))
                    .thenReturn(7L);
            when(lifecycleService.decide(7L, Decision.APPROVE, null))
                    .thenReturn(DecisionOutcome.of(7L, CandidateStatus.APPROVED));

            SweepResult result = sweeper.sweep();

            assertThat(result.fallbacks()).isEqualTo(1);
            verify(lifecycleService).decide(7L, Decision.APPROVE, null);
        }
    }

    @Nested
    @DisplayName("Races and failures")
    class RaceTests {

        @Test
        @DisplayName("Should count a candidate resolved in the meantime as already resolved")
        void shouldCountAlreadyResolved() {
            givenOverdue(overdue(1L, "t1", "edu_1"), overdue(2L, "t2", "edu_1"));
            when(tenantRepository.findById("t1")).thenReturn(Optional.of(tenant("t1", TimeoutPolicy.AUTO_CANCEL)));
            when(tenantRepository.findById("t2")).thenReturn(Optional.of(tenant("t2", TimeoutPolicy.AUTO_POST)));
            when(lifecycleService.expire(1L)).thenReturn(false);
            when(lifecycleService.decide(2L, Decision.APPROVE, null))
                    .thenThrow(new StaleDecisionException(2L, Decision.APPROVE, CandidateStatus.REJECTED));

            SweepResult result = sweeper.sweep();

            assertThat(result.examined()).isEqualTo(2);
            assertThat(result.alreadyResolved()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should not publish a fallback when the decision won the race")
        void shouldNotFallBackWhenDecisionWon() {
            givenOverdue(overdue(1L, "t1", "edu_1"));
            when(tenantRepository.findById("t1")).thenReturn(Optional.of(tenant("t1", TimeoutPolicy.FALLBACK)));
            when(lifecycleService.expire(1L)).thenReturn(false);

            SweepResult result = sweeper.sweep();

            assertThat(result.alreadyResolved()).isEqualTo(1);
            verify(draftComposer, never()).compose(any(Tenant.class), any(LocalDateTime.class));
        }

        @Test
        @DisplayName("Should keep sweeping after one candidate fails")
        void shouldIsolateFailures() {
            givenOverdue(overdue(1L, "t1", "edu_1"), overdue(2L, "t1", "edu_2"));
            when(tenantRepository.findById("t1")).thenReturn(Optional.of(tenant("t1", null)));
            when(lifecycleService.expire(1L)).thenThrow(new StoreException("db down", null));
            when(lifecycleService.expire(2L)).thenReturn(true);

            SweepResult result = sweeper.sweep();

            assertThat(result.failed()).isEqualTo(1);
            assertThat(result.cancelled()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should honour a custom grace period")
        void shouldHonourGracePeriod() {
            when(candidateRepository.findByStatusAndSlotTimeBeforeOrderBySlotTimeAsc(
                    CandidateStatus.PENDING, NOW.minusMinutes(30))).thenReturn(List.of());

            assertThat(sweeper.sweep(30)).isEqualTo(SweepResult.empty());
        }
    }

    @Nested
    @DisplayName("Publish retries")
    class RetryTests {

        @Test
        @DisplayName("Should retry every flagged candidate and count full deliveries")
        void shouldRetryFlaggedCandidates() {
            PostCandidate first = overdue(1L, "t1", "edu_1");
            PostCandidate second = overdue(2L, "t2", "edu_2");
            when(candidateRepository.findByStatusAndRetryPendingTrueOrderByUpdatedAtAsc(CandidateStatus.APPROVED))
                    .thenReturn(List.of(first, second));
            when(lifecycleService.retryFailed(1L)).thenReturn(new DecisionOutcome(1L, CandidateStatus.APPROVED,
                    List.of(PlatformResult.published("x", "1000"))));
            when(lifecycleService.retryFailed(2L)).thenReturn(new DecisionOutcome(2L, CandidateStatus.APPROVED,
                    List.of(PlatformResult.failed("x", "X API 503"))));

            assertThat(sweeper.retryFailedPublishes()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should keep retrying after one candidate fails")
        void shouldIsolateRetryFailures() {
            when(candidateRepository.findByStatusAndRetryPendingTrueOrderByUpdatedAtAsc(CandidateStatus.APPROVED))
                    .thenReturn(List.of(overdue(1L, "t1", "edu_1"), overdue(2L, "t1", "edu_2")));
            when(lifecycleService.retryFailed(1L)).thenThrow(new StoreException("db down", null));
            when(lifecycleService.retryFailed(2L)).thenReturn(new DecisionOutcome(2L, CandidateStatus.APPROVED,
                    List.of(PlatformResult.published("x", "1001"))));

            assertThat(sweeper.retryFailedPublishes()).isEqualTo(1);
        }
    }
}
