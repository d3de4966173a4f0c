package dev.postify.service;

import dev.postify.entity.PublishedPost;
import dev.postify.exception.StoreException;
import dev.postify.repository.PublishedPostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Africa/Johannesburg");

    @Mock
    private PublishedPostRepository repository;

    @Captor
    private ArgumentCaptor<PublishedPost> postCaptor;

    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T07:00:00Z"), ZONE);
        ledgerService = new LedgerService(repository, clock);
    }

    @Nested
    @DisplayName("Content hashing")
    class HashTests {

        @Test
        @DisplayName("Should produce a 64 character hex SHA-256")
        void shouldProduceHexSha256() {
            String hash = LedgerService.textHash("hello");

            assertThat(hash)
                    .hasSize(64)
                    .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
        }

        @Test
        @DisplayName("Should differ for different text")
        void shouldDifferForDifferentText() {
            assertThat(LedgerService.textHash("a")).isNotEqualTo(LedgerService.textHash("b"));
        }
    }

    @Nested
    @DisplayName("Recording")
    class RecordTests {

        @Test
        @DisplayName("Should save a new ledger entry")
        void shouldSaveNewEntry() {
            when(repository.existsByTenantIdAndPlatformAndTextHash(anyString(), anyString(), anyString()))
                    .thenReturn(false);

            boolean recorded = ledgerService.record("t1", "x", "edu_1", "Hello", "123");

            assertThat(recorded).isTrue();
            verify(repository).saveAndFlush(postCaptor.capture());
            PublishedPost saved = postCaptor.getValue();
            assertThat(saved)
                    .extracting(PublishedPost::getTenantId, PublishedPost::getPlatform,
                            PublishedPost::getTemplateKey, PublishedPost::getExternalId)
                    .containsExactly("t1", "x", "edu_1", "123");
            assertThat(saved.getTextHash()).isEqualTo(LedgerService.textHash("Hello"));
            assertThat(saved.getPostedAt()).isEqualTo(LocalDateTime.of(2026, 3, 10, 9, 0));
        }

        @Test
        @DisplayName("Should not record the same text twice")
        void shouldNotRecordTwice() {
            when(repository.existsByTenantIdAndPlatformAndTextHash("t1", "x", LedgerService.textHash("Hello")))
                    .thenReturn(true);

            boolean recorded = ledgerService.record("t1", "x", "edu_1", "Hello", null);

            assertThat(recorded).isFalse();
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should treat a uniqueness violation as already recorded")
        void shouldTreatUniqueViolationAsAlreadyRecorded() {
            when(repository.existsByTenantIdAndPlatformAndTextHash(anyString(), anyString(), anyString()))
                    .thenReturn(false);
            when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("uk_pp"));

            assertThat(ledgerService.record("t1", "x", "edu_1", "Hello", null)).isFalse();
        }

        @Test
        @DisplayName("Should wrap other store failures")
        void shouldWrapStoreFailures() {
            when(repository.existsByTenantIdAndPlatformAndTextHash(anyString(), anyString(), anyString()))
                    .thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> ledgerService.record("t1", "x", "edu_1", "Hello", null))
                    .isInstanceOf(StoreException.class)
                    .hasMessageContaining("t1");
        }
    }

    @Nested
    @DisplayName("Cooldown and monthly count")
    class CountTests {

        private final LocalDateTime now = LocalDateTime.of(2026, 3, 10, 9, 0);

        @Test
        @DisplayName("Should look back cooldown days from now")
        void shouldLookBackCooldownDays() {
            when(repository.existsByTenantIdAndPostedAtGreaterThanEqual("t1", now.minusDays(14))).thenReturn(true);

            assertThat(ledgerService.isInCooldown("t1", 14, now)).isTrue();
        }

        @Test
        @DisplayName("Should never be in cooldown with zero days")
        void shouldIgnoreZeroCooldown() {
            assertThat(ledgerService.isInCooldown("t1", 0, now)).isFalse();
            verify(repository, never()).existsByTenantIdAndPostedAtGreaterThanEqual(anyString(), any());
        }

        @Test
        @DisplayName("Should count within the calendar month")
        void shouldCountWithinCalendarMonth() {
            when(repository.countDistinctPosts("t1", LocalDateTime.of(2026, 3, 1, 0, 0),
                    LocalDateTime.of(2026, 4, 1, 0, 0))).thenReturn(2L);

            assertThat(ledgerService.monthlyCount("t1", now)).isEqualTo(2);
        }

        @Test
        @DisplayName("Should compute month bounds across year end")
        void shouldComputeMonthBoundsAcrossYearEnd() {
            LocalDateTime lateDecember = LocalDateTime.of(2025, 12, 31, 23, 59);

            assertThat(LedgerService.monthStart(lateDecember)).isEqualTo(LocalDateTime.of(2025, 12, 1, 0, 0));
            assertThat(LedgerService.monthEnd(lateDecember)).isEqualTo(LocalDateTime.of(2026, 1, 1, 0, 0));
        }
    }

    @Nested
    @DisplayName("Recent templates")
    class RecentTemplateTests {

        private PublishedPost post(String platform, String template, String text, int dayOfMonth) {
            return PublishedPost.builder()
                    .tenantId("t1")
                    .platform(platform)
                    .templateKey(template)
                    .textHash(LedgerService.textHash(text))
                    .postedAt(LocalDateTime.of(2026, 3, dayOfMonth, 9, 0))
                    .build();
        }

        @Test
        @DisplayName("Should count a multi-platform post once")
        void shouldCountMultiPlatformPostOnce() {
            when(repository.findTop20ByTenantIdOrderByPostedAtDesc("t1")).thenReturn(List.of(
                    post("x", "edu_3", "three", 9),
                    post("console", "edu_3", "three", 9),
                    post("x", "edu_2", "two", 8),
                    post("x", "edu_1", "one", 7)));

            assertThat(ledgerService.recentTemplateKeys("t1", 2)).containsExactly("edu_3", "edu_2");
        }

        @Test
        @DisplayName("Should return nothing for a zero window")
        void shouldReturnNothingForZeroWindow() {
            assertThat(ledgerService.recentTemplateKeys("t1", 0)).isEmpty();
        }
    }
}
