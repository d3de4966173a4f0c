package dev.postify.repository;

import dev.postify.entity.PublishedPost;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class PublishedPostRepositoryTest {

    private static final LocalDateTime MARCH = LocalDateTime.of(2026, 3, 1, 0, 0);

    @Autowired
    private PublishedPostRepository repository;

    private PublishedPost entry(String tenantId, String platform, String hash, String templateKey,
                                LocalDateTime postedAt) {
        return PublishedPost.builder()
                .tenantId(tenantId)
                .platform(platform)
                .textHash(hash)
                .templateKey(templateKey)
                .postedAt(postedAt)
                .build();
    }

    @Test
    @DisplayName("Should reject a second entry for the same tenant, platform and text")
    void shouldEnforceUniqueness() {
        repository.saveAndFlush(entry("t1", "x", "h1", "edu_1", MARCH.plusDays(1)));

        assertThatThrownBy(() -> repository.saveAndFlush(entry("t1", "x", "h1", "edu_1", MARCH.plusDays(2))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Should allow the same text on another platform or for another tenant")
    void shouldAllowOtherPlatformOrTenant() {
        repository.saveAndFlush(entry("t1", "x", "h1", "edu_1", MARCH.plusDays(1)));
        repository.saveAndFlush(entry("t1", "console", "h1", "edu_1", MARCH.plusDays(1)));
        repository.saveAndFlush(entry("t2", "x", "h1", "edu_1", MARCH.plusDays(1)));

        assertThat(repository.existsByTenantIdAndPlatformAndTextHash("t1", "console", "h1")).isTrue();
        assertThat(repository.existsByTenantIdAndPlatformAndTextHash("t2", "console", "h1")).isFalse();
    }

    @Test
    @DisplayName("Should count a post once across platforms within the month")
    void shouldCountDistinctPostsInRange() {
        repository.saveAndFlush(entry("t1", "x", "h1", "edu_1", MARCH.plusDays(2)));
        repository.saveAndFlush(entry("t1", "console", "h1", "edu_1", MARCH.plusDays(2)));
        repository.saveAndFlush(entry("t1", "x", "h2", "edu_2", MARCH.plusDays(9)));
        repository.saveAndFlush(entry("t1", "x", "h0", "edu_3", MARCH.minusSeconds(1)));
        repository.saveAndFlush(entry("t1", "x", "h3", "soft_1", MARCH.plusMonths(1)));

        assertThat(repository.countDistinctPosts("t1", MARCH, MARCH.plusMonths(1))).isEqualTo(2);
    }

    @Test
    @DisplayName("Should find entries at or after the cooldown cutoff")
    void shouldFindEntriesAfterCutoff() {
        repository.saveAndFlush(entry("t1", "x", "h1", "edu_1", MARCH.plusDays(5)));

        assertThat(repository.existsByTenantIdAndPostedAtGreaterThanEqual("t1", MARCH.plusDays(5))).isTrue();
        assertThat(repository.existsByTenantIdAndPostedAtGreaterThanEqual("t1", MARCH.plusDays(6))).isFalse();
    }

    @Test
    @DisplayName("Should list recent entries newest first")
    void shouldListNewestFirst() {
        repository.saveAndFlush(entry("t1", "x", "h1", "edu_1", MARCH.plusDays(1)));
        repository.saveAndFlush(entry("t1", "x", "h2", "edu_2", MARCH.plusDays(3)));
        repository.saveAndFlush(entry("t2", "x", "h3", "edu_3", MARCH.plusDays(4)));

        List<PublishedPost> recent = repository.findTop20ByTenantIdOrderByPostedAtDesc("t1");

        assertThat(recent).extracting(PublishedPost::getTemplateKey).containsExactly("edu_2", "edu_1");
    }
}
