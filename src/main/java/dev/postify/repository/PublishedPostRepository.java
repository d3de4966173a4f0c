package dev.postify.repository;

import dev.postify.entity.PublishedPost;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for the published-post ledger.
 */
@Repository
public interface PublishedPostRepository extends JpaRepository<PublishedPost, Long> {

    /**
     * Check whether this exact text already went to this platform for this tenant.
     */
    boolean existsByTenantIdAndPlatformAndTextHash(String tenantId, String platform, String textHash);

    /**
     * Check for any ledger entry at or after the cutoff (cooldown).
     */
    boolean existsByTenantIdAndPostedAtGreaterThanEqual(String tenantId, LocalDateTime cutoff);

    /**
     * Count distinct posts (by content hash) in a half-open time range.
     */
    @Query("SELECT COUNT(DISTINCT p.textHash) FROM PublishedPost p "
            + "WHERE p.tenantId = :tenantId AND p.postedAt >= :start AND p.postedAt < :end")
    long countDistinctPosts(@Param("tenantId") String tenantId,
                            @Param("start") LocalDateTime start,
                            @Param("end") LocalDateTime end);

    /**
     * Most recent ledger rows for a tenant, newest first.
     */
    List<PublishedPost> findTop20ByTenantIdOrderByPostedAtDesc(String tenantId);
}
