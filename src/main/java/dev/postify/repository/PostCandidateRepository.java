package dev.postify.repository;

import dev.postify.entity.PostCandidate;
import dev.postify.model.CandidateStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for post candidates.
 * <p>
 * State changes go through the conditional updates below so that racing
 * writers (two approval clicks, a click and the sweeper) resolve by row count
 * instead of overwriting each other.
 */
@Repository
public interface PostCandidateRepository extends JpaRepository<PostCandidate, Long> {

    Optional<PostCandidate> findByChannelReference(String channelReference);

    /**
     * Pending candidates whose slot time is before the cutoff.
     */
    List<PostCandidate> findByStatusAndSlotTimeBeforeOrderBySlotTimeAsc(CandidateStatus status,
                                                                        LocalDateTime cutoff);

    boolean existsByTenantIdAndStatus(String tenantId, CandidateStatus status);

    List<PostCandidate> findByStatusAndUpdatedAtGreaterThanEqual(CandidateStatus status, LocalDateTime since);

    List<PostCandidate> findByTenantIdAndStatusAndUpdatedAtGreaterThanEqual(String tenantId,
                                                                            CandidateStatus status,
                                                                            LocalDateTime since);

    /**
     * APPROVED candidates with failed platforms waiting for another attempt.
     */
    List<PostCandidate> findByStatusAndRetryPendingTrueOrderByUpdatedAtAsc(CandidateStatus status);

    /**
     * Take the retry flag of an APPROVED candidate and count the attempt.
     *
     * @return 1 for the caller that owns this retry, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PostCandidate c SET c.retryPending = false, c.publishAttempts = c.publishAttempts + 1, "
            + "c.updatedAt = :now "
            + "WHERE c.id = :id AND c.status = dev.postify.model.CandidateStatus.APPROVED AND c.retryPending = true")
    int claimRetry(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Move a candidate from one status to another.
     *
     * @return 1 when the transition happened, 0 when the candidate was not in {@code from}
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PostCandidate c SET c.status = :to, c.updatedAt = :now "
            + "WHERE c.id = :id AND c.status = :from")
    int transition(@Param("id") Long id,
                   @Param("from") CandidateStatus from,
                   @Param("to") CandidateStatus to,
                   @Param("now") LocalDateTime now);

    /**
     * PENDING to REJECTED, keeping the reason verbatim.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PostCandidate c SET c.status = dev.postify.model.CandidateStatus.REJECTED, "
            + "c.rejectionReason = :reason, c.updatedAt = :now "
            + "WHERE c.id = :id AND c.status = dev.postify.model.CandidateStatus.PENDING")
    int reject(@Param("id") Long id,
               @Param("reason") String reason,
               @Param("now") LocalDateTime now);

    /**
     * Replace the text of a still pending candidate.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PostCandidate c SET c.textBody = :text, c.templateKey = :templateKey, c.updatedAt = :now "
            + "WHERE c.id = :id AND c.status = dev.postify.model.CandidateStatus.PENDING")
    int replaceText(@Param("id") Long id,
                    @Param("text") String text,
                    @Param("templateKey") String templateKey,
                    @Param("now") LocalDateTime now);
}
