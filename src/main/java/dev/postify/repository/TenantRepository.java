package dev.postify.repository;

import dev.postify.entity.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read access to tenants. Writes belong to the ingestion side.
 */
@Repository
public interface TenantRepository extends JpaRepository<Tenant, String> {

    List<Tenant> findByOptedOutFalseAndContentConsentTrue();

    /**
     * Postable tenants upgraded after the given time, oldest upgrade first.
     */
    List<Tenant> findByOptedOutFalseAndContentConsentTrueAndUpgradedAtAfterOrderByUpgradedAtAsc(LocalDateTime after);
}
