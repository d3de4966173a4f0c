package dev.postify.service;

import dev.postify.entity.PublishedPost;
import dev.postify.exception.StoreException;
import dev.postify.repository.PublishedPostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for the published-post ledger: cooldowns, monthly counts and
 * content de-duplication.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final PublishedPostRepository publishedPostRepository;
    private final Clock clock;

    /**
     * SHA-256 of the rendered text, hex encoded.
     */
    public static String textHash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * First instant of the calendar month containing {@code when}.
     */
    public static LocalDateTime monthStart(LocalDateTime when) {
        return when.toLocalDate().withDayOfMonth(1).atStartOfDay();
    }

    /**
     * First instant of the following month (exclusive bound).
     */
    public static LocalDateTime monthEnd(LocalDateTime when) {
        return monthStart(when).plusMonths(1);
    }

    /**
     * Check if this exact text was already delivered to the platform for the tenant.
     */
    public boolean isPublished(String tenantId, String platform, String textHash) {
        try {
            return publishedPostRepository.existsByTenantIdAndPlatformAndTextHash(tenantId, platform, textHash);
        } catch (DataAccessException e) {
            throw new StoreException("Ledger lookup failed for tenant " + tenantId, e);
        }
    }

    /**
     * Record a delivered post.
     *
     * @return true if a new entry was written, false if the same
     *         (tenant, platform, text) was already recorded
     */
    public boolean record(String tenantId, String platform, String templateKey, String text, String externalId) {
        String hash = textHash(text);
        if (isPublished(tenantId, platform, hash)) {
            log.info("Ledger already has {} / {} / {} - not recording twice", tenantId, platform, shortHash(hash));
            return false;
        }

        PublishedPost entry = PublishedPost.builder()
                .tenantId(tenantId)
                .platform(platform)
                .templateKey(templateKey)
                .textHash(hash)
                .externalId(externalId)
                .postedAt(LocalDateTime.now(clock))
                .build();

        try {
            publishedPostRepository.saveAndFlush(entry);
            log.info("Recorded post for {} on {} (template: {}, hash: {})",
                    tenantId, platform, templateKey, shortHash(hash));
            return true;
        } catch (DataIntegrityViolationException e) {
            // a concurrent writer got there first
            log.info("Ledger entry {} / {} / {} recorded concurrently", tenantId, platform, shortHash(hash));
            return false;
        } catch (DataAccessException e) {
            throw new StoreException("Ledger write failed for tenant " + tenantId, e);
        }
    }

    /**
     * Check if the tenant has any ledger entry within the last {@code cooldownDays}.
     */
    public boolean isInCooldown(String tenantId, int cooldownDays, LocalDateTime now) {
        if (cooldownDays <= 0) {
            return false;
        }
        try {
            return publishedPostRepository.existsByTenantIdAndPostedAtGreaterThanEqual(
                    tenantId, now.minusDays(cooldownDays));
        } catch (DataAccessException e) {
            throw new StoreException("Cooldown lookup failed for tenant " + tenantId, e);
        }
    }

    /**
     * Number of distinct posts delivered in the calendar month containing {@code now}.
     * A post sent to several platforms counts once.
     */
    public long monthlyCount(String tenantId, LocalDateTime now) {
        try {
            return publishedPostRepository.countDistinctPosts(tenantId, monthStart(now), monthEnd(now));
        } catch (DataAccessException e) {
            throw new StoreException("Monthly count failed for tenant " + tenantId, e);
        }
    }

    /**
     * Template keys of the tenant's most recent posts, newest first, at most {@code limit}.
     */
    public List<String> recentTemplateKeys(String tenantId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            Set<String> keys = new LinkedHashSet<>();
            Set<String> posts = new LinkedHashSet<>();
            for (PublishedPost post : publishedPostRepository.findTop20ByTenantIdOrderByPostedAtDesc(tenantId)) {
                if (posts.size() >= limit && !posts.contains(post.getTextHash())) {
                    break;
                }
                posts.add(post.getTextHash());
                if (post.getTemplateKey() != null) {
                    keys.add(post.getTemplateKey());
                }
            }
            return List.copyOf(keys);
        } catch (DataAccessException e) {
            throw new StoreException("Recent template lookup failed for tenant " + tenantId, e);
        }
    }

    /**
     * Get total count of all ledger rows.
     */
    public long getTotalPublished() {
        return publishedPostRepository.count();
    }

    private String shortHash(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
