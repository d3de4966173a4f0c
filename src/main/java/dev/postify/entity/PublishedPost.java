package dev.postify.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ledger entry for one post delivered to one platform. Append-only.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "published_posts",
        uniqueConstraints = @UniqueConstraint(name = "uk_pp_tenant_platform_hash",
                columnNames = {"tenant_id", "platform", "text_hash"}),
        indexes = @Index(name = "idx_pp_tenant_posted", columnList = "tenant_id, posted_at"))
public class PublishedPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 50)
    private String tenantId;

    @Column(nullable = false, length = 50)
    private String platform;

    @Column(name = "template_key", length = 100)
    private String templateKey;

    @Column(name = "text_hash", nullable = false, length = 64)
    private String textHash;

    @Column(name = "external_id")
    private String externalId;

    @Column(name = "posted_at", nullable = false)
    private LocalDateTime postedAt;
}
