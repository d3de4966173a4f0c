package dev.postify.entity;

import dev.postify.model.CandidateStatus;
import dev.postify.model.TemplateCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Draft awaiting a publish decision. Never deleted; REJECTED rows feed the
 * pattern learner.
 */
@Data
@Entity
@DynamicUpdate
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "post_candidates", indexes = {
        @Index(name = "idx_pc_status_slot", columnList = "status, slot_time"),
        @Index(name = "idx_pc_tenant_status", columnList = "tenant_id, status"),
        @Index(name = "idx_pc_channel_ref", columnList = "channel_reference")
})
public class PostCandidate {

    public static final String META_CHANNEL_REF = "channel_ref";
    public static final String META_PUBLISH_PREFIX = "publish.";
    public static final String META_SOURCE = "source";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 50)
    private String tenantId;

    @Column(name = "template_key", nullable = false, length = 100)
    private String templateKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TemplateCategory category;

    @Column(name = "text_body", nullable = false, columnDefinition = "TEXT")
    private String textBody;

    @Column(name = "media_url", length = 2048)
    private String mediaUrl;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 500)
    private List<String> platforms = new ArrayList<>();

    @Column(name = "slot_time", nullable = false)
    private LocalDateTime slotTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CandidateStatus status;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "channel_reference", length = 100)
    private String channelReference;

    @ColumnDefault("0")
    @Column(name = "publish_attempts", nullable = false)
    private int publishAttempts;

    @ColumnDefault("false")
    @Column(name = "retry_pending", nullable = false)
    private boolean retryPending;

    @Builder.Default
    @Convert(converter = StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
