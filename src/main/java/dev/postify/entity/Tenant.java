package dev.postify.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A business we post on behalf of. Rows are written by the ingestion side;
 * the rotation engine only reads them.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "clients")
public class Tenant {

    @Id
    @Column(length = 50)
    private String id;

    @Column(nullable = false)
    private String name;

    private String website;

    @Column(length = 100)
    private String industry;

    @Column(length = 100)
    private String city;

    @Column(name = "opted_out", nullable = false)
    private boolean optedOut;

    @Column(name = "content_consent", nullable = false)
    private boolean contentConsent;

    @Embedded
    private TenantPolicy policy;

    /**
     * Brand profile (tone, constraints, pillars, product data...). Only the
     * renderer and the rewriter look inside.
     */
    @Builder.Default
    @Convert(converter = AttributesConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> attributes = new HashMap<>();

    /**
     * When the tenant was upgraded to a featured plan; null if never.
     */
    @Column(name = "upgraded_at")
    private LocalDateTime upgradedAt;

    private LocalDateTime createdAt;

    /**
     * String view of a profile attribute, or null when absent or blank.
     */
    public String attribute(String key) {
        if (attributes == null) {
            return null;
        }
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }
}
