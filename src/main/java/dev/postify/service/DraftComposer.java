package dev.postify.service;

import dev.postify.config.RotationProperties;
import dev.postify.entity.Tenant;
import dev.postify.model.Draft;
import dev.postify.model.PostTemplate;
import dev.postify.model.TemplateCategory;
import dev.postify.publish.PublisherRegistry;
import dev.postify.render.PostRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a tenant into a rendered draft: category cycle pick, template render,
 * media and platform resolution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftComposer {

    static final String ATTR_HERO_IMAGE = "hero_image_url";
    static final String ATTR_LOGO = "logo_url";

    private final TemplateCatalog templateCatalog;
    private final CategoryCycler categoryCycler;
    private final PostRenderer postRenderer;
    private final PublisherRegistry publisherRegistry;
    private final LedgerService ledgerService;
    private final RotationProperties rotationProperties;

    /**
     * Compose the next post for a tenant using its current monthly count.
     */
    public Draft compose(Tenant tenant, LocalDateTime now) {
        return compose(tenant, ledgerService.monthlyCount(tenant.getId(), now));
    }

    /**
     * Compose the next post for a tenant.
     *
     * @throws dev.postify.exception.ConfigurationException   if the catalog is empty
     * @throws dev.postify.exception.TemplateRenderException if the template references unknown fields
     */
    public Draft compose(Tenant tenant, long monthlyPostCount) {
        PostTemplate template = categoryCycler.selectTemplate(templateCatalog.all(), tenant, monthlyPostCount);
        return render(tenant, template);
    }

    /**
     * Render another template of the same category, if the catalog has one.
     */
    public Optional<Draft> composeAlternative(Tenant tenant, TemplateCategory category, String excludeKey) {
        List<PostTemplate> alternatives = templateCatalog.byCategory(category).stream()
                .filter(t -> !t.key().equals(excludeKey))
                .sorted(Comparator.comparing(PostTemplate::key))
                .toList();
        if (alternatives.isEmpty()) {
            return Optional.empty();
        }
        List<String> recent = ledgerService.recentTemplateKeys(tenant.getId(),
                rotationProperties.getRecentTemplateWindow());
        PostTemplate template = alternatives.stream()
                .filter(t -> !recent.contains(t.key()))
                .findFirst()
                .orElse(alternatives.get(0));
        return Optional.of(render(tenant, template));
    }

    /**
     * Render the tenant's upgrade announcement, if the catalog has an
     * ANNOUNCEMENT template.
     */
    public Optional<Draft> composeAnnouncement(Tenant tenant) {
        return templateCatalog.byCategory(TemplateCategory.ANNOUNCEMENT).stream()
                .min(Comparator.comparing(PostTemplate::key))
                .map(template -> render(tenant, template));
    }

    /**
     * Render a specific template for a tenant.
     */
    public Draft render(Tenant tenant, PostTemplate template) {
        String text = postRenderer.render(template.body(), renderContext(tenant));
        List<String> platforms = publisherRegistry.resolvePlatforms(template.platforms());
        log.debug("Rendered template {} for tenant {} -> {}", template.key(), tenant.getId(), platforms);
        return new Draft(template, text, mediaUrl(tenant), platforms);
    }

    /**
     * Variables a template may reference. Profile attributes first, core fields
     * on top. Unknown core fields are left out so a template using them fails
     * to render instead of printing a blank.
     */
    public static Map<String, Object> renderContext(Tenant tenant) {
        Map<String, Object> context = new HashMap<>();
        if (tenant.getAttributes() != null) {
            context.putAll(tenant.getAttributes());
        }
        putIfPresent(context, "name", tenant.getName());
        putIfPresent(context, "industry", tenant.getIndustry());
        putIfPresent(context, "city", tenant.getCity());
        putIfPresent(context, "website", tenant.getWebsite());
        return context;
    }

    private static void putIfPresent(Map<String, Object> context, String key, String value) {
        if (value != null) {
            context.put(key, value);
        }
    }

    /**
     * Hero image, then logo, then the configured fallback image. May be null.
     */
    public String mediaUrl(Tenant tenant) {
        String hero = tenant.attribute(ATTR_HERO_IMAGE);
        if (hero != null) {
            return hero;
        }
        String logo = tenant.attribute(ATTR_LOGO);
        if (logo != null) {
            return logo;
        }
        String fallback = rotationProperties.getFallbackImageUrl();
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }
}
