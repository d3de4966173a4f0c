package dev.postify.service;

import dev.postify.config.CatalogConfig;
import dev.postify.config.CatalogConfig.TemplateDefinition;
import dev.postify.exception.ConfigurationException;
import dev.postify.model.PostTemplate;
import dev.postify.model.TemplateCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the configured post templates. A scheduling cycle
 * always works on one snapshot; {@link #refresh()} swaps it.
 */
@Slf4j
@Service
public class TemplateCatalog {

    private final CatalogConfig catalogConfig;
    private volatile List<PostTemplate> templates = List.of();

    public TemplateCatalog(CatalogConfig catalogConfig) {
        this.catalogConfig = catalogConfig;
        refresh();
    }

    /**
     * Rebuild the snapshot from configuration.
     *
     * @return the new snapshot
     * @throws ConfigurationException if a definition is malformed or a key is duplicated
     */
    public synchronized List<PostTemplate> refresh() {
        Set<String> keys = new HashSet<>();
        List<PostTemplate> loaded = catalogConfig.getTemplates().stream()
                .map(this::toTemplate)
                .peek(t -> {
                    if (!keys.add(t.key())) {
                        throw new ConfigurationException("Duplicate template key: " + t.key());
                    }
                })
                .toList();
        this.templates = loaded;

        Map<TemplateCategory, Long> counts = loaded.stream()
                .collect(Collectors.groupingBy(PostTemplate::category,
                        () -> new EnumMap<>(TemplateCategory.class), Collectors.counting()));
        log.info("Template catalog loaded: {} templates {}", loaded.size(), counts);
        for (TemplateCategory category : TemplateCategory.values()) {
            if (category.isRotation() && !counts.containsKey(category)) {
                log.warn("No templates in category {} - the cycler will fall back to the full catalog", category);
            }
        }
        return loaded;
    }

    public List<PostTemplate> all() {
        return templates;
    }

    public List<PostTemplate> byCategory(TemplateCategory category) {
        return templates.stream()
                .filter(t -> t.category() == category)
                .toList();
    }

    public Optional<PostTemplate> find(String key) {
        return templates.stream()
                .filter(t -> t.key().equals(key))
                .findFirst();
    }

    public boolean isEmpty() {
        return templates.isEmpty();
    }

    /**
     * @throws ConfigurationException when there is nothing to post from
     */
    public void requireNonEmpty() {
        if (templates.stream().noneMatch(t -> t.category().isRotation())) {
            throw new ConfigurationException("Template catalog is empty - configure catalog.templates");
        }
    }

    private PostTemplate toTemplate(TemplateDefinition definition) {
        if (definition.getKey() == null || definition.getKey().isBlank()) {
            throw new ConfigurationException("Template without key in catalog");
        }
        if (definition.getCategory() == null) {
            throw new ConfigurationException("Template " + definition.getKey() + " has no category");
        }
        if (definition.getBody() == null || definition.getBody().isBlank()) {
            throw new ConfigurationException("Template " + definition.getKey() + " has an empty body");
        }
        return new PostTemplate(definition.getKey().trim(), definition.getCategory(),
                definition.getPlatforms(), definition.getBody());
    }
}
