package dev.postify.config;

import dev.postify.model.TemplateCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Post templates.
 * Loaded from templates.yml under 'catalog' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogConfig {

    private List<TemplateDefinition> templates = new ArrayList<>();

    @Data
    public static class TemplateDefinition {
        private String key;
        private TemplateCategory category;
        private List<String> platforms = new ArrayList<>();
        private String body;
    }
}
