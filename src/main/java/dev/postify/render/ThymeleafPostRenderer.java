package dev.postify.render;

import dev.postify.exception.TemplateRenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateProcessingException;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders template bodies as Thymeleaf TEXT templates.
 * <p>
 * Bodies use {@code {{ field }}} placeholders, e.g. {@code "Tip from {{ name }} in {{ city }}"},
 * which become inlined expressions ({@code [(${name})]}) before processing. Placeholders keep
 * the bodies safe from Spring's own {@code ${...}} property resolution when they live in YAML.
 * Raw Thymeleaf inlining works as well.
 */
@Slf4j
@Component
public class ThymeleafPostRenderer implements PostRenderer {

    // variable path of every ${...} expression; #utility objects are skipped
    private static final Pattern VARIABLE =
            Pattern.compile("\\$\\{\\s*([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.+?)\\s*}}");

    private final TemplateEngine templateEngine;

    public ThymeleafPostRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        this.templateEngine = new SpringTemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    @Override
    public String render(String templateBody, Map<String, Object> context) {
        if (templateBody == null || templateBody.isBlank()) {
            throw new TemplateRenderException("Template body is empty");
        }

        String body = toThymeleaf(templateBody);
        Set<String> missing = missingVariables(body, context);
        if (!missing.isEmpty()) {
            throw new TemplateRenderException("Undefined template fields: " + String.join(", ", missing));
        }

        Context thymeleafContext = new Context(Locale.ENGLISH);
        thymeleafContext.setVariables(context);
        try {
            return templateEngine.process(body, thymeleafContext).strip();
        } catch (TemplateProcessingException e) {
            log.debug("Template failed to render: {}", e.getMessage());
            throw new TemplateRenderException("Template failed to render: " + e.getMessage(), e);
        }
    }

    static String toThymeleaf(String templateBody) {
        return PLACEHOLDER.matcher(templateBody)
                .replaceAll(m -> Matcher.quoteReplacement("[(${" + m.group(1) + "})]"));
    }

    private Set<String> missingVariables(String templateBody, Map<String, Object> context) {
        Set<String> missing = new LinkedHashSet<>();
        Matcher matcher = VARIABLE.matcher(templateBody);
        while (matcher.find()) {
            String path = matcher.group(1);
            if (!isDefined(path, context)) {
                missing.add(path);
            }
        }
        return missing;
    }

    /**
     * A path is defined when every segment resolves to a non-null value. Map
     * segments are followed; past the first non-map value the expression is
     * left to Thymeleaf.
     */
    private static boolean isDefined(String path, Map<String, Object> context) {
        Object current = context;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return true;
            }
            current = ((Map<?, ?>) current).get(segment);
            if (current == null) {
                return false;
            }
        }
        return true;
    }
}
