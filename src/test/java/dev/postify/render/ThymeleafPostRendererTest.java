package dev.postify.render;

import dev.postify.exception.TemplateRenderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThymeleafPostRendererTest {

    private ThymeleafPostRenderer renderer;
    private Map<String, Object> context;

    @BeforeEach
    void setUp() {
        renderer = new ThymeleafPostRenderer();
        context = new HashMap<>();
        context.put("name", "Acme Plumbing");
        context.put("industry", "plumbing");
        context.put("city", "Cape Town");
    }

    @Test
    @DisplayName("Should substitute placeholders")
    void shouldSubstitutePlaceholders() {
        String result = renderer.render("Tip from {{ name }} in {{city}}: fix leaks early.", context);

        assertThat(result).isEqualTo("Tip from Acme Plumbing in Cape Town: fix leaks early.");
    }

    @Test
    @DisplayName("Should accept raw Thymeleaf inlining")
    void shouldAcceptRawInlining() {
        String result = renderer.render("[(${industry})] experts", context);

        assertThat(result).isEqualTo("plumbing experts");
    }

    @Test
    @DisplayName("Should fail loudly on an undefined field")
    void shouldFailOnUndefinedField() {
        assertThatThrownBy(() -> renderer.render("Call {{ phone }} now, {{ name }}", context))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("phone");
    }

    @Test
    @DisplayName("Should treat a null value as undefined")
    void shouldFailOnNullValue() {
        context.put("tone", null);

        assertThatThrownBy(() -> renderer.render("Tone: {{ tone }}!", context))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("tone");
    }

    @Test
    @DisplayName("Should follow nested profile fields")
    void shouldCheckNestedFields() {
        Map<String, Object> profile = new HashMap<>();
        profile.put("tone", "friendly");
        profile.put("slogan", null);
        context.put("profile", profile);

        assertThat(renderer.render("Keep it {{ profile.tone }}.", context)).isEqualTo("Keep it friendly.");
        assertThatThrownBy(() -> renderer.render("{{ profile.slogan }}", context))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("profile.slogan");
        assertThatThrownBy(() -> renderer.render("{{ profile.motto }}", context))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("profile.motto");
    }

    @Test
    @DisplayName("Should fail on an empty body")
    void shouldFailOnEmptyBody() {
        assertThatThrownBy(() -> renderer.render("  ", context))
                .isInstanceOf(TemplateRenderException.class);
    }

    @Test
    @DisplayName("Should translate placeholders to inlined expressions")
    void shouldTranslatePlaceholders() {
        assertThat(ThymeleafPostRenderer.toThymeleaf("Hi {{ name }}!")).isEqualTo("Hi [(${name})]!");
    }
}
