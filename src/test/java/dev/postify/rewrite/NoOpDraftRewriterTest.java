package dev.postify.rewrite;

import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.model.Draft;
import dev.postify.model.PostTemplate;
import dev.postify.model.TemplateCategory;
import dev.postify.service.DraftComposer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NoOpDraftRewriterTest {

    @Mock
    private DraftComposer draftComposer;

    private NoOpDraftRewriter rewriter;
    private Tenant tenant;
    private PostCandidate candidate;

    @BeforeEach
    void setUp() {
        rewriter = new NoOpDraftRewriter(draftComposer);
        tenant = Tenant.builder().id("t1").name("Acme").build();
        candidate = PostCandidate.builder()
                .id(1L)
                .tenantId("t1")
                .templateKey("edu_1")
                .category(TemplateCategory.EDUCATIONAL)
                .textBody("Original text")
                .build();
    }

    @Test
    @DisplayName("Should render another template of the same category on regenerate")
    void shouldRenderAlternativeOnRegenerate() {
        PostTemplate other = new PostTemplate("edu_2", TemplateCategory.EDUCATIONAL, List.of("x"), "b");
        when(draftComposer.composeAlternative(tenant, TemplateCategory.EDUCATIONAL, "edu_1"))
                .thenReturn(Optional.of(new Draft(other, "Alternative text", null, List.of("console"))));

        StepVerifier.create(rewriter.rewrite(tenant, candidate, null))
                .assertNext(result -> {
                    assertThat(result.text()).isEqualTo("Alternative text");
                    assertThat(result.templateKey()).isEqualTo("edu_2");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should keep the text when there is no alternative")
    void shouldKeepTextWithoutAlternative() {
        when(draftComposer.composeAlternative(tenant, TemplateCategory.EDUCATIONAL, "edu_1"))
                .thenReturn(Optional.empty());

        StepVerifier.create(rewriter.rewrite(tenant, candidate, null))
                .assertNext(result -> assertThat(result.text()).isEqualTo("Original text"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should use the instructions as the new text on customize")
    void shouldUseInstructionsOnCustomize() {
        StepVerifier.create(rewriter.rewrite(tenant, candidate, "  Winter special: 10% off geysers  "))
                .assertNext(result -> {
                    assertThat(result.text()).isEqualTo("Winter special: 10% off geysers");
                    assertThat(result.templateKey()).isEqualTo("edu_1");
                })
                .verifyComplete();
        verify(draftComposer, never()).composeAlternative(any(), any(), any());
    }

    @Test
    @DisplayName("Should not be AI backed")
    void shouldNotBeAiBacked() {
        assertThat(rewriter.isAiBacked()).isFalse();
    }
}
