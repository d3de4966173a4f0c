package dev.postify.rewrite;

import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.model.RewrittenDraft;
import dev.postify.service.DraftComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Template-only rewriter used when no AI provider is configured.
 * Regenerate renders another template of the same category; customize takes
 * the reviewer's instructions as the new text.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpDraftRewriter implements DraftRewriter {

    private final DraftComposer draftComposer;

    public NoOpDraftRewriter(DraftComposer draftComposer) {
        this.draftComposer = draftComposer;
        log.info("AI rewrite disabled - using template-only rewriter");
    }

    @Override
    public Mono<RewrittenDraft> rewrite(Tenant tenant, PostCandidate candidate, String instructions) {
        if (instructions != null && !instructions.isBlank()) {
            return Mono.just(new RewrittenDraft(instructions.strip(), candidate.getTemplateKey()));
        }
        return Mono.fromCallable(() -> draftComposer
                .composeAlternative(tenant, candidate.getCategory(), candidate.getTemplateKey())
                .map(draft -> new RewrittenDraft(draft.text(), draft.template().key()))
                .orElseGet(() -> {
                    log.info("No alternative template for candidate {} - keeping its text", candidate.getId());
                    return new RewrittenDraft(candidate.getTextBody(), candidate.getTemplateKey());
                }));
    }

    @Override
    public boolean isAiBacked() {
        return false;
    }
}
