package dev.postify.rewrite;

import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.model.RewrittenDraft;
import reactor.core.publisher.Mono;

/**
 * Produces new text for a pending candidate on REGENERATE and CUSTOMIZE.
 * Can be implemented by AI-powered or template-only implementations.
 */
public interface DraftRewriter {

    /**
     * Rewrite a candidate's text.
     *
     * @param tenant       the candidate's tenant
     * @param candidate    the pending candidate
     * @param instructions reviewer instructions; null or blank asks for a fresh variant
     * @return Mono with the replacement text
     */
    Mono<RewrittenDraft> rewrite(Tenant tenant, PostCandidate candidate, String instructions);

    /**
     * Check if the rewriter calls an AI model.
     */
    boolean isAiBacked();
}
