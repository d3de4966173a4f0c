package dev.postify.approval;

import dev.postify.model.CandidateStatus;
import dev.postify.model.CandidateSummary;

/**
 * Outbound side of the approval gate: shows a pending candidate to a human.
 * Decisions come back asynchronously through {@link ApprovalCallbackHandler}.
 */
public interface ApprovalChannel {

    String getName();

    /**
     * Present a candidate for review.
     *
     * @return channel reference used to correlate the reply with the candidate
     * @throws dev.postify.exception.ApprovalChannelException if the channel cannot be reached
     */
    String notify(CandidateSummary summary);

    /**
     * Re-render the preview after the candidate's text changed.
     */
    default void refresh(String reference, CandidateSummary summary) {
    }

    /**
     * Show that the candidate left PENDING.
     */
    default void resolved(String reference, CandidateStatus status) {
    }
}
