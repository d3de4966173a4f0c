package dev.postify.model;

/**
 * Coarse taxonomy for free-text rejection reasons.
 */
public enum RejectionBucket {
    TOO_SALESY("Add a tone constraint: fewer direct offers, lead with value before the call to action."),
    WRONG_TONE("Review the tenant tone setting and align the template wording with it."),
    OFF_TOPIC("Tie the template closer to the tenant's content pillars or industry."),
    TOO_LONG("Shorten the template body or cap the rendered length."),
    TOO_SHORT("Add a concrete detail (benefit, stat or tip) to the template."),
    REPETITIVE("Add template variants for this category or widen the recent-template window."),
    UNSPECIFIED("Ask reviewers to give a reason when rejecting this template."),
    OTHER("Read the raw rejection reasons for this template; they did not match a known pattern.");

    private final String suggestion;

    RejectionBucket(String suggestion) {
        this.suggestion = suggestion;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
