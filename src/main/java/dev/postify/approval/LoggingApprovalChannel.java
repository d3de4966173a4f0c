package dev.postify.approval;

import dev.postify.model.CandidateSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Approval channel that only logs previews. Candidates are then resolved by
 * the timeout sweeper according to the tenant's timeout policy.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "approval.channel", havingValue = "log", matchIfMissing = true)
public class LoggingApprovalChannel implements ApprovalChannel {

    private static final String SEPARATOR = "----------------------------------------";

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public String notify(CandidateSummary summary) {
        log.info(SEPARATOR);
        log.info("Approval requested for candidate {} - {} ({}, {})",
                summary.candidateId(), summary.tenantName(), summary.industry(), summary.city());
        log.info("Template: {} [{}] -> {}", summary.templateKey(), summary.category(), summary.platforms());
        log.info("{}", summary.text());
        log.info(SEPARATOR);
        return "log:" + summary.candidateId();
    }

    @Override
    public void refresh(String reference, CandidateSummary summary) {
        log.info("Candidate {} updated ({}): {}", summary.candidateId(), reference, summary.text());
    }
}
