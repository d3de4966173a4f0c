package dev.postify.service;

import dev.postify.config.LearningProperties;
import dev.postify.entity.PostCandidate;
import dev.postify.exception.StoreException;
import dev.postify.metrics.RotationMetrics;
import dev.postify.model.CandidateStatus;
import dev.postify.model.RejectionBucket;
import dev.postify.model.RejectionReport;
import dev.postify.model.TemplateSuggestion;
import dev.postify.repository.PostCandidateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mines rejection reasons for template tuning hints. Advisory only: nothing
 * here changes templates or candidates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternLearner {

    private static final String SEPARATOR = "========================================";

    private final PostCandidateRepository candidateRepository;
    private final RejectionClassifier classifier;
    private final LearningProperties learningProperties;
    private final RotationMetrics metrics;
    private final Clock clock;

    public RejectionReport analyzeRejections() {
        return analyzeRejections(learningProperties.getWindowDays(), null);
    }

    /**
     * Bucket the reasons of candidates rejected in the last {@code windowDays}.
     *
     * @param windowDays look-back window
     * @param tenantId   restrict to one tenant, or null for all
     */
    public RejectionReport analyzeRejections(int windowDays, String tenantId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime since = now.minusDays(windowDays);

        List<PostCandidate> rejected;
        try {
            rejected = tenantId == null
                    ? candidateRepository.findByStatusAndUpdatedAtGreaterThanEqual(CandidateStatus.REJECTED, since)
                    : candidateRepository.findByTenantIdAndStatusAndUpdatedAtGreaterThanEqual(
                            tenantId, CandidateStatus.REJECTED, since);
        } catch (DataAccessException e) {
            throw new StoreException("Could not load rejected candidates", e);
        }

        Map<String, Map<RejectionBucket, Integer>> byTemplate = new TreeMap<>();
        for (PostCandidate candidate : rejected) {
            RejectionBucket bucket = classifier.classify(candidate.getRejectionReason());
            byTemplate.computeIfAbsent(candidate.getTemplateKey(), k -> new EnumMap<>(RejectionBucket.class))
                    .merge(bucket, 1, Integer::sum);
        }

        List<TemplateSuggestion> suggestions = new ArrayList<>();
        byTemplate.forEach((templateKey, buckets) -> {
            int total = buckets.values().stream().mapToInt(Integer::intValue).sum();
            if (total < learningProperties.getMinRejections()) {
                return;
            }
            RejectionBucket dominant = dominant(buckets);
            suggestions.add(new TemplateSuggestion(templateKey, total, dominant,
                    Collections.unmodifiableMap(buckets), dominant.getSuggestion()));
        });
        suggestions.sort(Comparator.comparingInt(TemplateSuggestion::rejections).reversed()
                .thenComparing(TemplateSuggestion::templateKey));

        Map<String, Map<RejectionBucket, Integer>> frozen = new LinkedHashMap<>();
        byTemplate.forEach((k, v) -> frozen.put(k, Collections.unmodifiableMap(v)));
        RejectionReport report = new RejectionReport(windowDays, tenantId, now, rejected.size(),
                Collections.unmodifiableMap(frozen), List.copyOf(suggestions));

        metrics.updateLastReport(rejected.size());
        logReport(report);
        return report;
    }

    /**
     * Highest count wins; ties go to the bucket declared first.
     */
    static RejectionBucket dominant(Map<RejectionBucket, Integer> buckets) {
        RejectionBucket best = RejectionBucket.OTHER;
        int bestCount = -1;
        for (RejectionBucket bucket : RejectionBucket.values()) {
            int count = buckets.getOrDefault(bucket, 0);
            if (count > bestCount) {
                best = bucket;
                bestCount = count;
            }
        }
        return best;
    }

    private void logReport(RejectionReport report) {
        log.info(SEPARATOR);
        log.info("Rejection analysis: {} rejection(s) in {} day(s){}", report.totalRejections(),
                report.windowDays(), report.tenantId() != null ? " for tenant " + report.tenantId() : "");
        report.bucketsByTemplate().forEach((key, buckets) -> log.info("  {} -> {}", key, buckets));
        for (TemplateSuggestion suggestion : report.suggestions()) {
            log.info("  SUGGESTION {} ({} rejections, mostly {}): {}", suggestion.templateKey(),
                    suggestion.rejections(), suggestion.dominantBucket(), suggestion.suggestion());
        }
        log.info(SEPARATOR);
    }
}
