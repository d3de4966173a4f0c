package dev.postify.metrics;

import dev.postify.model.SweepResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for rotation, approval and publishing.
 */
@Component
public class RotationMetrics {

    private static final String TAG_PLATFORM = "platform";
    private static final String TAG_DECISION = "decision";
    private final MeterRegistry registry;

    // Counters
    private final Counter slotsDispatchedCounter;
    private final Counter slotsSkippedCounter;
    private final Counter candidatesCreatedCounter;
    private final Counter staleDecisionsCounter;
    private final Counter channelFailuresCounter;
    private final Counter timeoutsCounter;

    // Timers (per platform)
    private final ConcurrentHashMap<String, Timer> publishTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastSweepExamined = new AtomicInteger(0);
    private final AtomicInteger lastSweepResolved = new AtomicInteger(0);
    private final AtomicInteger lastReportRejections = new AtomicInteger(0);

    public RotationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.slotsDispatchedCounter = Counter.builder("rotation_slots_dispatched_total")
                .description("Slots that produced a candidate")
                .register(registry);

        this.slotsSkippedCounter = Counter.builder("rotation_slots_skipped_total")
                .description("Slots with no eligible tenant or no renderable template")
                .register(registry);

        this.candidatesCreatedCounter = Counter.builder("rotation_candidates_created_total")
                .description("Post candidates created")
                .register(registry);

        this.staleDecisionsCounter = Counter.builder("rotation_stale_decisions_total")
                .description("Decisions that arrived for an already resolved candidate")
                .register(registry);

        this.channelFailuresCounter = Counter.builder("rotation_approval_channel_failures_total")
                .description("Approval channel notifications that failed")
                .register(registry);

        this.timeoutsCounter = Counter.builder("rotation_candidates_timed_out_total")
                .description("Candidates resolved by the timeout sweeper")
                .register(registry);

        Gauge.builder("rotation_last_sweep_examined", lastSweepExamined, AtomicInteger::get)
                .description("Candidates examined in the last sweep")
                .register(registry);

        Gauge.builder("rotation_last_sweep_resolved", lastSweepResolved, AtomicInteger::get)
                .description("Candidates resolved in the last sweep")
                .register(registry);

        Gauge.builder("rotation_last_report_rejections", lastReportRejections, AtomicInteger::get)
                .description("Rejections analysed in the last learning run")
                .register(registry);
    }

    /**
     * Get or create a publish timer for a platform.
     */
    public Timer getPublishTimer(String platform) {
        return publishTimers.computeIfAbsent(platform, name ->
                Timer.builder("rotation_publish_duration")
                        .description("Time to publish a post to a platform")
                        .tag(TAG_PLATFORM, name)
                        .register(registry)
        );
    }

    public void recordSlotDispatched() {
        slotsDispatchedCounter.increment();
    }

    public void recordSlotSkipped() {
        slotsSkippedCounter.increment();
    }

    public void recordCandidateCreated() {
        candidatesCreatedCounter.increment();
    }

    /**
     * Record a decision applied to a candidate.
     */
    public void recordDecision(String decision) {
        Counter.builder("rotation_decisions_total")
                .tag(TAG_DECISION, decision)
                .register(registry)
                .increment();
    }

    public void recordStaleDecision() {
        staleDecisionsCounter.increment();
    }

    public void recordChannelFailure() {
        channelFailuresCounter.increment();
    }

    /**
     * Record a successful publish to a platform.
     */
    public void recordPublished(String platform) {
        Counter.builder("rotation_posts_published_total")
                .tag(TAG_PLATFORM, platform)
                .register(registry)
                .increment();
    }

    /**
     * Record a failed publish to a platform.
     */
    public void recordPublishFailure(String platform) {
        Counter.builder("rotation_publish_failures_total")
                .tag(TAG_PLATFORM, platform)
                .register(registry)
                .increment();
    }

    public void recordPublishLatency(String platform, long latencyMs) {
        getPublishTimer(platform).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Update last sweep statistics.
     */
    public void updateLastSweep(SweepResult result) {
        int resolved = result.autoPosted() + result.cancelled() + result.fallbacks();
        timeoutsCounter.increment(resolved);
        lastSweepExamined.set(result.examined());
        lastSweepResolved.set(resolved);
    }

    public void updateLastReport(int rejections) {
        lastReportRejections.set(rejections);
    }
}
