package dev.postify.scheduler;

import dev.postify.approval.TelegramUpdatePoller;
import dev.postify.config.LearningProperties;
import dev.postify.config.RotationProperties;
import dev.postify.exception.ConfigurationException;
import dev.postify.service.PatternLearner;
import dev.postify.service.RotationService;
import dev.postify.service.TimeoutSweeper;
import dev.postify.service.UpgradeAnnouncer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Registers the recurring jobs: one cron trigger per daily slot, the timeout
 * sweep, the upgrade watch, the daily learning run and, with the Telegram
 * channel, update polling. A slot trigger only plans its posts; each post is
 * dispatched after a random jitter, later posts staggered further.
 * No job lets anything but a {@link ConfigurationException} escape.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "rotation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class RotationScheduler {

    private final ThreadPoolTaskScheduler taskScheduler;
    private final RotationService rotationService;
    private final TimeoutSweeper timeoutSweeper;
    private final PatternLearner patternLearner;
    private final UpgradeAnnouncer upgradeAnnouncer;
    private final RotationProperties rotationProperties;
    private final LearningProperties learningProperties;
    private final ObjectProvider<TelegramUpdatePoller> pollerProvider;
    private final Clock clock;

    private final List<String> slotCrons;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    public RotationScheduler(
            @Qualifier("rotationScheduler") ThreadPoolTaskScheduler taskScheduler,
            RotationService rotationService,
            TimeoutSweeper timeoutSweeper,
            PatternLearner patternLearner,
            UpgradeAnnouncer upgradeAnnouncer,
            RotationProperties rotationProperties,
            LearningProperties learningProperties,
            ObjectProvider<TelegramUpdatePoller> pollerProvider,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.rotationService = rotationService;
        this.timeoutSweeper = timeoutSweeper;
        this.patternLearner = patternLearner;
        this.upgradeAnnouncer = upgradeAnnouncer;
        this.rotationProperties = rotationProperties;
        this.learningProperties = learningProperties;
        this.pollerProvider = pollerProvider;
        this.clock = clock;

        this.slotCrons = rotationProperties.getSlots().stream()
                .map(RotationScheduler::cronForSlot)
                .toList();
        if (!CronExpression.isValidExpression(learningProperties.getCron())) {
            throw new ConfigurationException("Invalid learning.cron: " + learningProperties.getCron());
        }
    }

    /**
     * Spring cron expression firing daily at an {@code HH:mm} slot.
     *
     * @throws ConfigurationException if the slot is not a valid time
     */
    public static String cronForSlot(String slot) {
        try {
            LocalTime time = LocalTime.parse(slot.strip());
            return String.format("0 %d %d * * *", time.getMinute(), time.getHour());
        } catch (DateTimeParseException | NullPointerException e) {
            throw new ConfigurationException("Invalid rotation slot '" + slot + "', expected HH:mm");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!futures.isEmpty()) {
            return;
        }
        for (String cron : slotCrons) {
            futures.add(taskScheduler.schedule(this::runSlot, new CronTrigger(cron, clock.getZone())));
        }
        futures.add(taskScheduler.scheduleWithFixedDelay(this::runSweep, rotationProperties.getSweepInterval()));
        futures.add(taskScheduler.scheduleWithFixedDelay(this::runUpgradeWatch,
                rotationProperties.getUpgradeWatchInterval()));
        futures.add(taskScheduler.schedule(this::runLearning,
                new CronTrigger(learningProperties.getCron(), clock.getZone())));
        pollerProvider.ifAvailable(poller -> futures.add(taskScheduler.scheduleWithFixedDelay(
                () -> runPoll(poller), poller.getPollInterval())));

        log.info("Rotation scheduled: slots {} ({}), jitter {}m, stagger {}m, sweep every {}, upgrades every {}, "
                        + "learning '{}', zone {}",
                rotationProperties.getSlots(), slotCrons, rotationProperties.getJitterMinutes(),
                rotationProperties.getStaggerMinutes(), rotationProperties.getSweepInterval(),
                rotationProperties.getUpgradeWatchInterval(), learningProperties.getCron(), clock.getZone());
    }

    @PreDestroy
    public synchronized void stop() {
        futures.forEach(f -> f.cancel(false));
        futures.clear();
    }

    /**
     * Plan the posts of a slot: post {@code i} runs after a random
     * {@code 0..jitter} minutes plus {@code i * stagger}.
     */
    void runSlot() {
        int posts = Math.max(1, rotationProperties.getPostsPerSlot());
        int jitter = Math.max(0, rotationProperties.getJitterMinutes());
        int stagger = Math.max(0, rotationProperties.getStaggerMinutes());
        Instant now = clock.instant();
        for (int i = 0; i < posts; i++) {
            long delay = ThreadLocalRandom.current().nextInt(jitter + 1) + (long) i * stagger;
            Instant at = now.plus(Duration.ofMinutes(delay));
            taskScheduler.schedule(this::runDispatch, at);
            log.debug("Slot post {}/{} planned for {}", i + 1, posts, at);
        }
    }

    void runDispatch() {
        try {
            rotationService.dispatchSlot(LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES), 1);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Slot dispatch failed: {}", e.getMessage(), e);
        }
    }

    void runSweep() {
        try {
            timeoutSweeper.sweep();
            timeoutSweeper.retryFailedPublishes();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Timeout sweep failed: {}", e.getMessage(), e);
        }
    }

    void runUpgradeWatch() {
        try {
            upgradeAnnouncer.announceUpgrades();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Upgrade watch failed: {}", e.getMessage(), e);
        }
    }

    void runLearning() {
        try {
            patternLearner.analyzeRejections();
        } catch (RuntimeException e) {
            log.error("Rejection analysis failed: {}", e.getMessage(), e);
        }
    }

    void runPoll(TelegramUpdatePoller poller) {
        try {
            poller.pollOnce();
        } catch (RuntimeException e) {
            log.error("Approval polling failed: {}", e.getMessage(), e);
        }
    }
}
